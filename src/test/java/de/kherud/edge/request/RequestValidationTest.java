package de.kherud.edge.request;

import de.kherud.edge.validation.ValidationException;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class RequestValidationTest {

	private static String invalidParameter(GenerationRequest<?> request) {
		try {
			request.validate();
		}
		catch (ValidationException e) {
			return e.getParameter();
		}
		fail("Expected validation to fail");
		return null;
	}

	@Test
	public void testTextRequest() {
		TextRequest.builder("hi").maxTokens(TextRequest.UNLIMITED_TOKENS).build().validate();
		TextRequest.builder("hi").maxTokens(32768).temperature(0.0f).build().validate();

		assertEquals("prompt", invalidParameter(TextRequest.of("")));
		assertEquals("maxTokens", invalidParameter(TextRequest.builder("hi").maxTokens(0).build()));
		assertEquals("maxTokens", invalidParameter(TextRequest.builder("hi").maxTokens(32769).build()));
		assertEquals("temperature", invalidParameter(TextRequest.builder("hi").temperature(2.5f).build()));
	}

	@Test
	public void testImageStrengthWithInitImage() {
		byte[] init = new byte[256 * 256 * 3];
		ImageRequest.builder("a house").size(256, 256).initImage(init, 0.6f).build().validate();
		ImageRequest.builder("a house").size(256, 256).initImage(null, 0.0f).build().validate();

		assertEquals("strength", invalidParameter(ImageRequest.builder("a house").initImage(init, 0.0f).build()));
		assertEquals("strength", invalidParameter(ImageRequest.builder("a house").initImage(init, 1.5f).build()));
	}

	@Test
	public void testTranscriptionRequest() {
		new TranscriptionRequest(new float[16000]).validate();

		assertEquals("samples", invalidParameter(new TranscriptionRequest(new float[0])));
		assertEquals("sampleRate", invalidParameter(new TranscriptionRequest(new float[100], 44100, null, false)));
		assertEquals(1000, new TranscriptionRequest(new float[16000]).getDurationMillis());
	}

	@Test
	public void testEmbeddingRequest() {
		new EmbeddingRequest("query").validate();
		assertEquals("input", invalidParameter(new EmbeddingRequest(" ")));
	}

	@Test
	public void testProducedUnits() {
		assertEquals(7, TextRequest.of("hi").producedUnits(new TextResult("x", 7)));
		assertEquals(1, new EmbeddingRequest("q").producedUnits(new float[]{1f}));
		TranscriptionResult transcript = new TranscriptionResult(List.of(
			new TranscriptionResult.Segment(0, 500, " hello"),
			new TranscriptionResult.Segment(500, 900, "world ")));
		assertEquals(2, new TranscriptionRequest(new float[1]).producedUnits(transcript));
		assertEquals("hello world", transcript.text());
	}
}
