package de.kherud.edge.request;

import de.kherud.edge.validation.ValidationException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class VideoRequestTest {

	private static ValidationException expectInvalid(VideoRequest request) {
		try {
			request.validate();
		}
		catch (ValidationException e) {
			return e;
		}
		fail("Expected validation to fail");
		return null;
	}

	@Test
	public void testActualFrameCountAlignsToFourPlusOne() {
		assertEquals(0, VideoRequest.actualFrameCount(0));
		assertEquals(1, VideoRequest.actualFrameCount(4));
		assertEquals(5, VideoRequest.actualFrameCount(5));
		assertEquals(5, VideoRequest.actualFrameCount(8));
		assertEquals(17, VideoRequest.actualFrameCount(17));
		assertEquals(61, VideoRequest.actualFrameCount(64));
	}

	@Test
	public void testValidRequest() {
		VideoRequest.builder("a cat surfing").size(512, 320).videoFrames(33).steps(30).cfgScale(6.0f).seed(42).build().validate();
	}

	@Test
	public void testTooFewFrames() {
		ValidationException e = expectInvalid(VideoRequest.builder("a cat").videoFrames(2).build());
		assertEquals("videoFrames", e.getParameter());
		assertEquals(2, e.getValue());
	}

	@Test
	public void testTooManyFrames() {
		ValidationException e = expectInvalid(VideoRequest.builder("a cat").videoFrames(65).build());
		assertEquals("videoFrames", e.getParameter());
	}

	@Test
	public void testDimensionsMustBeAligned() {
		assertEquals("width", expectInvalid(VideoRequest.builder("a cat").size(500, 512).build()).getParameter());
		assertEquals("height", expectInvalid(VideoRequest.builder("a cat").size(512, 64).build()).getParameter());
		assertEquals("width", expectInvalid(VideoRequest.builder("a cat").size(1088, 512).build()).getParameter());
	}

	@Test
	public void testDiffusionParameterBounds() {
		assertEquals("steps", expectInvalid(VideoRequest.builder("a cat").steps(0).build()).getParameter());
		assertEquals("steps", expectInvalid(VideoRequest.builder("a cat").steps(51).build()).getParameter());
		assertEquals("cfgScale", expectInvalid(VideoRequest.builder("a cat").cfgScale(0.5f).build()).getParameter());
		assertEquals("seed", expectInvalid(VideoRequest.builder("a cat").seed(-2).build()).getParameter());
		assertEquals("prompt", expectInvalid(VideoRequest.builder("  ").build()).getParameter());
	}
}
