package de.kherud.edge.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.kherud.edge.ModelFamily;
import de.kherud.edge.request.Operation;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class MetricsSnapshotTest {

	private static final long MB = 1024L * 1024L;

	@Test
	public void testDerivedFigures() {
		MetricsSnapshot snapshot = new MetricsSnapshot(ModelFamily.VIDEO_DIFFUSION, Operation.TEXT_TO_VIDEO,
			GenerationOutcome.Status.SUCCESS, 4000, 20, 17, "frames", 3072 * MB, "cpu", "STAGED");

		assertEquals(4.25, snapshot.throughput(), 1e-9);
		assertEquals(200.0, snapshot.millisPerStep(), 1e-9);
		assertEquals(3072, snapshot.peakMemoryMb());
	}

	@Test
	public void testZeroElapsedTime() {
		MetricsSnapshot snapshot = new MetricsSnapshot(ModelFamily.TEXT, Operation.COMPLETION,
			GenerationOutcome.Status.CANCELLED, 0, 0, 0, "tokens", 0, "gpu", "EAGER");

		assertEquals(0.0, snapshot.throughput(), 0.0);
		assertEquals(0.0, snapshot.millisPerStep(), 0.0);
	}

	@Test
	public void testJsonSerialization() throws Exception {
		MetricsSnapshot snapshot = new MetricsSnapshot(ModelFamily.IMAGE_DIFFUSION, Operation.TEXT_TO_IMAGE,
			GenerationOutcome.Status.SUCCESS, 2000, 20, 1, "images", 1024 * MB, "gpu", "EAGER");

		JsonNode json = new ObjectMapper().readTree(snapshot.toJson());

		assertEquals("IMAGE_DIFFUSION", json.get("family").asText());
		assertEquals("TEXT_TO_IMAGE", json.get("operation").asText());
		assertEquals("SUCCESS", json.get("status").asText());
		assertEquals(2000, json.get("elapsedMillis").asLong());
		assertEquals(0.5, json.get("throughput").asDouble(), 1e-9);
		assertEquals(1024, json.get("peakMemoryMb").asLong());
		assertEquals("gpu", json.get("backend").asText());
	}
}
