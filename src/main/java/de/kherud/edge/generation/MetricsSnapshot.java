package de.kherud.edge.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.kherud.edge.ModelFamily;
import de.kherud.edge.request.Operation;

/**
 * Read-only measurements of one finished generation.
 *
 * @param family          family of the model that ran
 * @param operation       operation that ran
 * @param status          how the generation ended
 * @param elapsedMillis   wall time of the native call
 * @param steps           highest progress step reported by the engine
 * @param unitsProduced   frames, images, tokens, vectors or segments produced
 * @param unitName        name of the produced unit, e.g. {@code "frames"}
 * @param peakMemoryBytes highest device memory use sampled while generating
 * @param backend         {@code "gpu"} or {@code "cpu"}
 * @param loadStrategy    strategy the model was loaded with
 */
public record MetricsSnapshot(
	ModelFamily family,
	Operation operation,
	GenerationOutcome.Status status,
	long elapsedMillis,
	int steps,
	long unitsProduced,
	String unitName,
	long peakMemoryBytes,
	String backend,
	String loadStrategy
) {

	private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

	/**
	 * Produced units per second, 0 when nothing was produced or no time elapsed.
	 */
	public double throughput() {
		return elapsedMillis > 0 ? unitsProduced * 1000.0 / elapsedMillis : 0.0;
	}

	public double millisPerStep() {
		return steps > 0 ? (double) elapsedMillis / steps : 0.0;
	}

	public long peakMemoryMb() {
		return peakMemoryBytes / (1024 * 1024);
	}

	public ObjectNode toJsonNode() {
		ObjectNode node = OBJECT_MAPPER.createObjectNode();
		node.put("family", family.name());
		node.put("operation", operation.name());
		node.put("status", status.name());
		node.put("elapsedMillis", elapsedMillis);
		node.put("steps", steps);
		node.put("unitsProduced", unitsProduced);
		node.put("unitName", unitName);
		node.put("throughput", throughput());
		node.put("millisPerStep", millisPerStep());
		node.put("peakMemoryMb", peakMemoryMb());
		node.put("backend", backend);
		node.put("loadStrategy", loadStrategy);
		return node;
	}

	public String toJson() {
		try {
			return OBJECT_MAPPER.writeValueAsString(toJsonNode());
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize metrics", e);
		}
	}

	public String toPrettyString() {
		return String.format("Total time: %.2fs%nThroughput: %.2f %s/s%nAverage time/step: %.1fms%nPeak memory: %dMB%nBackend: %s (%s)",
			elapsedMillis / 1000.0, throughput(), unitName, millisPerStep(), peakMemoryMb(), backend, loadStrategy);
	}
}
