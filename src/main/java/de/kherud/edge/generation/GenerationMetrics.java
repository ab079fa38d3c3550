package de.kherud.edge.generation;

import de.kherud.edge.ModelFamily;
import de.kherud.edge.memory.MemoryProbe;
import de.kherud.edge.request.Operation;

/**
 * Collects timing, step and memory figures while a generation runs and freezes them into a
 * {@link MetricsSnapshot} when it ends.
 */
public class GenerationMetrics {

	private final MemoryProbe memoryProbe;
	private final ModelFamily family;
	private final Operation operation;
	private final String backend;
	private final String loadStrategy;
	private final long startNanos;

	private int steps;
	private long peakMemoryBytes;

	public GenerationMetrics(MemoryProbe memoryProbe, ModelFamily family, Operation operation, boolean gpu,
							 String loadStrategy) {
		this.memoryProbe = memoryProbe;
		this.family = family;
		this.operation = operation;
		this.backend = gpu ? "gpu" : "cpu";
		this.loadStrategy = loadStrategy;
		this.startNanos = System.nanoTime();
		sampleMemory();
	}

	/**
	 * Records a completed step and samples memory. Called on the reporting thread.
	 */
	public synchronized void onStep(int step) {
		steps = Math.max(steps, step);
		sampleMemory();
	}

	private synchronized void sampleMemory() {
		peakMemoryBytes = Math.max(peakMemoryBytes, memoryProbe.snapshot().usedDeviceMemory());
	}

	public synchronized MetricsSnapshot finish(GenerationOutcome.Status status, long unitsProduced, String unitName) {
		sampleMemory();
		long elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000L;
		return new MetricsSnapshot(family, operation, status, elapsedMillis, steps, unitsProduced, unitName,
			peakMemoryBytes, backend, loadStrategy);
	}
}
