package de.kherud.edge.memory;

/**
 * Reports available system memory to the model cache, which evicts proactively when the value drops below
 * its configured floor.
 */
@FunctionalInterface
public interface MemoryProvider {

	long availableMemoryBytes();

	static MemoryProvider of(MemoryProbe probe) {
		return () -> probe.snapshot().availableDeviceMemory();
	}
}
