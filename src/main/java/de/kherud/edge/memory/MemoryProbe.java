package de.kherud.edge.memory;

/**
 * Reads live device and process memory.
 * <p>
 * Implementations must be pure reads, safe from any thread, and must not allocate enough to disturb the
 * reading they return.
 */
public interface MemoryProbe {

	/**
	 * Devices below this total RAM are treated as low-memory when finer heuristics are unavailable.
	 */
	long LOW_MEMORY_DEVICE_BYTES = 8L * 1024L * 1024L * 1024L;

	MemorySnapshot snapshot();

	default boolean isLowMemoryDevice() {
		return snapshot().totalDeviceMemory() < LOW_MEMORY_DEVICE_BYTES;
	}
}
