package de.kherud.edge.memory;

/**
 * Point-in-time memory reading. All values are in bytes.
 */
public record MemorySnapshot(
	long totalDeviceMemory,
	long availableDeviceMemory,
	long processHeapUsed,
	long processHeapMax
) {
	private static final long MB = 1024L * 1024L;

	/**
	 * Heap the process can still allocate before hitting its limit, never negative.
	 */
	public long heapHeadroom() {
		return Math.max(0L, processHeapMax - processHeapUsed);
	}

	/**
	 * Device memory in use, never negative.
	 */
	public long usedDeviceMemory() {
		return Math.max(0L, totalDeviceMemory - availableDeviceMemory);
	}

	public double availableFraction() {
		return totalDeviceMemory > 0 ? (double) availableDeviceMemory / totalDeviceMemory : 0.0;
	}

	/**
	 * Copy of this snapshot with a different available device memory, used to model shrinking headroom.
	 */
	public MemorySnapshot withAvailableDeviceMemory(long available) {
		return new MemorySnapshot(totalDeviceMemory, available, processHeapUsed, processHeapMax);
	}

	@Override
	public String toString() {
		return String.format("MemorySnapshot{device: %dMB free / %dMB total, heap: %dMB used / %dMB max}",
			availableDeviceMemory / MB, totalDeviceMemory / MB, processHeapUsed / MB, processHeapMax / MB);
	}
}
