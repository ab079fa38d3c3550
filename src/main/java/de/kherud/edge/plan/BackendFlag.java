package de.kherud.edge.plan;

import java.util.Set;

/**
 * Bits handed to the native loader. The numeric values are part of the native contract and must not be reordered.
 */
public enum BackendFlag {
	GPU_OFFLOAD(1),
	MMAP(1 << 1),
	MLOCK(1 << 2),
	SEQUENTIAL_LOAD(1 << 3),
	OFFLOAD_TO_CPU(1 << 4),
	KEEP_CLIP_ON_CPU(1 << 5),
	KEEP_VAE_ON_CPU(1 << 6),
	FLASH_ATTENTION(1 << 7);

	private final int bit;

	BackendFlag(int bit) {
		this.bit = bit;
	}

	public int getBit() {
		return bit;
	}

	public boolean isSet(int mask) {
		return (mask & bit) != 0;
	}

	public static int mask(Set<BackendFlag> flags) {
		int mask = 0;
		for (BackendFlag flag : flags) {
			mask |= flag.bit;
		}
		return mask;
	}
}
