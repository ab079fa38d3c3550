package de.kherud.edge.plan;

import java.util.EnumSet;
import java.util.Set;

/**
 * How one model should be loaded. Computed fresh for every load attempt and never cached.
 *
 * @param strategy          eager or staged loading
 * @param threadCount       native worker threads
 * @param gpuOffload        whether weights go to the GPU backend
 * @param mmap              whether weights are memory mapped
 * @param mlock             whether mapped weights are pinned in RAM
 * @param offloadToCpu      whether weights are streamed from CPU memory instead of staying resident
 * @param auxiliaryOnCpu    whether CLIP/T5/VAE components stay on the CPU
 * @param flashAttention    whether the flash attention kernel is enabled
 * @param contextSize       text context size, 0 for non-text families
 * @param reason            the signal that decided the strategy
 */
public record LoadPlan(
	Strategy strategy,
	int threadCount,
	boolean gpuOffload,
	boolean mmap,
	boolean mlock,
	boolean offloadToCpu,
	boolean auxiliaryOnCpu,
	boolean flashAttention,
	int contextSize,
	String reason
) {

	public enum Strategy {
		/** All weights resident at once. */
		EAGER,
		/** Components loaded one after another with memory released in between. */
		STAGED
	}

	public boolean isStaged() {
		return strategy == Strategy.STAGED;
	}

	public Set<BackendFlag> backendFlags() {
		Set<BackendFlag> flags = EnumSet.noneOf(BackendFlag.class);
		if (gpuOffload) flags.add(BackendFlag.GPU_OFFLOAD);
		if (mmap) flags.add(BackendFlag.MMAP);
		if (mlock) flags.add(BackendFlag.MLOCK);
		if (isStaged()) flags.add(BackendFlag.SEQUENTIAL_LOAD);
		if (offloadToCpu) flags.add(BackendFlag.OFFLOAD_TO_CPU);
		if (auxiliaryOnCpu) {
			flags.add(BackendFlag.KEEP_CLIP_ON_CPU);
			flags.add(BackendFlag.KEEP_VAE_ON_CPU);
		}
		if (flashAttention) flags.add(BackendFlag.FLASH_ATTENTION);
		return flags;
	}

	public int backendFlagMask() {
		return BackendFlag.mask(backendFlags());
	}
}
