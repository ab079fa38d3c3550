package de.kherud.edge.generation;

/**
 * Receives generation progress on the callback executor. Steps are non-decreasing within one generation.
 */
@FunctionalInterface
public interface ProgressListener {

	ProgressListener NONE = (step, totalSteps) -> {
	};

	/**
	 * @param step       completed work units (denoising steps, frames, tokens or audio chunks)
	 * @param totalSteps expected total, 0 when unknown
	 */
	void onProgress(int step, int totalSteps);
}
