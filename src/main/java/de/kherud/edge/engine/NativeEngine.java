package de.kherud.edge.engine;

import de.kherud.edge.ModelFamily;
import de.kherud.edge.generation.CancellationToken;
import de.kherud.edge.generation.ProgressSink;
import de.kherud.edge.request.GenerationRequest;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Binding to the native inference runtime. Handles are opaque non-zero longs owned by the runtime.
 * <p>
 * {@link #generate} runs on the calling thread and must poll the supplied {@link CancellationToken} between work
 * units (denoising steps, frames, token batches, audio chunks). {@link #cancel} may be called from any thread while
 * {@code generate} is running.
 */
public interface NativeEngine {

	/**
	 * Loads the weights at {@code path} plus optional component files.
	 *
	 * @param family       family of the model, selects the native backend
	 * @param path         primary weight file
	 * @param auxPaths     VAE, text encoder and auxiliary decoder files, possibly empty
	 * @param threadCount  native worker threads
	 * @param backendFlags bit mask of {@link de.kherud.edge.plan.BackendFlag}
	 * @return a handle, or 0 on failure
	 */
	long load(ModelFamily family, String path, List<String> auxPaths, int threadCount, int backendFlags);

	/**
	 * Runs one request to completion.
	 *
	 * @return the result, or {@code null} on failure (see {@link #lastError(long)})
	 */
	@Nullable
	<R> R generate(long handle, GenerationRequest<R> request, ProgressSink progress, CancellationToken token);

	/**
	 * Asks a running {@link #generate} on this handle to stop at the next work unit boundary.
	 */
	void cancel(long handle);

	/**
	 * Releases the handle. Calling it twice for the same handle has no effect.
	 */
	void close(long handle);

	/**
	 * Static size estimate of the weights, 0 when unknown.
	 */
	long estimateParameterMemory(String path);

	@Nullable
	String lastError(long handle);
}
