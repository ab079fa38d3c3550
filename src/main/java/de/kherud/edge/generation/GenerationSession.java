package de.kherud.edge.generation;

import de.kherud.edge.ModelFamily;
import de.kherud.edge.engine.NativeEngineHandle;

/**
 * State of one generation call. Created under the family's generation lock and discarded when the call returns.
 */
public final class GenerationSession {

	private final ModelFamily family;
	private final NativeEngineHandle handle;
	private final CancellationToken token = new CancellationToken();
	private final ProgressSink progressSink;

	GenerationSession(ModelFamily family, NativeEngineHandle handle, ProgressSink progressSink) {
		this.family = family;
		this.handle = handle;
		this.progressSink = progressSink;
	}

	public ModelFamily getFamily() {
		return family;
	}

	public NativeEngineHandle getHandle() {
		return handle;
	}

	public CancellationToken getToken() {
		return token;
	}

	public ProgressSink getProgressSink() {
		return progressSink;
	}

	public boolean isCancellationRequested() {
		return token.isCancellationRequested();
	}

	/**
	 * Flips the token and, on the first request only, forwards it to the native handle.
	 *
	 * @return whether this call issued the native cancel
	 */
	boolean cancel() {
		if (token.request()) {
			handle.cancel();
			return true;
		}
		return false;
	}
}
