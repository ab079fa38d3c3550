package de.kherud.edge.engine;

import de.kherud.edge.ModelFamily;
import de.kherud.edge.generation.CancellationToken;
import de.kherud.edge.generation.ProgressSink;
import de.kherud.edge.request.GenerationRequest;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * {@link NativeEngine} bound to the {@value NativeLibraryLoader#LIBRARY_NAME} JNI library.
 * <p>
 * Requests cross the JNI boundary as the request object itself; the native side reads the parameter fields through
 * their getters and builds the matching result type. Progress and cancellation are passed as objects the native side
 * calls back into.
 */
public class JniNativeEngine implements NativeEngine {

	public JniNativeEngine() {
		NativeLibraryLoader.initialize();
	}

	@Override
	public long load(ModelFamily family, String path, List<String> auxPaths, int threadCount, int backendFlags) {
		return nativeLoad(family.ordinal(), path, auxPaths.toArray(new String[0]), threadCount, backendFlags);
	}

	@Override
	@Nullable
	@SuppressWarnings("unchecked")
	public <R> R generate(long handle, GenerationRequest<R> request, ProgressSink progress, CancellationToken token) {
		Object result = nativeGenerate(handle, request.getOperation().ordinal(), request, progress, token);
		if (result == null) {
			return null;
		}
		return (R) result;
	}

	@Override
	public void cancel(long handle) {
		nativeCancel(handle);
	}

	@Override
	public void close(long handle) {
		nativeClose(handle);
	}

	@Override
	public long estimateParameterMemory(String path) {
		return nativeEstimateParameterMemory(path);
	}

	@Override
	@Nullable
	public String lastError(long handle) {
		return nativeLastError(handle);
	}

	private static native long nativeLoad(int family, String path, String[] auxPaths, int threadCount, int backendFlags);

	private static native Object nativeGenerate(long handle, int operation, Object request, ProgressSink progress,
												CancellationToken token);

	private static native void nativeCancel(long handle);

	private static native void nativeClose(long handle);

	private static native long nativeEstimateParameterMemory(String path);

	private static native String nativeLastError(long handle);
}
