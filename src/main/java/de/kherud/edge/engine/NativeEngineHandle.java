package de.kherud.edge.engine;

import de.kherud.edge.ModelFamily;

import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * Owner of one native model handle. Closing releases the native memory exactly once; later calls are no-ops.
 * After close the handle must not be used for generation.
 */
public class NativeEngineHandle implements AutoCloseable {

	private static final System.Logger logger = System.getLogger(NativeEngineHandle.class.getName());

	private final NativeEngine engine;
	private final long pointer;
	private final ModelMetadata metadata;
	private final AtomicBoolean closed = new AtomicBoolean(false);

	public NativeEngineHandle(NativeEngine engine, long pointer, ModelMetadata metadata) {
		if (pointer == 0) {
			throw new IllegalArgumentException("Native handle cannot be 0");
		}
		this.engine = engine;
		this.pointer = pointer;
		this.metadata = metadata;
	}

	public NativeEngine getEngine() {
		return engine;
	}

	public long getPointer() {
		return pointer;
	}

	public ModelMetadata getMetadata() {
		return metadata;
	}

	public ModelFamily getFamily() {
		return metadata.getFamily();
	}

	public boolean isClosed() {
		return closed.get();
	}

	/**
	 * Forwards a cancellation request to the native side. Ignored once the handle is closed.
	 */
	public void cancel() {
		if (!closed.get()) {
			engine.cancel(pointer);
		}
	}

	@Override
	public void close() {
		if (closed.compareAndSet(false, true)) {
			logger.log(DEBUG, "Closing native handle " + pointer + " (" + metadata.getFileName() + ")");
			engine.close(pointer);
		}
	}

	@Override
	public String toString() {
		return "NativeEngineHandle{" + pointer + ", " + metadata + (closed.get() ? ", closed" : "") + "}";
	}
}
