package de.kherud.edge.generation;

import de.kherud.edge.ModelFamily;
import de.kherud.edge.engine.NativeEngineHandle;
import de.kherud.edge.request.GenerationRequest;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

/**
 * Serializes generation per model family and routes cancellation requests to the running session.
 * <p>
 * Each family has one fair lock, so waiting callers are served in arrival order. Locks of different families are
 * independent. {@link #withGenerationLock} must not be re-entered for the same family from inside its block; the
 * lock is reentrant, but a nested generation would share the family's single session slot.
 */
public class GenerationCoordinator {

	private static final System.Logger logger = System.getLogger(GenerationCoordinator.class.getName());

	private final Map<ModelFamily, ReentrantLock> locks;
	private final Map<ModelFamily, GenerationSession> activeSessions = new ConcurrentHashMap<>();
	private final Executor callbackExecutor;

	/**
	 * @param callbackExecutor executor progress listeners are invoked on
	 */
	public GenerationCoordinator(Executor callbackExecutor) {
		this.callbackExecutor = callbackExecutor;
		Map<ModelFamily, ReentrantLock> map = new EnumMap<>(ModelFamily.class);
		for (ModelFamily family : ModelFamily.values()) {
			map.put(family, new ReentrantLock(true));
		}
		this.locks = Collections.unmodifiableMap(map);
	}

	/**
	 * Runs {@code block} while holding the generation lock of {@code family}. Blocks until the lock is available.
	 */
	public <T> T withGenerationLock(ModelFamily family, Supplier<T> block) {
		ReentrantLock lock = locks.get(family);
		lock.lock();
		try {
			return block.get();
		}
		finally {
			lock.unlock();
		}
	}

	public boolean isLockHeldByCurrentThread(ModelFamily family) {
		return locks.get(family).isHeldByCurrentThread();
	}

	public boolean isLocked(ModelFamily family) {
		return locks.get(family).isLocked();
	}

	/**
	 * Runs one request against {@code handle} inside a fresh session. The caller must hold the family's lock.
	 * <p>
	 * A session that saw a cancellation request yields {@link GenerationOutcome.Status#CANCELLED} even when the
	 * engine returned a complete result. Engine failures become {@link GenerationOutcome.Status#FAILED}.
	 */
	public <R> GenerationOutcome<R> generate(ModelFamily family, NativeEngineHandle handle,
											 GenerationRequest<R> request, ProgressListener listener,
											 GenerationMetrics metrics) {
		if (!isLockHeldByCurrentThread(family)) {
			throw new IllegalStateException("Generation lock for " + family + " is not held by the current thread");
		}
		ProgressSink sink = new ProgressSink(listener, callbackExecutor, metrics::onStep);
		GenerationSession session = new GenerationSession(family, handle, sink);
		activeSessions.put(family, session);
		try {
			GenerationOutcome<R> outcome = invoke(session, request);
			long units = 0;
			if (outcome.isSuccess()) {
				units = request.producedUnits(outcome.getResult().orElseThrow());
			}
			return outcome.withMetrics(metrics.finish(outcome.getStatus(), units, request.unitName()));
		}
		finally {
			activeSessions.remove(family, session);
		}
	}

	private <R> GenerationOutcome<R> invoke(GenerationSession session, GenerationRequest<R> request) {
		NativeEngineHandle handle = session.getHandle();
		R result;
		try {
			result = handle.getEngine().generate(handle.getPointer(), request, session.getProgressSink(), session.getToken());
		}
		catch (RuntimeException e) {
			if (session.isCancellationRequested()) {
				session.getToken().acknowledge();
				return GenerationOutcome.cancelled();
			}
			return GenerationOutcome.failed("Native " + request.getOperation() + " failed: " + e.getMessage(), e);
		}
		if (session.isCancellationRequested()) {
			session.getToken().acknowledge();
			logger.log(INFO, session.getFamily() + " generation cancelled after step " + session.getProgressSink().getHighestStep());
			return GenerationOutcome.cancelled();
		}
		if (result == null) {
			String error = handle.getEngine().lastError(handle.getPointer());
			return GenerationOutcome.failed("Native " + request.getOperation() + " returned no result"
				+ (error != null ? ": " + error : ""), null);
		}
		return GenerationOutcome.success(result);
	}

	/**
	 * Requests cancellation of the generation running for {@code family}. Never blocks.
	 *
	 * @return whether this call issued the native cancel; false when nothing runs or a request is already pending
	 */
	public boolean cancelGeneration(ModelFamily family) {
		GenerationSession session = activeSessions.get(family);
		if (session == null) {
			logger.log(DEBUG, "No " + family + " generation to cancel");
			return false;
		}
		boolean issued = session.cancel();
		if (issued) {
			logger.log(INFO, "Cancellation requested for " + family + " generation");
		}
		return issued;
	}

	/**
	 * Requests cancellation of every running generation.
	 *
	 * @return number of sessions that received a new cancellation request
	 */
	public int cancelGeneration() {
		int issued = 0;
		for (ModelFamily family : ModelFamily.values()) {
			if (cancelGeneration(family)) {
				issued++;
			}
		}
		return issued;
	}

	public boolean isGenerating(ModelFamily family) {
		return activeSessions.containsKey(family);
	}

	@Nullable
	public GenerationSession getActiveSession(ModelFamily family) {
		return activeSessions.get(family);
	}
}
