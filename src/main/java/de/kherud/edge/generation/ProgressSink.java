package de.kherud.edge.generation;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.IntConsumer;

import static java.lang.System.Logger.Level.WARNING;

/**
 * Entry point for progress reported by the native thread. Regressing steps are dropped and accepted events are
 * handed to the callback executor, so the native thread never waits for the listener.
 */
public class ProgressSink {

	private static final System.Logger logger = System.getLogger(ProgressSink.class.getName());

	private final ProgressListener listener;
	private final Executor callbackExecutor;
	private final IntConsumer stepObserver;
	private int highestStep = -1;
	private int acceptedEvents;

	public ProgressSink(ProgressListener listener, Executor callbackExecutor) {
		this(listener, callbackExecutor, step -> {
		});
	}

	/**
	 * @param stepObserver called synchronously on the reporting thread for every accepted step
	 */
	public ProgressSink(ProgressListener listener, Executor callbackExecutor, IntConsumer stepObserver) {
		this.listener = listener;
		this.callbackExecutor = callbackExecutor;
		this.stepObserver = stepObserver;
	}

	/**
	 * Called by the native engine after each completed work unit.
	 *
	 * @return whether the event was forwarded
	 */
	public boolean report(int step, int totalSteps) {
		synchronized (this) {
			if (step < highestStep) {
				return false;
			}
			highestStep = step;
			acceptedEvents++;
		}
		stepObserver.accept(step);
		try {
			callbackExecutor.execute(() -> listener.onProgress(step, totalSteps));
		}
		catch (RejectedExecutionException e) {
			logger.log(WARNING, "Dropped progress event " + step + "/" + totalSteps, e);
		}
		return true;
	}

	public synchronized int getHighestStep() {
		return highestStep;
	}

	public synchronized int getAcceptedEvents() {
		return acceptedEvents;
	}
}
