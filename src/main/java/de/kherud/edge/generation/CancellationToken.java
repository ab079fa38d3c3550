package de.kherud.edge.generation;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared between a {@link GenerationSession} and the native engine.
 * <p>
 * The state only moves forward: {@code NOT_REQUESTED -> REQUESTED -> ACKNOWLEDGED}. The engine polls
 * {@link #isCancellationRequested()} between work units and calls {@link #acknowledge()} when it stops early.
 */
public final class CancellationToken {

	public enum State {
		NOT_REQUESTED,
		REQUESTED,
		ACKNOWLEDGED
	}

	private final AtomicReference<State> state = new AtomicReference<>(State.NOT_REQUESTED);

	public boolean isCancellationRequested() {
		return state.get() != State.NOT_REQUESTED;
	}

	public State getState() {
		return state.get();
	}

	/**
	 * @return true only for the call that moved the token out of {@code NOT_REQUESTED}
	 */
	boolean request() {
		return state.compareAndSet(State.NOT_REQUESTED, State.REQUESTED);
	}

	/**
	 * Marks a pending request as observed by the engine. Has no effect unless a request is pending.
	 */
	public void acknowledge() {
		state.compareAndSet(State.REQUESTED, State.ACKNOWLEDGED);
	}

	@Override
	public String toString() {
		return "CancellationToken{" + state.get() + "}";
	}
}
