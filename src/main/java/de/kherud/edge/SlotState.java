package de.kherud.edge;

/**
 * Lifecycle of the model slot the manager keeps per {@link ModelFamily}.
 * <p>
 * {@code UNLOADED -> LOADING -> READY -> GENERATING -> READY -> ... -> UNLOADED}. A failed load or generation
 * passes through {@code ERROR} and clears the slot back to {@code UNLOADED}.
 */
public enum SlotState {
	UNLOADED,
	LOADING,
	READY,
	GENERATING,
	ERROR
}
