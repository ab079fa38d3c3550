package de.kherud.edge;

/**
 * The generation observed a cancellation request. Kept apart from {@link GenerationFailureException} so that callers
 * can tell a user abort from an engine failure.
 */
public class GenerationCancelledException extends EdgeException {

	public GenerationCancelledException(String message) {
		super(message);
	}
}
