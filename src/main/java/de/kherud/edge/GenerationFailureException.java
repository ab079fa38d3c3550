package de.kherud.edge;

/**
 * The native engine rejected or failed a generation for a reason other than cancellation.
 * The message carries whatever diagnostic text the engine provided.
 */
public class GenerationFailureException extends EdgeException {

	public GenerationFailureException(String message) {
		super(message);
	}

	public GenerationFailureException(String message, Throwable cause) {
		super(message, cause);
	}
}
