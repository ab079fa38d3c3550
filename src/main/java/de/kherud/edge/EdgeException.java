package de.kherud.edge;

/**
 * Root of all failures raised by the lifecycle layer.
 */
public class EdgeException extends RuntimeException {

	public EdgeException(String message) {
		super(message);
	}

	public EdgeException(String message, Throwable cause) {
		super(message, cause);
	}
}
