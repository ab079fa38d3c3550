package de.kherud.edge.validation;

import de.kherud.edge.EdgeException;
import org.jetbrains.annotations.Nullable;

/**
 * A request parameter violates its constraint. Thrown before any model is loaded or any native call is made.
 */
public class ValidationException extends EdgeException {

	private final String parameter;
	private final String constraint;
	@Nullable
	private final Object value;

	public ValidationException(String parameter, String constraint, @Nullable Object value) {
		super("Invalid " + parameter + ": " + constraint + " (got " + value + ")");
		this.parameter = parameter;
		this.constraint = constraint;
		this.value = value;
	}

	/**
	 * Name of the offending parameter, e.g. {@code videoFrames}.
	 */
	public String getParameter() {
		return parameter;
	}

	/**
	 * Human readable rule that was violated.
	 */
	public String getConstraint() {
		return constraint;
	}

	@Nullable
	public Object getValue() {
		return value;
	}
}
