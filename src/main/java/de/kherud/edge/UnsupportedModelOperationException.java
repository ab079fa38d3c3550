package de.kherud.edge;

import de.kherud.edge.request.Operation;

/**
 * An operation was requested against a handle whose family does not provide it, e.g. video generation on a
 * text model. Raised before anything is dispatched to native code.
 */
public class UnsupportedModelOperationException extends EdgeException {

	private final ModelFamily family;
	private final Operation operation;

	public UnsupportedModelOperationException(ModelFamily family, Operation operation) {
		super("Operation " + operation + " is not supported by " + family + " models (supported: "
			+ family.getOperations() + ")");
		this.family = family;
		this.operation = operation;
	}

	public ModelFamily getFamily() {
		return family;
	}

	public Operation getOperation() {
		return operation;
	}
}
