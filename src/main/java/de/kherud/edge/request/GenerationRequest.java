package de.kherud.edge.request;

/**
 * A unit of work for a loaded model.
 * <p>
 * Requests are plain parameter holders; {@link #validate()} checks them before any model is loaded so that an
 * invalid request never costs a native call.
 *
 * @param <R> result type the native engine produces for this request
 */
public interface GenerationRequest<R> {

	Operation getOperation();

	/**
	 * @throws de.kherud.edge.validation.ValidationException if a parameter is out of range
	 */
	void validate();

	/**
	 * Name of the unit counted by {@link #producedUnits}, used for throughput metrics.
	 */
	String unitName();

	long producedUnits(R result);

	/**
	 * Output width in pixels for visual requests, 0 otherwise.
	 */
	default int getTargetWidth() {
		return 0;
	}

	/**
	 * Output height in pixels for visual requests, 0 otherwise.
	 */
	default int getTargetHeight() {
		return 0;
	}
}
