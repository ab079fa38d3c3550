package de.kherud.edge.generation;

import de.kherud.edge.GenerationCancelledException;
import de.kherud.edge.GenerationFailureException;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Result of a generation call. Cancellation is a regular outcome rather than an exception so that it never has to
 * travel through native frames.
 *
 * @param <R> type of the produced result
 */
public final class GenerationOutcome<R> {

	public enum Status {
		SUCCESS,
		CANCELLED,
		FAILED
	}

	private final Status status;
	@Nullable
	private final R result;
	@Nullable
	private final String errorMessage;
	@Nullable
	private final Throwable cause;
	@Nullable
	private final MetricsSnapshot metrics;

	private GenerationOutcome(Status status, @Nullable R result, @Nullable String errorMessage,
							  @Nullable Throwable cause, @Nullable MetricsSnapshot metrics) {
		this.status = status;
		this.result = result;
		this.errorMessage = errorMessage;
		this.cause = cause;
		this.metrics = metrics;
	}

	public static <R> GenerationOutcome<R> success(R result) {
		return new GenerationOutcome<>(Status.SUCCESS, result, null, null, null);
	}

	public static <R> GenerationOutcome<R> cancelled() {
		return new GenerationOutcome<>(Status.CANCELLED, null, "Generation was cancelled", null, null);
	}

	public static <R> GenerationOutcome<R> failed(String errorMessage, @Nullable Throwable cause) {
		return new GenerationOutcome<>(Status.FAILED, null, errorMessage, cause, null);
	}

	/**
	 * Copy of this outcome carrying the given metrics.
	 */
	public GenerationOutcome<R> withMetrics(MetricsSnapshot metrics) {
		return new GenerationOutcome<>(status, result, errorMessage, cause, metrics);
	}

	public Status getStatus() {
		return status;
	}

	public boolean isSuccess() {
		return status == Status.SUCCESS;
	}

	public boolean isCancelled() {
		return status == Status.CANCELLED;
	}

	public boolean isFailed() {
		return status == Status.FAILED;
	}

	public Optional<R> getResult() {
		return Optional.ofNullable(result);
	}

	public Optional<String> getErrorMessage() {
		return Optional.ofNullable(errorMessage);
	}

	@Nullable
	public Throwable getCause() {
		return cause;
	}

	public Optional<MetricsSnapshot> getMetrics() {
		return Optional.ofNullable(metrics);
	}

	/**
	 * @throws GenerationCancelledException if the generation was cancelled
	 * @throws GenerationFailureException   if the generation failed
	 */
	public R getOrThrow() {
		switch (status) {
			case SUCCESS:
				return result;
			case CANCELLED:
				throw new GenerationCancelledException(errorMessage);
			default:
				throw cause != null
					? new GenerationFailureException(errorMessage, cause)
					: new GenerationFailureException(errorMessage);
		}
	}

	@Override
	public String toString() {
		return "GenerationOutcome{" + status + (errorMessage != null && status != Status.SUCCESS ? ", " + errorMessage : "") + "}";
	}
}
