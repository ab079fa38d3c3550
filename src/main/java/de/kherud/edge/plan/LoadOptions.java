package de.kherud.edge.plan;

import org.jetbrains.annotations.Nullable;

/**
 * Caller supplied knobs for a single load. Everything defaults to the memory-conservative choice.
 */
public final class LoadOptions {

	public static final LoadOptions DEFAULT = builder().build();

	private final boolean preferPerformance;
	@Nullable
	private final Boolean forceStaged;
	private final boolean forceGpu;
	private final boolean flashAttention;
	private final int targetWidth;
	private final int targetHeight;
	private final int contextSize;
	private final int threadCount;

	private LoadOptions(Builder builder) {
		this.preferPerformance = builder.preferPerformance;
		this.forceStaged = builder.forceStaged;
		this.forceGpu = builder.forceGpu;
		this.flashAttention = builder.flashAttention;
		this.targetWidth = builder.targetWidth;
		this.targetHeight = builder.targetHeight;
		this.contextSize = builder.contextSize;
		this.threadCount = builder.threadCount;
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean isPreferPerformance() {
		return preferPerformance;
	}

	/**
	 * {@code TRUE} forces staged loading, {@code FALSE} forces eager loading, {@code null} lets memory decide.
	 */
	@Nullable
	public Boolean getForceStaged() {
		return forceStaged;
	}

	public boolean isForceGpu() {
		return forceGpu;
	}

	public boolean isFlashAttention() {
		return flashAttention;
	}

	/** Target output width in pixels, 0 when unknown. */
	public int getTargetWidth() {
		return targetWidth;
	}

	/** Target output height in pixels, 0 when unknown. */
	public int getTargetHeight() {
		return targetHeight;
	}

	/** Requested text context size, 0 for the heap-derived default. */
	public int getContextSize() {
		return contextSize;
	}

	/** Explicit thread count, 0 to derive it from the CPU topology. */
	public int getThreadCount() {
		return threadCount;
	}

	public Builder toBuilder() {
		return new Builder()
			.preferPerformance(preferPerformance)
			.forceStaged(forceStaged)
			.forceGpu(forceGpu)
			.flashAttention(flashAttention)
			.targetSize(targetWidth, targetHeight)
			.contextSize(contextSize)
			.threadCount(threadCount);
	}

	@Override
	public String toString() {
		return "LoadOptions{preferPerformance=" + preferPerformance + ", forceStaged=" + forceStaged
			+ ", forceGpu=" + forceGpu + ", flashAttention=" + flashAttention + ", target=" + targetWidth + "x"
			+ targetHeight + ", contextSize=" + contextSize + ", threads=" + threadCount + "}";
	}

	public static class Builder {
		private boolean preferPerformance;
		private Boolean forceStaged;
		private boolean forceGpu;
		private boolean flashAttention;
		private int targetWidth;
		private int targetHeight;
		private int contextSize;
		private int threadCount;

		public Builder preferPerformance(boolean preferPerformance) {
			this.preferPerformance = preferPerformance;
			return this;
		}

		public Builder forceStaged(@Nullable Boolean forceStaged) {
			this.forceStaged = forceStaged;
			return this;
		}

		public Builder forceGpu(boolean forceGpu) {
			this.forceGpu = forceGpu;
			return this;
		}

		public Builder flashAttention(boolean flashAttention) {
			this.flashAttention = flashAttention;
			return this;
		}

		public Builder targetSize(int width, int height) {
			if (width < 0 || height < 0) {
				throw new IllegalArgumentException("Target size cannot be negative: " + width + "x" + height);
			}
			this.targetWidth = width;
			this.targetHeight = height;
			return this;
		}

		public Builder contextSize(int contextSize) {
			if (contextSize < 0) {
				throw new IllegalArgumentException("Context size cannot be negative: " + contextSize);
			}
			this.contextSize = contextSize;
			return this;
		}

		public Builder threadCount(int threadCount) {
			if (threadCount < 0) {
				throw new IllegalArgumentException("Thread count cannot be negative: " + threadCount);
			}
			this.threadCount = threadCount;
			return this;
		}

		public LoadOptions build() {
			return new LoadOptions(this);
		}
	}
}
