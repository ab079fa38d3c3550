package de.kherud.edge.request;

import de.kherud.edge.validation.ParameterValidator;
import org.jetbrains.annotations.Nullable;

/**
 * Parameters shared by image and video diffusion.
 *
 * @param <R> result type
 */
public abstract class DiffusionRequest<R> implements GenerationRequest<R> {

	private final String prompt;
	private final String negativePrompt;
	private final int width;
	private final int height;
	private final int steps;
	private final float cfgScale;
	private final long seed;
	@Nullable
	private final byte[] initImage;
	private final float strength;

	protected DiffusionRequest(Builder<?> builder) {
		this.prompt = builder.prompt;
		this.negativePrompt = builder.negativePrompt;
		this.width = builder.width;
		this.height = builder.height;
		this.steps = builder.steps;
		this.cfgScale = builder.cfgScale;
		this.seed = builder.seed;
		this.initImage = builder.initImage;
		this.strength = builder.strength;
	}

	@Override
	public void validate() {
		ParameterValidator.requireNotBlank("prompt", prompt);
		ParameterValidator.requireDimension("width", width);
		ParameterValidator.requireDimension("height", height);
		ParameterValidator.requireSteps(steps);
		ParameterValidator.requireCfgScale(cfgScale);
		ParameterValidator.requireSeed(seed);
		ParameterValidator.requireStrength(strength, initImage != null);
	}

	@Override
	public int getTargetWidth() {
		return width;
	}

	@Override
	public int getTargetHeight() {
		return height;
	}

	public String getPrompt() {
		return prompt;
	}

	public String getNegativePrompt() {
		return negativePrompt;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public int getSteps() {
		return steps;
	}

	public float getCfgScale() {
		return cfgScale;
	}

	public long getSeed() {
		return seed;
	}

	@Nullable
	public byte[] getInitImage() {
		return initImage;
	}

	public float getStrength() {
		return strength;
	}

	@SuppressWarnings("unchecked")
	public abstract static class Builder<B extends Builder<B>> {
		private final String prompt;
		private String negativePrompt = "";
		private int width;
		private int height;
		private int steps;
		private float cfgScale = 7.0f;
		private long seed = -1;
		private byte[] initImage;
		private float strength = 0.8f;

		protected Builder(String prompt, int defaultSize, int defaultSteps) {
			this.prompt = prompt;
			this.width = defaultSize;
			this.height = defaultSize;
			this.steps = defaultSteps;
		}

		public B negativePrompt(String negativePrompt) {
			this.negativePrompt = negativePrompt == null ? "" : negativePrompt;
			return (B) this;
		}

		public B size(int width, int height) {
			this.width = width;
			this.height = height;
			return (B) this;
		}

		public B steps(int steps) {
			this.steps = steps;
			return (B) this;
		}

		public B cfgScale(float cfgScale) {
			this.cfgScale = cfgScale;
			return (B) this;
		}

		public B seed(long seed) {
			this.seed = seed;
			return (B) this;
		}

		/**
		 * RGB bytes of a starting image, {@code width * height * 3} long.
		 */
		public B initImage(@Nullable byte[] initImage, float strength) {
			this.initImage = initImage;
			this.strength = strength;
			return (B) this;
		}
	}
}
