package de.kherud.edge.validation;

import org.jetbrains.annotations.Nullable;

/**
 * Checks shared by all request types. Each method throws {@link ValidationException} naming the parameter, the rule
 * and the rejected value.
 */
public final class ParameterValidator {

	public static final int MIN_DIMENSION = 128;
	public static final int MAX_DIMENSION = 1024;
	public static final int DIMENSION_ALIGNMENT = 64;
	public static final int MIN_STEPS = 1;
	public static final int MAX_STEPS = 50;
	public static final float MIN_CFG_SCALE = 1.0f;
	public static final float MAX_CFG_SCALE = 15.0f;

	private ParameterValidator() {
	}

	public static void requireNotBlank(String parameter, @Nullable String value) {
		if (value == null || value.isBlank()) {
			throw new ValidationException(parameter, "must not be blank", value == null ? null : "\"" + value + "\"");
		}
	}

	public static void requireRange(String parameter, long value, long min, long max) {
		if (value < min || value > max) {
			throw new ValidationException(parameter, "must be between " + min + " and " + max, value);
		}
	}

	public static void requireRange(String parameter, float value, float min, float max) {
		if (Float.isNaN(value) || value < min || value > max) {
			throw new ValidationException(parameter, "must be between " + min + " and " + max, value);
		}
	}

	public static void requireAtLeast(String parameter, long value, long min) {
		if (value < min) {
			throw new ValidationException(parameter, "must be at least " + min, value);
		}
	}

	public static void requireAtMost(String parameter, long value, long max) {
		if (value > max) {
			throw new ValidationException(parameter, "must be at most " + max, value);
		}
	}

	public static void requireMultipleOf(String parameter, int value, int divisor) {
		if (value % divisor != 0) {
			throw new ValidationException(parameter, "must be a multiple of " + divisor, value);
		}
	}

	/**
	 * Output dimensions of diffusion models: aligned to the latent grid and within what fits on a device.
	 */
	public static void requireDimension(String parameter, int value) {
		requireMultipleOf(parameter, value, DIMENSION_ALIGNMENT);
		requireRange(parameter, value, MIN_DIMENSION, MAX_DIMENSION);
	}

	public static void requireSteps(int steps) {
		requireRange("steps", steps, MIN_STEPS, MAX_STEPS);
	}

	public static void requireCfgScale(float cfgScale) {
		requireRange("cfgScale", cfgScale, MIN_CFG_SCALE, MAX_CFG_SCALE);
	}

	/**
	 * {@code -1} asks for a random seed.
	 */
	public static void requireSeed(long seed) {
		requireAtLeast("seed", seed, -1);
	}

	/**
	 * Denoising strength in [0, 1]; with an init image a strength of 0 would return the input unchanged.
	 */
	public static void requireStrength(float strength, boolean hasInitImage) {
		requireRange("strength", strength, 0.0f, 1.0f);
		if (hasInitImage && strength <= 0.0f) {
			throw new ValidationException("strength", "must be greater than 0 when an init image is given", strength);
		}
	}
}
