package de.kherud.edge.engine;

import de.kherud.edge.ModelFamily;
import de.kherud.edge.request.Operation;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * What is known about a loaded model without parsing its weights: the family, the operations it supports and the
 * parameter class detected from the file name.
 */
public final class ModelMetadata {

	/** Parameter class whose video models are limited to {@link #REDUCED_MAX_VIDEO_FRAMES}. */
	public static final String PARAMS_5B = "5B";
	public static final String PARAMS_14B = "14B";
	public static final int REDUCED_MAX_VIDEO_FRAMES = 32;

	// parameter classes must stand as their own name token, so "1.5b" or "15b" is not read as 5B
	private static final Pattern PARAMS_1_3B_PATTERN = Pattern.compile("(^|[-_])1[._]3_?b([-_.]|$)");
	private static final Pattern PARAMS_14B_PATTERN = Pattern.compile("(^|[-_])14_?b([-_.]|$)");
	private static final Pattern PARAMS_5B_PATTERN = Pattern.compile("(^|[-_])5_?b([-_.]|$)");

	private final ModelFamily family;
	private final String fileName;
	@Nullable
	private final String parameterCount;
	private final long estimatedSizeBytes;

	public ModelMetadata(ModelFamily family, String fileName, @Nullable String parameterCount, long estimatedSizeBytes) {
		this.family = family;
		this.fileName = fileName;
		this.parameterCount = parameterCount;
		this.estimatedSizeBytes = estimatedSizeBytes;
	}

	/**
	 * Builds metadata from the weight file name, e.g. {@code wan2.1-t2v-1.3b-q4.gguf} yields parameter class
	 * {@code 1.3B}.
	 */
	public static ModelMetadata detect(ModelFamily family, String fileName, long estimatedSizeBytes) {
		return new ModelMetadata(family, fileName, detectParameterCount(fileName), estimatedSizeBytes);
	}

	@Nullable
	static String detectParameterCount(String fileName) {
		String name = fileName.toLowerCase(Locale.ROOT);
		if (PARAMS_1_3B_PATTERN.matcher(name).find()) {
			return "1.3B";
		}
		if (PARAMS_14B_PATTERN.matcher(name).find()) {
			return PARAMS_14B;
		}
		if (PARAMS_5B_PATTERN.matcher(name).find()) {
			return PARAMS_5B;
		}
		return null;
	}

	public ModelFamily getFamily() {
		return family;
	}

	public Set<Operation> getSupportedOperations() {
		return family.getOperations();
	}

	public boolean supports(Operation operation) {
		return family.supports(operation);
	}

	public String getFileName() {
		return fileName;
	}

	@Nullable
	public String getParameterCount() {
		return parameterCount;
	}

	public long getEstimatedSizeBytes() {
		return estimatedSizeBytes;
	}

	/**
	 * 14B video models need desktop class memory and are rejected before loading.
	 */
	public boolean isMobileSupported() {
		return !(family == ModelFamily.VIDEO_DIFFUSION && PARAMS_14B.equals(parameterCount));
	}

	/**
	 * Largest frame count a video model of this parameter class accepts.
	 */
	public int getMaxVideoFrames(int defaultMax) {
		return PARAMS_5B.equals(parameterCount) ? Math.min(defaultMax, REDUCED_MAX_VIDEO_FRAMES) : defaultMax;
	}

	@Override
	public String toString() {
		return "ModelMetadata{" + family + ", " + fileName + (parameterCount != null ? ", " + parameterCount : "")
			+ ", " + estimatedSizeBytes / (1024 * 1024) + "MB}";
	}
}
