package de.kherud.edge.request;

import de.kherud.edge.validation.ValidationException;
import org.jetbrains.annotations.Nullable;

/**
 * Speech-to-text over mono PCM samples in [-1, 1].
 */
public final class TranscriptionRequest implements GenerationRequest<TranscriptionResult> {

	public static final int SAMPLE_RATE = 16000;

	private final float[] samples;
	private final int sampleRate;
	@Nullable
	private final String language;
	private final boolean translate;

	public TranscriptionRequest(float[] samples) {
		this(samples, SAMPLE_RATE, null, false);
	}

	/**
	 * @param language  ISO 639-1 code, {@code null} for auto-detection
	 * @param translate translate the transcript to English
	 */
	public TranscriptionRequest(float[] samples, int sampleRate, @Nullable String language, boolean translate) {
		this.samples = samples;
		this.sampleRate = sampleRate;
		this.language = language;
		this.translate = translate;
	}

	@Override
	public Operation getOperation() {
		return Operation.TRANSCRIPTION;
	}

	@Override
	public void validate() {
		if (samples == null || samples.length == 0) {
			throw new ValidationException("samples", "must not be empty", samples == null ? null : 0);
		}
		if (sampleRate != SAMPLE_RATE) {
			throw new ValidationException("sampleRate", "must be " + SAMPLE_RATE + " Hz", sampleRate);
		}
	}

	@Override
	public String unitName() {
		return "segments";
	}

	@Override
	public long producedUnits(TranscriptionResult result) {
		return result.segments().size();
	}

	public float[] getSamples() {
		return samples;
	}

	public int getSampleRate() {
		return sampleRate;
	}

	@Nullable
	public String getLanguage() {
		return language;
	}

	public boolean isTranslate() {
		return translate;
	}

	public long getDurationMillis() {
		return samples.length * 1000L / sampleRate;
	}
}
