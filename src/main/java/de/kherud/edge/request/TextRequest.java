package de.kherud.edge.request;

import de.kherud.edge.validation.ParameterValidator;
import de.kherud.edge.validation.ValidationException;
import org.jetbrains.annotations.Nullable;

/**
 * Text completion.
 */
public final class TextRequest implements GenerationRequest<TextResult> {

	public static final int UNLIMITED_TOKENS = -1;
	public static final int MAX_TOKENS = 32768;

	private final String prompt;
	@Nullable
	private final String systemPrompt;
	private final int maxTokens;
	private final float temperature;
	private final float topP;

	private TextRequest(Builder builder) {
		this.prompt = builder.prompt;
		this.systemPrompt = builder.systemPrompt;
		this.maxTokens = builder.maxTokens;
		this.temperature = builder.temperature;
		this.topP = builder.topP;
	}

	public static TextRequest of(String prompt) {
		return builder(prompt).build();
	}

	public static Builder builder(String prompt) {
		return new Builder(prompt);
	}

	@Override
	public Operation getOperation() {
		return Operation.COMPLETION;
	}

	@Override
	public void validate() {
		ParameterValidator.requireNotBlank("prompt", prompt);
		if (maxTokens != UNLIMITED_TOKENS && (maxTokens < 1 || maxTokens > MAX_TOKENS)) {
			throw new ValidationException("maxTokens", "must be -1 or between 1 and " + MAX_TOKENS, maxTokens);
		}
		ParameterValidator.requireRange("temperature", temperature, 0.0f, 2.0f);
		ParameterValidator.requireRange("topP", topP, 0.0f, 1.0f);
	}

	@Override
	public String unitName() {
		return "tokens";
	}

	@Override
	public long producedUnits(TextResult result) {
		return result.tokenCount();
	}

	public String getPrompt() {
		return prompt;
	}

	@Nullable
	public String getSystemPrompt() {
		return systemPrompt;
	}

	public int getMaxTokens() {
		return maxTokens;
	}

	public float getTemperature() {
		return temperature;
	}

	public float getTopP() {
		return topP;
	}

	public static class Builder {
		private final String prompt;
		private String systemPrompt;
		private int maxTokens = 256;
		private float temperature = 0.7f;
		private float topP = 0.9f;

		public Builder(String prompt) {
			this.prompt = prompt;
		}

		public Builder systemPrompt(@Nullable String systemPrompt) { this.systemPrompt = systemPrompt; return this; }
		public Builder maxTokens(int maxTokens) { this.maxTokens = maxTokens; return this; }
		public Builder temperature(float temperature) { this.temperature = temperature; return this; }
		public Builder topP(float topP) { this.topP = topP; return this; }

		public TextRequest build() {
			return new TextRequest(this);
		}
	}
}
