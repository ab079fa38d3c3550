package de.kherud.edge.request;

import de.kherud.edge.validation.ParameterValidator;

/**
 * Embedding of one input text. Served by embedding models and by text models.
 */
public final class EmbeddingRequest implements GenerationRequest<float[]> {

	private final String input;
	private final boolean normalize;

	public EmbeddingRequest(String input) {
		this(input, true);
	}

	public EmbeddingRequest(String input, boolean normalize) {
		this.input = input;
		this.normalize = normalize;
	}

	@Override
	public Operation getOperation() {
		return Operation.EMBEDDING;
	}

	@Override
	public void validate() {
		ParameterValidator.requireNotBlank("input", input);
	}

	@Override
	public String unitName() {
		return "vectors";
	}

	@Override
	public long producedUnits(float[] result) {
		return result.length > 0 ? 1 : 0;
	}

	public String getInput() {
		return input;
	}

	public boolean isNormalize() {
		return normalize;
	}
}
