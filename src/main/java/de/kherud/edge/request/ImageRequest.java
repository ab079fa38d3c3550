package de.kherud.edge.request;

/**
 * Text-to-image diffusion, optionally starting from an init image.
 */
public final class ImageRequest extends DiffusionRequest<ImageResult> {

	private ImageRequest(Builder builder) {
		super(builder);
	}

	public static Builder builder(String prompt) {
		return new Builder(prompt);
	}

	@Override
	public Operation getOperation() {
		return Operation.TEXT_TO_IMAGE;
	}

	@Override
	public String unitName() {
		return "images";
	}

	@Override
	public long producedUnits(ImageResult result) {
		return 1;
	}

	public static class Builder extends DiffusionRequest.Builder<Builder> {

		public Builder(String prompt) {
			super(prompt, 512, 20);
		}

		public ImageRequest build() {
			return new ImageRequest(this);
		}
	}
}
