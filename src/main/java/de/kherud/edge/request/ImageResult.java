package de.kherud.edge.request;

/**
 * Generated image as packed RGB bytes.
 */
public record ImageResult(byte[] rgb, int width, int height) {

	public ImageResult {
		if (rgb.length != width * height * 3) {
			throw new IllegalArgumentException("Expected " + width * height * 3 + " RGB bytes but got " + rgb.length);
		}
	}
}
