package de.kherud.edge.request;

import java.util.List;

/**
 * Generated video as a list of packed RGB frames.
 */
public record VideoResult(List<byte[]> frames, int width, int height) {

	public VideoResult {
		frames = List.copyOf(frames);
	}

	public int frameCount() {
		return frames.size();
	}
}
