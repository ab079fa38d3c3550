package de.kherud.edge.request;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Timed transcript segments.
 */
public record TranscriptionResult(List<Segment> segments) {

	public TranscriptionResult {
		segments = List.copyOf(segments);
	}

	public String text() {
		return segments.stream().map(Segment::text).map(String::trim).collect(Collectors.joining(" "));
	}

	/**
	 * @param startMillis segment start relative to the audio start
	 * @param endMillis   segment end relative to the audio start
	 * @param text        recognized text
	 */
	public record Segment(long startMillis, long endMillis, String text) {
	}
}
