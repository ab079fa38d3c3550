package de.kherud.edge.request;

/**
 * Kind of work a request asks a loaded model to do. Each {@link de.kherud.edge.ModelFamily} supports a fixed
 * subset of these.
 */
public enum Operation {
	COMPLETION,
	EMBEDDING,
	TEXT_TO_IMAGE,
	TEXT_TO_VIDEO,
	TRANSCRIPTION
}
