package de.kherud.edge;

import de.kherud.edge.request.Operation;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Category of native engine. Families differ in memory footprint and in the operations their handles support.
 */
public enum ModelFamily {
	TEXT(true, EnumSet.of(Operation.COMPLETION, Operation.EMBEDDING)),
	EMBEDDING(false, EnumSet.of(Operation.EMBEDDING)),
	IMAGE_DIFFUSION(true, EnumSet.of(Operation.TEXT_TO_IMAGE)),
	VIDEO_DIFFUSION(true, EnumSet.of(Operation.TEXT_TO_VIDEO)),
	TRANSCRIPTION(false, EnumSet.of(Operation.TRANSCRIPTION));

	private final boolean heavy;
	private final Set<Operation> operations;

	ModelFamily(boolean heavy, Set<Operation> operations) {
		this.heavy = heavy;
		this.operations = Collections.unmodifiableSet(operations);
	}

	/**
	 * Heavy families (large-context text and diffusion) are not kept resident next to each other.
	 */
	public boolean isHeavy() {
		return heavy;
	}

	public Set<Operation> getOperations() {
		return operations;
	}

	public boolean supports(Operation operation) {
		return operations.contains(operation);
	}

	/**
	 * Whether loading a model of this family should evict the models of {@code other} first.
	 */
	public boolean conflictsWith(ModelFamily other) {
		return other != this && heavy && other.heavy;
	}

	public boolean isDiffusion() {
		return this == IMAGE_DIFFUSION || this == VIDEO_DIFFUSION;
	}
}
