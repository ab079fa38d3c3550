package de.kherud.edge;

import org.jetbrains.annotations.Nullable;

/**
 * A model could not be loaded: the native engine returned no handle, or a required weight file is missing.
 * Not retried; the slot is reset to {@link SlotState#UNLOADED}.
 */
public class LoadFailureException extends EdgeException {

	@Nullable
	private final ModelIdentity identity;

	public LoadFailureException(String message, @Nullable ModelIdentity identity) {
		super(message);
		this.identity = identity;
	}

	public LoadFailureException(String message, @Nullable ModelIdentity identity, Throwable cause) {
		super(message, cause);
		this.identity = identity;
	}

	@Nullable
	public ModelIdentity getIdentity() {
		return identity;
	}
}
