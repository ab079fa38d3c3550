package de.kherud.edge;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Canonical identity of a loadable model: the primary weight file plus the optional component files
 * (VAE, text encoder, auxiliary decoder) loaded with it.
 * <p>
 * Two identities are equal only if every component matches exactly, absence included. A model loaded with and
 * without a VAE are therefore two different cache entries.
 */
public final class ModelIdentity {

	private final String primaryPath;
	@Nullable
	private final String vaePath;
	@Nullable
	private final String textEncoderPath;
	@Nullable
	private final String auxiliaryDecoderPath;

	private ModelIdentity(Builder builder) {
		this.primaryPath = builder.primaryPath;
		this.vaePath = builder.vaePath;
		this.textEncoderPath = builder.textEncoderPath;
		this.auxiliaryDecoderPath = builder.auxiliaryDecoderPath;
	}

	public static ModelIdentity of(String primaryPath) {
		return builder(primaryPath).build();
	}

	public static Builder builder(String primaryPath) {
		return new Builder(primaryPath);
	}

	/**
	 * Resolves a (repo-id, filename) pair to the absolute path the download collaborator stores it at,
	 * {@code <root>/<repo id with '/' replaced by '_'>/<filename>}.
	 */
	public static ModelIdentity ofRepoFile(Path modelRoot, String repoId, String filename) {
		return of(resolveRepoFile(modelRoot, repoId, filename));
	}

	public static String resolveRepoFile(Path modelRoot, String repoId, String filename) {
		if (repoId == null || repoId.isBlank()) {
			throw new IllegalArgumentException("Repository id cannot be blank");
		}
		if (filename == null || filename.isBlank()) {
			throw new IllegalArgumentException("Filename cannot be blank");
		}
		return modelRoot.resolve(repoId.replace('/', '_')).resolve(filename).toAbsolutePath().toString();
	}

	@NotNull
	public String getPrimaryPath() {
		return primaryPath;
	}

	@Nullable
	public String getVaePath() {
		return vaePath;
	}

	@Nullable
	public String getTextEncoderPath() {
		return textEncoderPath;
	}

	@Nullable
	public String getAuxiliaryDecoderPath() {
		return auxiliaryDecoderPath;
	}

	/**
	 * Component paths other than the primary one, in native argument order (vae, text encoder, decoder).
	 * Absent components are skipped.
	 */
	public List<String> getAuxiliaryPaths() {
		List<String> paths = new ArrayList<>(3);
		if (vaePath != null) paths.add(vaePath);
		if (textEncoderPath != null) paths.add(textEncoderPath);
		if (auxiliaryDecoderPath != null) paths.add(auxiliaryDecoderPath);
		return Collections.unmodifiableList(paths);
	}

	/**
	 * All files that must exist on disk for this model to load.
	 */
	public List<String> getAllPaths() {
		List<String> paths = new ArrayList<>(4);
		paths.add(primaryPath);
		paths.addAll(getAuxiliaryPaths());
		return paths;
	}

	/**
	 * File name of the primary weights, used for filename based metadata detection.
	 */
	public String getFileName() {
		int slash = Math.max(primaryPath.lastIndexOf('/'), primaryPath.lastIndexOf('\\'));
		return slash >= 0 ? primaryPath.substring(slash + 1) : primaryPath;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ModelIdentity)) return false;
		ModelIdentity that = (ModelIdentity) o;
		return primaryPath.equals(that.primaryPath)
			&& Objects.equals(vaePath, that.vaePath)
			&& Objects.equals(textEncoderPath, that.textEncoderPath)
			&& Objects.equals(auxiliaryDecoderPath, that.auxiliaryDecoderPath);
	}

	@Override
	public int hashCode() {
		return Objects.hash(primaryPath, vaePath, textEncoderPath, auxiliaryDecoderPath);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("ModelIdentity{").append(primaryPath);
		if (vaePath != null) sb.append(", vae=").append(vaePath);
		if (textEncoderPath != null) sb.append(", textEncoder=").append(textEncoderPath);
		if (auxiliaryDecoderPath != null) sb.append(", decoder=").append(auxiliaryDecoderPath);
		return sb.append('}').toString();
	}

	public static class Builder {
		private final String primaryPath;
		private String vaePath;
		private String textEncoderPath;
		private String auxiliaryDecoderPath;

		public Builder(String primaryPath) {
			if (primaryPath == null || primaryPath.isBlank()) {
				throw new IllegalArgumentException("Primary model path cannot be blank");
			}
			this.primaryPath = primaryPath;
		}

		public Builder vae(@Nullable String path) { this.vaePath = path; return this; }
		public Builder textEncoder(@Nullable String path) { this.textEncoderPath = path; return this; }
		public Builder auxiliaryDecoder(@Nullable String path) { this.auxiliaryDecoderPath = path; return this; }

		public ModelIdentity build() {
			return new ModelIdentity(this);
		}
	}
}
