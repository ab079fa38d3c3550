package de.kherud.edge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.kherud.edge.cache.FamilyBudget;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Settings of a {@link ModelLifecycleManager}.
 * <p>
 * Built in code through {@link #builder()} or read from JSON:
 * <pre>{@code
 * {
 *   "preferPerformance": false,
 *   "crossFamilyEviction": true,
 *   "retainInactiveModels": false,
 *   "memoryFloorMb": 512,
 *   "releasePauseMillis": 100,
 *   "workerThreads": 2,
 *   "budgets": {
 *     "VIDEO_DIFFUSION": { "maxEntries": 1, "maxMemoryMb": 6144 }
 *   }
 * }
 * }</pre>
 * Missing keys keep their defaults.
 */
public final class LifecycleConfig {

	public static final String DEFAULT_RESOURCE = "llama-edge.json";

	private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
	private static final long MB = 1024L * 1024L;

	private final boolean preferPerformance;
	private final boolean crossFamilyEviction;
	private final boolean retainInactiveModels;
	private final long memoryFloorBytes;
	private final long releasePauseMillis;
	private final int workerThreads;
	private final Map<ModelFamily, FamilyBudget> budgets;

	private LifecycleConfig(Builder builder) {
		this.preferPerformance = builder.preferPerformance;
		this.crossFamilyEviction = builder.crossFamilyEviction;
		this.retainInactiveModels = builder.retainInactiveModels;
		this.memoryFloorBytes = builder.memoryFloorBytes;
		this.releasePauseMillis = builder.releasePauseMillis;
		this.workerThreads = builder.workerThreads;
		this.budgets = Collections.unmodifiableMap(new EnumMap<>(builder.budgets));
	}

	public static Builder builder() {
		return new Builder();
	}

	public static LifecycleConfig defaults() {
		return builder().build();
	}

	public static LifecycleConfig load(Path path) throws IOException {
		try (InputStream in = Files.newInputStream(path)) {
			return fromJson(in);
		}
	}

	public static LifecycleConfig fromJson(InputStream in) throws IOException {
		return fromJson(OBJECT_MAPPER.readTree(in));
	}

	public static LifecycleConfig fromJson(String json) throws IOException {
		return fromJson(OBJECT_MAPPER.readTree(json));
	}

	/**
	 * Reads {@value #DEFAULT_RESOURCE} from the classpath, falling back to {@link #defaults()} when absent.
	 */
	public static LifecycleConfig loadDefault() {
		try (InputStream in = LifecycleConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
			return in == null ? defaults() : fromJson(in);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	static LifecycleConfig fromJson(JsonNode root) {
		if (root == null || !root.isObject()) {
			throw new IllegalArgumentException("Lifecycle configuration must be a JSON object");
		}
		Builder builder = builder();
		if (root.has("preferPerformance")) builder.preferPerformance(root.get("preferPerformance").asBoolean());
		if (root.has("crossFamilyEviction")) builder.crossFamilyEviction(root.get("crossFamilyEviction").asBoolean());
		if (root.has("retainInactiveModels")) builder.retainInactiveModels(root.get("retainInactiveModels").asBoolean());
		if (root.has("memoryFloorMb")) builder.memoryFloorMb(root.get("memoryFloorMb").asLong());
		if (root.has("releasePauseMillis")) builder.releasePauseMillis(root.get("releasePauseMillis").asLong());
		if (root.has("workerThreads")) builder.workerThreads(root.get("workerThreads").asInt());

		JsonNode budgetsNode = root.get("budgets");
		if (budgetsNode != null) {
			Iterator<Map.Entry<String, JsonNode>> fields = budgetsNode.fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> field = fields.next();
				ModelFamily family;
				try {
					family = ModelFamily.valueOf(field.getKey().toUpperCase(Locale.ROOT));
				}
				catch (IllegalArgumentException e) {
					throw new IllegalArgumentException("Unknown model family in budgets: " + field.getKey(), e);
				}
				JsonNode budget = field.getValue();
				FamilyBudget current = builder.budgets.getOrDefault(family, FamilyBudget.DEFAULT);
				int maxEntries = budget.has("maxEntries") ? budget.get("maxEntries").asInt() : current.maxEntries();
				long maxBytes = budget.has("maxMemoryMb") ? budget.get("maxMemoryMb").asLong() * MB : current.maxBytes();
				builder.budget(family, new FamilyBudget(maxEntries, maxBytes));
			}
		}
		return builder.build();
	}

	public boolean isPreferPerformance() {
		return preferPerformance;
	}

	/**
	 * Whether loading a heavy family unloads the other resident heavy families first.
	 */
	public boolean isCrossFamilyEviction() {
		return crossFamilyEviction;
	}

	/**
	 * Whether switching a family to another model keeps the previous one cached.
	 */
	public boolean isRetainInactiveModels() {
		return retainInactiveModels;
	}

	public long getMemoryFloorBytes() {
		return memoryFloorBytes;
	}

	public long getReleasePauseMillis() {
		return releasePauseMillis;
	}

	public int getWorkerThreads() {
		return workerThreads;
	}

	public Map<ModelFamily, FamilyBudget> getBudgets() {
		return budgets;
	}

	public FamilyBudget getBudget(ModelFamily family) {
		return budgets.getOrDefault(family, FamilyBudget.DEFAULT);
	}

	@Override
	public String toString() {
		return "LifecycleConfig{preferPerformance=" + preferPerformance + ", crossFamilyEviction=" + crossFamilyEviction
			+ ", retainInactiveModels=" + retainInactiveModels + ", memoryFloor=" + memoryFloorBytes / MB + "MB"
			+ ", releasePause=" + releasePauseMillis + "ms, workerThreads=" + workerThreads + ", budgets=" + budgets + "}";
	}

	public static class Builder {
		private boolean preferPerformance;
		private boolean crossFamilyEviction = true;
		private boolean retainInactiveModels;
		private long memoryFloorBytes;
		private long releasePauseMillis = 100;
		private int workerThreads = 2;
		private final Map<ModelFamily, FamilyBudget> budgets = new EnumMap<>(ModelFamily.class);

		public Builder preferPerformance(boolean preferPerformance) {
			this.preferPerformance = preferPerformance;
			return this;
		}

		public Builder crossFamilyEviction(boolean crossFamilyEviction) {
			this.crossFamilyEviction = crossFamilyEviction;
			return this;
		}

		public Builder retainInactiveModels(boolean retainInactiveModels) {
			this.retainInactiveModels = retainInactiveModels;
			return this;
		}

		public Builder memoryFloorMb(long memoryFloorMb) {
			if (memoryFloorMb < 0) {
				throw new IllegalArgumentException("memoryFloorMb cannot be negative: " + memoryFloorMb);
			}
			this.memoryFloorBytes = memoryFloorMb * MB;
			return this;
		}

		/**
		 * Pause after requesting garbage collection before a native load or after an unload. 0 disables the pause.
		 */
		public Builder releasePauseMillis(long releasePauseMillis) {
			if (releasePauseMillis < 0) {
				throw new IllegalArgumentException("releasePauseMillis cannot be negative: " + releasePauseMillis);
			}
			this.releasePauseMillis = releasePauseMillis;
			return this;
		}

		public Builder workerThreads(int workerThreads) {
			if (workerThreads < 1) {
				throw new IllegalArgumentException("workerThreads must be at least 1: " + workerThreads);
			}
			this.workerThreads = workerThreads;
			return this;
		}

		public Builder budget(ModelFamily family, FamilyBudget budget) {
			this.budgets.put(family, budget);
			return this;
		}

		public Builder budget(ModelFamily family, int maxEntries, long maxMemoryMb) {
			return budget(family, FamilyBudget.ofMegabytes(maxEntries, maxMemoryMb));
		}

		public LifecycleConfig build() {
			return new LifecycleConfig(this);
		}
	}
}
