package de.kherud.edge.plan;

import de.kherud.edge.ModelFamily;
import de.kherud.edge.memory.MemorySnapshot;
import org.jetbrains.annotations.Nullable;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Chooses between eager and staged loading from live memory pressure and derives the rest of the
 * {@link LoadPlan}.
 * <p>
 * Two independent signals decide staging. The device signal looks at system RAM, the process signal at the
 * managed heap headroom. A staged plan is returned when either fires, so staging never flips back to eager as
 * memory gets scarcer. Prefer-performance mode only honours the severe form of the device signal and ignores
 * the heap.
 */
public class LoadStrategySelector {

	private static final System.Logger logger = System.getLogger(LoadStrategySelector.class.getName());

	private static final long MB = 1024L * 1024L;
	private static final long GB = 1024L * MB;

	static final double LOW_AVAILABLE_FRACTION = 0.15;
	static final long LOW_TOTAL_MEMORY = 8L * GB;
	static final double MODEL_TO_AVAILABLE_RATIO = 0.60;

	static final double CRITICAL_AVAILABLE_FRACTION = 0.05;
	static final long CRITICAL_TOTAL_MEMORY = 4L * GB;
	static final double CRITICAL_MODEL_TO_AVAILABLE_RATIO = 0.90;

	static final double HEAP_HEADROOM_FACTOR = 1.4;

	static final int CONSERVATIVE_THREAD_CAP = 2;
	static final int MIN_GPU_PIXELS = 256 * 256;

	private final CpuTopology topology;

	public LoadStrategySelector() {
		this(CpuTopology.detect());
	}

	public LoadStrategySelector(CpuTopology topology) {
		this.topology = topology;
	}

	/**
	 * Family-neutral plan selection.
	 *
	 * @param modelSizeEstimate estimated resident size of the weights in bytes
	 * @param snapshot          current memory reading
	 * @param preferPerformance relax the memory heuristics in favour of speed
	 * @param explicitOverride  {@code TRUE}/{@code FALSE} forces staged/eager, {@code null} decides from memory
	 */
	public LoadPlan selectPlan(long modelSizeEstimate, MemorySnapshot snapshot, boolean preferPerformance,
							   @Nullable Boolean explicitOverride) {
		LoadOptions options = LoadOptions.builder()
			.preferPerformance(preferPerformance)
			.forceStaged(explicitOverride)
			.build();
		return selectPlan(null, modelSizeEstimate, snapshot, options);
	}

	/**
	 * Computes the plan for loading a model of {@code family}. Never throws: any failure while deriving the plan
	 * yields {@link #conservativePlan(String)}.
	 */
	public LoadPlan selectPlan(@Nullable ModelFamily family, long modelSizeEstimate, MemorySnapshot snapshot,
							   LoadOptions options) {
		try {
			LoadPlan plan = computePlan(family, modelSizeEstimate, snapshot, options);
			logger.log(DEBUG, "Load plan for " + family + " (" + modelSizeEstimate / MB + "MB, " + snapshot + "): " + plan);
			return plan;
		}
		catch (RuntimeException e) {
			logger.log(WARNING, "Falling back to conservative load plan", e);
			return conservativePlan("plan selection failed: " + e.getMessage());
		}
	}

	private LoadPlan computePlan(@Nullable ModelFamily family, long modelSize, MemorySnapshot snapshot,
								 LoadOptions options) {
		boolean preferPerformance = options.isPreferPerformance();

		boolean staged;
		String reason;
		if (options.getForceStaged() != null) {
			staged = options.getForceStaged();
			reason = "explicit override (" + (staged ? "staged" : "eager") + ")";
		}
		else {
			reason = stagingReason(modelSize, snapshot, preferPerformance);
			staged = reason != null;
			if (reason == null) {
				reason = "sufficient memory";
			}
		}

		int threads = options.getThreadCount() > 0 ? options.getThreadCount() : topology.optimalThreads(family);
		if (!preferPerformance) {
			threads = Math.min(threads, CONSERVATIVE_THREAD_CAP);
		}
		threads = Math.max(1, threads);

		boolean gpu = preferPerformance || options.isForceGpu();
		int pixels = options.getTargetWidth() * options.getTargetHeight();
		if (gpu && pixels > 0 && pixels < MIN_GPU_PIXELS) {
			gpu = false;
		}

		int contextSize = family == ModelFamily.TEXT ? contextSizeForHeap(snapshot.processHeapMax(), options.getContextSize()) : 0;

		return new LoadPlan(
			staged ? LoadPlan.Strategy.STAGED : LoadPlan.Strategy.EAGER,
			threads,
			gpu,
			true,
			preferPerformance && !staged,
			staged,
			staged,
			options.isFlashAttention(),
			contextSize,
			reason
		);
	}

	/**
	 * Whether memory pressure alone asks for staged loading.
	 */
	public boolean shouldStage(long modelSizeEstimate, MemorySnapshot snapshot, boolean preferPerformance) {
		return stagingReason(modelSizeEstimate, snapshot, preferPerformance) != null;
	}

	@Nullable
	private static String stagingReason(long modelSize, MemorySnapshot snapshot, boolean preferPerformance) {
		long total = snapshot.totalDeviceMemory();
		long available = snapshot.availableDeviceMemory();

		double availableFraction = preferPerformance ? CRITICAL_AVAILABLE_FRACTION : LOW_AVAILABLE_FRACTION;
		long totalFloor = preferPerformance ? CRITICAL_TOTAL_MEMORY : LOW_TOTAL_MEMORY;
		double modelRatio = preferPerformance ? CRITICAL_MODEL_TO_AVAILABLE_RATIO : MODEL_TO_AVAILABLE_RATIO;

		if (available < total * availableFraction) {
			return "device memory low (" + available / MB + "MB of " + total / MB + "MB available)";
		}
		if (total < totalFloor) {
			return "low memory device (" + total / MB + "MB total)";
		}
		if (modelSize > available * modelRatio) {
			return "model (" + modelSize / MB + "MB) exceeds " + Math.round(modelRatio * 100) + "% of available memory";
		}
		if (!preferPerformance && snapshot.heapHeadroom() < modelSize * HEAP_HEADROOM_FACTOR) {
			return "heap headroom (" + snapshot.heapHeadroom() / MB + "MB) below " + HEAP_HEADROOM_FACTOR + "x model size";
		}
		return null;
	}

	/**
	 * Staged, single threaded, CPU only. Used whenever the regular selection cannot be trusted.
	 */
	public static LoadPlan conservativePlan(String reason) {
		return new LoadPlan(LoadPlan.Strategy.STAGED, 1, false, true, false, true, true, false, 0, reason);
	}

	/**
	 * Clamps a requested text context size to what the heap can hold. A request of 0 yields the cap itself.
	 */
	public static int contextSizeForHeap(long heapMaxBytes, int requested) {
		long heapMb = heapMaxBytes / MB;
		int cap;
		if (heapMb <= 256) {
			cap = 2048;
		}
		else if (heapMb <= 384) {
			cap = 4096;
		}
		else if (heapMb <= 512) {
			cap = 6144;
		}
		else {
			cap = 8192;
		}
		return requested > 0 ? Math.min(requested, cap) : cap;
	}
}
