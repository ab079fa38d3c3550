package de.kherud.edge;

import de.kherud.edge.cache.CacheEntry;
import de.kherud.edge.cache.CacheStats;
import de.kherud.edge.cache.FamilyBudget;
import de.kherud.edge.cache.ModelCache;
import de.kherud.edge.engine.ModelMetadata;
import de.kherud.edge.engine.NativeEngine;
import de.kherud.edge.engine.NativeEngineHandle;
import de.kherud.edge.generation.GenerationCoordinator;
import de.kherud.edge.generation.GenerationMetrics;
import de.kherud.edge.generation.GenerationOutcome;
import de.kherud.edge.generation.MetricsSnapshot;
import de.kherud.edge.generation.ProgressListener;
import de.kherud.edge.memory.MemoryProbe;
import de.kherud.edge.memory.MemoryProvider;
import de.kherud.edge.memory.MemorySnapshot;
import de.kherud.edge.memory.SystemMemoryProbe;
import de.kherud.edge.plan.LoadOptions;
import de.kherud.edge.plan.LoadPlan;
import de.kherud.edge.plan.LoadStrategySelector;
import de.kherud.edge.request.GenerationRequest;
import de.kherud.edge.request.VideoRequest;
import de.kherud.edge.validation.ValidationException;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Entry point for running on-device models. Owns the model cache, one slot per {@link ModelFamily} and the
 * generation coordinator.
 * <p>
 * A generation call goes through these steps:
 * <ol>
 *     <li>the request is validated and checked against the family's operations, without touching native code</li>
 *     <li>conflicting heavy families are unloaded, each under its own generation lock</li>
 *     <li>the family's generation lock is taken</li>
 *     <li>the model is taken from the cache or loaded with a plan chosen from the current memory reading</li>
 *     <li>the request runs natively inside a cancellable session</li>
 *     <li>metrics are recorded and the lock is released</li>
 * </ol>
 * Generation locks are never nested, so concurrent calls for different families cannot deadlock.
 * <p>
 * Instances are independent; nothing is shared between managers.
 */
public class ModelLifecycleManager implements AutoCloseable {

	private static final System.Logger logger = System.getLogger(ModelLifecycleManager.class.getName());
	private static final long MB = 1024L * 1024L;

	private final NativeEngine engine;
	private final LifecycleConfig config;
	private final MemoryProbe memoryProbe;
	private final LoadStrategySelector selector;
	private final ModelCache cache;
	private final GenerationCoordinator coordinator;
	private final ExecutorService workerPool;
	@Nullable
	private final ExecutorService ownedCallbackExecutor;

	private final Map<ModelFamily, Slot> slots = new EnumMap<>(ModelFamily.class);
	private final ReadWriteLock slotsLock = new ReentrantReadWriteLock();

	private final AtomicReference<MetricsSnapshot> lastMetrics = new AtomicReference<>();
	private final Map<ModelFamily, MetricsSnapshot> lastMetricsByFamily = new ConcurrentHashMap<>();
	private volatile boolean closed = false;

	public ModelLifecycleManager(NativeEngine engine) {
		this(builder(engine));
	}

	public ModelLifecycleManager(NativeEngine engine, LifecycleConfig config) {
		this(builder(engine).config(config));
	}

	private ModelLifecycleManager(Builder builder) {
		this.engine = builder.engine;
		this.config = builder.config != null ? builder.config : LifecycleConfig.defaults();
		this.memoryProbe = builder.memoryProbe != null ? builder.memoryProbe : new SystemMemoryProbe();
		this.selector = builder.selector != null ? builder.selector : new LoadStrategySelector();

		Map<ModelFamily, FamilyBudget> budgets = new EnumMap<>(ModelFamily.class);
		for (ModelFamily family : ModelFamily.values()) {
			budgets.put(family, config.getBudget(family));
		}
		this.cache = new ModelCache(budgets);
		this.cache.setPreferPerformance(config.isPreferPerformance());
		if (builder.memoryProvider != null) {
			cache.setMemoryProvider(builder.memoryProvider, config.getMemoryFloorBytes());
		}
		else if (config.getMemoryFloorBytes() > 0) {
			cache.setMemoryProvider(MemoryProvider.of(memoryProbe), config.getMemoryFloorBytes());
		}

		Executor callbackExecutor = builder.callbackExecutor;
		if (callbackExecutor == null) {
			this.ownedCallbackExecutor = Executors.newSingleThreadExecutor(daemonThreadFactory("edge-progress-"));
			callbackExecutor = ownedCallbackExecutor;
		}
		else {
			this.ownedCallbackExecutor = null;
		}
		this.coordinator = new GenerationCoordinator(callbackExecutor);
		// a family locked by another thread may be generating on its cached handle
		this.cache.setBusyFamilyCheck(family ->
			coordinator.isLocked(family) && !coordinator.isLockHeldByCurrentThread(family));
		this.workerPool = Executors.newFixedThreadPool(config.getWorkerThreads(), daemonThreadFactory("edge-generation-"));

		for (ModelFamily family : ModelFamily.values()) {
			slots.put(family, new Slot());
		}
		logger.log(DEBUG, "Created lifecycle manager with " + config);
	}

	public static Builder builder(NativeEngine engine) {
		return new Builder(engine);
	}

	private static ThreadFactory daemonThreadFactory(String prefix) {
		return new ThreadFactory() {
			private final AtomicInteger counter = new AtomicInteger(0);

			@Override
			public Thread newThread(Runnable r) {
				Thread thread = new Thread(r);
				thread.setName(prefix + counter.getAndIncrement());
				thread.setDaemon(true);
				return thread;
			}
		};
	}

	// ------------------------------------------------------------------
	// Loading
	// ------------------------------------------------------------------

	/**
	 * Returns a ready handle for {@code identity}, loading it if needed. Conflicting heavy families are unloaded
	 * first, as for a generation call. Takes the family's generation lock, so it waits for a running generation of
	 * the same family.
	 *
	 * @throws LoadFailureException if a weight file is missing, the model is not supported on this device, or the
	 *                              native engine fails to load it
	 */
	public NativeEngineHandle ensureLoaded(ModelFamily family, ModelIdentity identity, LoadOptions options) {
		checkOpen();
		if (config.isCrossFamilyEviction()) {
			unloadConflictingFamilies(family);
		}
		return coordinator.withGenerationLock(family, () -> ensureLoadedLocked(family, identity, options).getHandle());
	}

	public NativeEngineHandle ensureLoaded(ModelFamily family, ModelIdentity identity) {
		return ensureLoaded(family, identity, LoadOptions.DEFAULT);
	}

	private CacheEntry ensureLoadedLocked(ModelFamily family, ModelIdentity identity, LoadOptions options) {
		CacheEntry cached = cache.get(identity);
		if (cached != null) {
			if (cached.getFamily() != family) {
				throw new LoadFailureException(identity + " is already loaded as a " + cached.getFamily() + " model", identity);
			}
			setSlot(family, identity, SlotState.READY);
			return cached;
		}

		ModelIdentity previous = slotIdentity(family);
		if (previous != null && !previous.equals(identity) && !config.isRetainInactiveModels()) {
			if (cache.remove(previous)) {
				logger.log(INFO, "Unloaded previous " + family + " model " + previous);
			}
		}

		setSlot(family, identity, SlotState.LOADING);
		try {
			CacheEntry entry = load(family, identity, options);
			setSlot(family, identity, SlotState.READY);
			return entry;
		}
		catch (RuntimeException e) {
			failSlot(family, identity, e);
			throw e;
		}
	}

	private CacheEntry load(ModelFamily family, ModelIdentity identity, LoadOptions options) {
		for (String path : identity.getAllPaths()) {
			if (!Files.isRegularFile(Paths.get(path))) {
				throw new LoadFailureException("Model file not found: " + path, identity);
			}
		}
		long size = estimateSize(identity);
		ModelMetadata metadata = ModelMetadata.detect(family, identity.getFileName(), size);
		if (!metadata.isMobileSupported()) {
			throw new LoadFailureException(metadata.getParameterCount() + " " + family
				+ " models are not supported on mobile devices, use a smaller variant", identity);
		}

		LoadOptions effective = options;
		if (config.isPreferPerformance() && !options.isPreferPerformance()) {
			effective = options.toBuilder().preferPerformance(true).build();
		}
		MemorySnapshot snapshot = memoryProbe.snapshot();
		LoadPlan plan = selector.selectPlan(family, size, snapshot, effective);
		logger.log(INFO, "Loading " + family + " model " + identity.getFileName() + " (" + size / MB + "MB): "
			+ plan.strategy() + ", " + plan.threadCount() + " threads, " + (plan.gpuOffload() ? "gpu" : "cpu")
			+ ", reason: " + plan.reason());

		releaseMemory();
		long start = System.nanoTime();
		long pointer = engine.load(family, identity.getPrimaryPath(), identity.getAuxiliaryPaths(),
			plan.threadCount(), plan.backendFlagMask());
		long loadMs = (System.nanoTime() - start) / 1_000_000L;
		if (pointer == 0) {
			String error = engine.lastError(0);
			throw new LoadFailureException("Native engine failed to load " + identity.getPrimaryPath()
				+ (error != null ? ": " + error : ""), identity);
		}
		NativeEngineHandle handle = new NativeEngineHandle(engine, pointer, metadata);
		logger.log(INFO, "Loaded " + identity.getFileName() + " in " + loadMs + "ms");
		return cache.put(identity, handle, size, loadMs, plan);
	}

	/**
	 * Engine estimate of the primary weights when available, otherwise the summed file sizes. Component files are
	 * always counted by their file size.
	 */
	private long estimateSize(ModelIdentity identity) {
		try {
			long primary = engine.estimateParameterMemory(identity.getPrimaryPath());
			if (primary <= 0) {
				primary = Files.size(Paths.get(identity.getPrimaryPath()));
			}
			long total = primary;
			for (String aux : identity.getAuxiliaryPaths()) {
				total += Files.size(Paths.get(aux));
			}
			return total;
		}
		catch (IOException e) {
			throw new LoadFailureException("Failed to read model file size for " + identity, identity, e);
		}
	}

	/**
	 * Unloads every model of {@code family}, waiting for a running generation of that family to finish.
	 *
	 * @return number of unloaded models
	 */
	public int unload(ModelFamily family) {
		checkOpen();
		return coordinator.withGenerationLock(family, () -> unloadLocked(family));
	}

	private int unloadLocked(ModelFamily family) {
		int removed = cache.removeFamily(family);
		setSlot(family, null, SlotState.UNLOADED);
		if (removed > 0) {
			logger.log(INFO, "Unloaded " + removed + " " + family + " model(s)");
			releaseMemory();
		}
		return removed;
	}

	private void releaseMemory() {
		long pause = config.getReleasePauseMillis();
		if (pause <= 0) {
			return;
		}
		System.gc();
		try {
			TimeUnit.MILLISECONDS.sleep(pause);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	// ------------------------------------------------------------------
	// Generation
	// ------------------------------------------------------------------

	public <R> GenerationOutcome<R> runGeneration(ModelFamily family, ModelIdentity identity, GenerationRequest<R> request) {
		return runGeneration(family, identity, LoadOptions.DEFAULT, request, ProgressListener.NONE);
	}

	public <R> GenerationOutcome<R> runGeneration(ModelFamily family, ModelIdentity identity, LoadOptions options,
												  GenerationRequest<R> request) {
		return runGeneration(family, identity, options, request, ProgressListener.NONE);
	}

	/**
	 * Runs {@code request} on the model {@code identity}, loading it first if needed. The native call runs on the
	 * calling thread.
	 *
	 * @throws ValidationException                if the request is invalid, before anything is loaded
	 * @throws UnsupportedModelOperationException if the family cannot serve the request, before anything is loaded
	 * @throws LoadFailureException               if the model cannot be loaded
	 */
	public <R> GenerationOutcome<R> runGeneration(ModelFamily family, ModelIdentity identity, LoadOptions options,
												  GenerationRequest<R> request, ProgressListener listener) {
		checkOpen();
		checkRequest(family, identity, request);
		return execute(family, identity, options, request, listener);
	}

	public <R> CompletableFuture<GenerationOutcome<R>> runGenerationAsync(ModelFamily family, ModelIdentity identity,
																		  GenerationRequest<R> request) {
		return runGenerationAsync(family, identity, LoadOptions.DEFAULT, request, ProgressListener.NONE);
	}

	/**
	 * Like {@link #runGeneration(ModelFamily, ModelIdentity, LoadOptions, GenerationRequest, ProgressListener)} but
	 * loads and generates on the manager's worker pool. Validation and operation checks still happen on the calling
	 * thread and throw directly.
	 */
	public <R> CompletableFuture<GenerationOutcome<R>> runGenerationAsync(ModelFamily family, ModelIdentity identity,
																		  LoadOptions options,
																		  GenerationRequest<R> request,
																		  ProgressListener listener) {
		checkOpen();
		checkRequest(family, identity, request);
		return CompletableFuture.supplyAsync(() -> execute(family, identity, options, request, listener), workerPool);
	}

	private void checkRequest(ModelFamily family, ModelIdentity identity, GenerationRequest<?> request) {
		request.validate();
		if (!family.supports(request.getOperation())) {
			throw new UnsupportedModelOperationException(family, request.getOperation());
		}
		if (request instanceof VideoRequest) {
			VideoRequest video = (VideoRequest) request;
			ModelMetadata metadata = ModelMetadata.detect(family, identity.getFileName(), 0);
			int maxFrames = metadata.getMaxVideoFrames(VideoRequest.MAX_VIDEO_FRAMES);
			if (video.getVideoFrames() > maxFrames) {
				throw new ValidationException("videoFrames", metadata.getParameterCount()
					+ " models support at most " + maxFrames + " frames", video.getVideoFrames());
			}
		}
	}

	private <R> GenerationOutcome<R> execute(ModelFamily family, ModelIdentity identity, LoadOptions options,
											 GenerationRequest<R> request, ProgressListener listener) {
		if (config.isCrossFamilyEviction()) {
			unloadConflictingFamilies(family);
		}
		LoadOptions effective = options;
		if (request.getTargetWidth() > 0 && options.getTargetWidth() == 0) {
			effective = options.toBuilder().targetSize(request.getTargetWidth(), request.getTargetHeight()).build();
		}
		LoadOptions loadOptions = effective;
		return coordinator.withGenerationLock(family, () -> generateLocked(family, identity, loadOptions, request, listener));
	}

	private void unloadConflictingFamilies(ModelFamily family) {
		for (ModelFamily other : ModelFamily.values()) {
			if (family.conflictsWith(other) && cache.familySize(other) > 0) {
				logger.log(INFO, "Unloading " + other + " models before loading " + family);
				coordinator.withGenerationLock(other, () -> unloadLocked(other));
			}
		}
	}

	private <R> GenerationOutcome<R> generateLocked(ModelFamily family, ModelIdentity identity, LoadOptions options,
													GenerationRequest<R> request, ProgressListener listener) {
		checkOpen();
		CacheEntry entry = ensureLoadedLocked(family, identity, options);
		NativeEngineHandle handle = entry.getHandle();
		if (!handle.getMetadata().supports(request.getOperation())) {
			throw new UnsupportedModelOperationException(handle.getFamily(), request.getOperation());
		}

		LoadPlan plan = entry.getLoadPlan();
		GenerationMetrics metrics = new GenerationMetrics(memoryProbe, family, request.getOperation(),
			plan != null && plan.gpuOffload(), plan != null ? plan.strategy().name() : "UNKNOWN");
		setSlot(family, identity, SlotState.GENERATING);
		GenerationOutcome<R> outcome;
		try {
			outcome = coordinator.generate(family, handle, request, listener, metrics);
		}
		catch (RuntimeException e) {
			failSlot(family, identity, e);
			throw e;
		}

		if (outcome.isFailed()) {
			failSlot(family, identity, outcome.getCause());
		}
		else {
			setSlot(family, identity, SlotState.READY);
		}
		outcome.getMetrics().ifPresent(snapshot -> {
			lastMetrics.set(snapshot);
			lastMetricsByFamily.put(family, snapshot);
			logger.log(DEBUG, family + " generation " + snapshot.status() + ": " + snapshot.toJson());
		});
		return outcome;
	}

	/**
	 * Requests cancellation of the running generation of {@code family}. Returns immediately.
	 *
	 * @return whether a new cancellation request was issued
	 */
	public boolean cancelGeneration(ModelFamily family) {
		return coordinator.cancelGeneration(family);
	}

	/**
	 * Requests cancellation of all running generations.
	 *
	 * @return number of generations that received a new request
	 */
	public int cancelGeneration() {
		return coordinator.cancelGeneration();
	}

	// ------------------------------------------------------------------
	// Slots
	// ------------------------------------------------------------------

	private static final class Slot {
		@Nullable
		ModelIdentity identity;
		SlotState state = SlotState.UNLOADED;
	}

	private void setSlot(ModelFamily family, @Nullable ModelIdentity identity, SlotState state) {
		slotsLock.writeLock().lock();
		try {
			Slot slot = slots.get(family);
			if (slot.state != state) {
				logger.log(DEBUG, family + " slot: " + slot.state + " -> " + state);
			}
			slot.identity = state == SlotState.UNLOADED ? null : identity;
			slot.state = state;
		}
		finally {
			slotsLock.writeLock().unlock();
		}
	}

	/**
	 * Moves the slot through ERROR back to UNLOADED, closing the handle so it is never reused.
	 */
	private void failSlot(ModelFamily family, ModelIdentity identity, @Nullable Throwable cause) {
		setSlot(family, identity, SlotState.ERROR);
		logger.log(WARNING, family + " slot failed for " + identity, cause);
		cache.remove(identity);
		setSlot(family, null, SlotState.UNLOADED);
	}

	@Nullable
	private ModelIdentity slotIdentity(ModelFamily family) {
		slotsLock.readLock().lock();
		try {
			return slots.get(family).identity;
		}
		finally {
			slotsLock.readLock().unlock();
		}
	}

	/**
	 * Current lifecycle state of the family's slot. A slot whose model was evicted from the cache reports
	 * {@link SlotState#UNLOADED}.
	 */
	public SlotState slotState(ModelFamily family) {
		slotsLock.readLock().lock();
		try {
			Slot slot = slots.get(family);
			if (slot.state == SlotState.READY && (slot.identity == null || !cache.contains(slot.identity))) {
				return SlotState.UNLOADED;
			}
			return slot.state;
		}
		finally {
			slotsLock.readLock().unlock();
		}
	}

	/**
	 * Model currently held by the family's slot, if it is still cached.
	 */
	public Optional<ModelIdentity> loadedModel(ModelFamily family) {
		ModelIdentity identity = slotIdentity(family);
		return identity != null && cache.contains(identity) ? Optional.of(identity) : Optional.empty();
	}

	// ------------------------------------------------------------------
	// Introspection
	// ------------------------------------------------------------------

	public Optional<MetricsSnapshot> lastMetrics() {
		return Optional.ofNullable(lastMetrics.get());
	}

	public Optional<MetricsSnapshot> lastMetrics(ModelFamily family) {
		return Optional.ofNullable(lastMetricsByFamily.get(family));
	}

	public CacheStats cacheStats() {
		return cache.stats();
	}

	/**
	 * The underlying cache, e.g. for pinning frequently used models.
	 */
	public ModelCache getCache() {
		return cache;
	}

	public LifecycleConfig getConfig() {
		return config;
	}

	public boolean isGenerating(ModelFamily family) {
		return coordinator.isGenerating(family);
	}

	private void checkOpen() {
		if (closed) {
			throw new IllegalStateException("ModelLifecycleManager has been closed");
		}
	}

	/**
	 * Cancels running generations, waits for them to return and releases every loaded model.
	 */
	@Override
	public void close() {
		if (closed) return;
		closed = true;

		coordinator.cancelGeneration();
		workerPool.shutdown();
		for (ModelFamily family : ModelFamily.values()) {
			coordinator.withGenerationLock(family, () -> {
				cache.removeFamily(family);
				setSlot(family, null, SlotState.UNLOADED);
				return null;
			});
		}
		cache.clear();
		if (ownedCallbackExecutor != null) {
			ownedCallbackExecutor.shutdown();
		}
		logger.log(INFO, "Lifecycle manager closed");
	}

	public static class Builder {
		private final NativeEngine engine;
		private LifecycleConfig config;
		private MemoryProbe memoryProbe;
		private LoadStrategySelector selector;
		private MemoryProvider memoryProvider;
		private Executor callbackExecutor;

		public Builder(NativeEngine engine) {
			if (engine == null) {
				throw new IllegalArgumentException("Native engine cannot be null");
			}
			this.engine = engine;
		}

		public Builder config(LifecycleConfig config) {
			this.config = config;
			return this;
		}

		public Builder memoryProbe(MemoryProbe memoryProbe) {
			this.memoryProbe = memoryProbe;
			return this;
		}

		public Builder selector(LoadStrategySelector selector) {
			this.selector = selector;
			return this;
		}

		/**
		 * Memory callback for floor based cache eviction; defaults to the memory probe when a floor is configured.
		 */
		public Builder memoryProvider(MemoryProvider memoryProvider) {
			this.memoryProvider = memoryProvider;
			return this;
		}

		/**
		 * Executor progress listeners run on; defaults to a dedicated daemon thread.
		 */
		public Builder callbackExecutor(Executor callbackExecutor) {
			this.callbackExecutor = callbackExecutor;
			return this;
		}

		public ModelLifecycleManager build() {
			return new ModelLifecycleManager(this);
		}
	}
}
