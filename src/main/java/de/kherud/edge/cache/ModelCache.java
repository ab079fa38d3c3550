package de.kherud.edge.cache;

import de.kherud.edge.ModelFamily;
import de.kherud.edge.ModelIdentity;
import de.kherud.edge.engine.NativeEngineHandle;
import de.kherud.edge.memory.MemoryProvider;
import de.kherud.edge.plan.LoadPlan;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

/**
 * LRU cache of loaded models with per-family entry and byte budgets.
 * <p>
 * All entries live in one access-ordered map. After an insert the cache evicts the least recently used other
 * entries of the inserted family until both of the family's bounds hold; unpinned entries go first. A configured
 * {@link MemoryProvider} additionally triggers eviction of unpinned entries while available memory is below the
 * floor. That eviction crosses families and skips every family reported busy by
 * {@link #setBusyFamilyCheck(Predicate)}. Every operation runs on this object's monitor and evicted handles are
 * closed inside that same section, so no entry is ever visible after its handle was closed.
 */
public class ModelCache implements AutoCloseable {

	private static final System.Logger logger = System.getLogger(ModelCache.class.getName());
	private static final long MB = 1024L * 1024L;

	private final LinkedHashMap<ModelIdentity, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
	private final Map<ModelFamily, FamilyBudget> budgets = new EnumMap<>(ModelFamily.class);

	@Nullable
	private MemoryProvider memoryProvider;
	private long memoryFloorBytes;
	private boolean preferPerformance;
	private Predicate<ModelFamily> busyFamilyCheck = family -> false;

	private long hits;
	private long misses;
	private long evictions;

	public ModelCache() {
		this(Map.of());
	}

	/**
	 * @param budgets bounds per family; families without an entry use {@link FamilyBudget#DEFAULT}
	 */
	public ModelCache(Map<ModelFamily, FamilyBudget> budgets) {
		for (ModelFamily family : ModelFamily.values()) {
			this.budgets.put(family, budgets.getOrDefault(family, FamilyBudget.DEFAULT));
		}
	}

	/**
	 * Looks up a loaded model and marks it most recently used.
	 */
	@Nullable
	public synchronized CacheEntry get(ModelIdentity identity) {
		CacheEntry entry = entries.get(identity);
		if (entry == null) {
			misses++;
			return null;
		}
		entry.recordHit();
		hits++;
		return entry;
	}

	/**
	 * Looks up a loaded model without touching recency or counters.
	 */
	@Nullable
	public synchronized CacheEntry peek(ModelIdentity identity) {
		if (!entries.containsKey(identity)) {
			return null;
		}
		// get() on the access-ordered map would move the entry to the most recently used end
		for (Map.Entry<ModelIdentity, CacheEntry> e : entries.entrySet()) {
			if (e.getKey().equals(identity)) {
				return e.getValue();
			}
		}
		return null;
	}

	public synchronized boolean contains(ModelIdentity identity) {
		return entries.containsKey(identity);
	}

	public CacheEntry put(ModelIdentity identity, NativeEngineHandle handle, long estimatedSizeBytes, long loadDurationMs) {
		return put(identity, handle, estimatedSizeBytes, loadDurationMs, null);
	}

	/**
	 * Inserts a freshly loaded model, closing any entry previously stored under the same identity, then evicts
	 * until the family's budget holds.
	 */
	public synchronized CacheEntry put(ModelIdentity identity, NativeEngineHandle handle, long estimatedSizeBytes,
									   long loadDurationMs, @Nullable LoadPlan loadPlan) {
		if (estimatedSizeBytes < 0) {
			throw new IllegalArgumentException("Estimated size cannot be negative: " + estimatedSizeBytes);
		}
		CacheEntry previous = entries.remove(identity);
		if (previous != null && previous.getHandle() != handle) {
			logger.log(DEBUG, "Replacing cached " + identity);
			closeQuietly(previous);
		}
		CacheEntry entry = new CacheEntry(identity, handle, estimatedSizeBytes, loadDurationMs, loadPlan);
		entries.put(identity, entry);
		logger.log(INFO, "Cached " + entry + " (" + entries.size() + " entries, " + totalBytes() / MB + "MB)");

		enforceBudget(entry);
		enforceMemoryFloor(entry);
		return entry;
	}

	private void enforceBudget(CacheEntry inserted) {
		ModelFamily family = inserted.getFamily();
		FamilyBudget budget = budgets.get(family);
		while (familySizeLocked(family) > budget.maxEntries() || familyBytesLocked(family) > budget.maxBytes()) {
			CacheEntry victim = selectVictim(family, inserted.getIdentity(), true, false);
			if (victim == null) {
				break;
			}
			evict(victim, "family budget " + budget);
		}
	}

	private void enforceMemoryFloor(CacheEntry inserted) {
		if (memoryProvider == null || memoryFloorBytes <= 0 || preferPerformance) {
			return;
		}
		while (memoryProvider.availableMemoryBytes() < memoryFloorBytes) {
			CacheEntry victim = selectVictim(null, inserted.getIdentity(), false, true);
			if (victim == null) {
				logger.log(WARNING, "Available memory below " + memoryFloorBytes / MB + "MB but no idle model left to evict");
				break;
			}
			evict(victim, "available memory below " + memoryFloorBytes / MB + "MB");
		}
	}

	/**
	 * Least recently used entry of {@code family} (any family when null), skipping {@code exclude} and, when
	 * {@code skipBusy}, entries of busy families. Unpinned entries are preferred; pinned ones are only returned when
	 * {@code allowPinned} and no unpinned one exists.
	 */
	@Nullable
	private CacheEntry selectVictim(@Nullable ModelFamily family, ModelIdentity exclude, boolean allowPinned,
									boolean skipBusy) {
		CacheEntry pinnedCandidate = null;
		for (CacheEntry entry : entries.values()) {
			if (entry.getIdentity().equals(exclude) || (family != null && entry.getFamily() != family)) {
				continue;
			}
			if (skipBusy && busyFamilyCheck.test(entry.getFamily())) {
				logger.log(DEBUG, "Not evicting " + entry.getIdentity() + ", " + entry.getFamily() + " is in use");
				continue;
			}
			if (!entry.isPinned()) {
				return entry;
			}
			if (pinnedCandidate == null) {
				pinnedCandidate = entry;
			}
		}
		return allowPinned ? pinnedCandidate : null;
	}

	private void evict(CacheEntry victim, String reason) {
		entries.remove(victim.getIdentity());
		evictions++;
		logger.log(INFO, "Evicting " + victim + ": " + reason);
		closeQuietly(victim);
	}

	private static void closeQuietly(CacheEntry entry) {
		try {
			entry.getHandle().close();
		}
		catch (RuntimeException e) {
			logger.log(WARNING, "Failed to close " + entry.getIdentity(), e);
		}
	}

	/**
	 * Removes and closes the entry for {@code identity}. Removing an absent identity is a no-op.
	 *
	 * @return whether an entry was removed
	 */
	public synchronized boolean remove(ModelIdentity identity) {
		CacheEntry entry = entries.remove(identity);
		if (entry == null) {
			return false;
		}
		logger.log(INFO, "Removing " + entry);
		closeQuietly(entry);
		return true;
	}

	/**
	 * Removes and closes every entry of {@code family}.
	 *
	 * @return number of removed entries
	 */
	public synchronized int removeFamily(ModelFamily family) {
		int removed = 0;
		Iterator<CacheEntry> it = entries.values().iterator();
		List<CacheEntry> toClose = new ArrayList<>();
		while (it.hasNext()) {
			CacheEntry entry = it.next();
			if (entry.getFamily() == family) {
				it.remove();
				toClose.add(entry);
				removed++;
			}
		}
		for (CacheEntry entry : toClose) {
			logger.log(INFO, "Removing " + entry);
			closeQuietly(entry);
		}
		return removed;
	}

	/**
	 * Removes and closes every entry and resets the hit, miss and eviction counters.
	 */
	public synchronized void clear() {
		List<CacheEntry> toClose = new ArrayList<>(entries.values());
		entries.clear();
		hits = 0;
		misses = 0;
		evictions = 0;
		for (CacheEntry entry : toClose) {
			closeQuietly(entry);
		}
		if (!toClose.isEmpty()) {
			logger.log(INFO, "Cleared " + toClose.size() + " cached models");
		}
	}

	/**
	 * Pinned entries are evicted for budget only when no unpinned entry of the family is left, and never for
	 * memory pressure.
	 *
	 * @return whether the identity was cached
	 */
	public synchronized boolean pin(ModelIdentity identity) {
		return setPinned(identity, true);
	}

	public synchronized boolean unpin(ModelIdentity identity) {
		return setPinned(identity, false);
	}

	private boolean setPinned(ModelIdentity identity, boolean pinned) {
		CacheEntry entry = peek(identity);
		if (entry == null) {
			return false;
		}
		entry.setPinned(pinned);
		return true;
	}

	/**
	 * Installs the memory callback consulted after each insert. {@code null} or a floor of 0 disables it.
	 */
	public synchronized void setMemoryProvider(@Nullable MemoryProvider provider, long memoryFloorBytes) {
		this.memoryProvider = provider;
		this.memoryFloorBytes = Math.max(0L, memoryFloorBytes);
	}

	/**
	 * Families for which {@code check} returns true are never touched by memory-floor eviction, which is how a
	 * handle in use by another thread stays open. Family-budget eviction is unaffected; it only evicts the
	 * inserting family. {@code null} restores the default of no busy family.
	 */
	public synchronized void setBusyFamilyCheck(@Nullable Predicate<ModelFamily> check) {
		this.busyFamilyCheck = check != null ? check : family -> false;
	}

	/**
	 * Prefer-performance mode disables memory-floor eviction; family budgets still apply.
	 */
	public synchronized void setPreferPerformance(boolean preferPerformance) {
		this.preferPerformance = preferPerformance;
	}

	public synchronized boolean isPreferPerformance() {
		return preferPerformance;
	}

	public synchronized FamilyBudget getBudget(ModelFamily family) {
		return budgets.get(family);
	}

	public synchronized void setBudget(ModelFamily family, FamilyBudget budget) {
		budgets.put(family, budget);
	}

	public synchronized int size() {
		return entries.size();
	}

	public synchronized int familySize(ModelFamily family) {
		return familySizeLocked(family);
	}

	public synchronized long familyBytes(ModelFamily family) {
		return familyBytesLocked(family);
	}

	public synchronized long totalBytes() {
		long total = 0;
		for (CacheEntry entry : entries.values()) {
			total += entry.getEstimatedSizeBytes();
		}
		return total;
	}

	private int familySizeLocked(ModelFamily family) {
		int count = 0;
		for (CacheEntry entry : entries.values()) {
			if (entry.getFamily() == family) count++;
		}
		return count;
	}

	private long familyBytesLocked(ModelFamily family) {
		long bytes = 0;
		for (CacheEntry entry : entries.values()) {
			if (entry.getFamily() == family) bytes += entry.getEstimatedSizeBytes();
		}
		return bytes;
	}

	/**
	 * Cached identities from least to most recently used.
	 */
	public synchronized List<ModelIdentity> identities() {
		return new ArrayList<>(entries.keySet());
	}

	public synchronized List<ModelIdentity> identities(ModelFamily family) {
		List<ModelIdentity> result = new ArrayList<>();
		for (CacheEntry entry : entries.values()) {
			if (entry.getFamily() == family) result.add(entry.getIdentity());
		}
		return result;
	}

	public synchronized CacheStats stats() {
		return new CacheStats(entries.size(), totalBytes(), hits, misses, evictions);
	}

	@Override
	public void close() {
		clear();
	}
}
