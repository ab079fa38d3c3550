package de.kherud.edge.cache;

import de.kherud.edge.ModelFamily;
import de.kherud.edge.ModelIdentity;
import de.kherud.edge.engine.NativeEngineHandle;
import de.kherud.edge.plan.LoadPlan;
import org.jetbrains.annotations.Nullable;

/**
 * A loaded model owned by the {@link ModelCache}. Access counters are updated under the cache's lock.
 */
public final class CacheEntry {

	private final ModelIdentity identity;
	private final NativeEngineHandle handle;
	private final long estimatedSizeBytes;
	private final long loadDurationMs;
	@Nullable
	private final LoadPlan loadPlan;
	private final long createdAt;
	private volatile long lastAccess;
	private volatile long hitCount;
	private volatile boolean pinned;

	CacheEntry(ModelIdentity identity, NativeEngineHandle handle, long estimatedSizeBytes, long loadDurationMs,
			   @Nullable LoadPlan loadPlan) {
		this.identity = identity;
		this.handle = handle;
		this.estimatedSizeBytes = estimatedSizeBytes;
		this.loadDurationMs = loadDurationMs;
		this.loadPlan = loadPlan;
		this.createdAt = System.currentTimeMillis();
		this.lastAccess = createdAt;
	}

	void recordHit() {
		hitCount++;
		lastAccess = System.currentTimeMillis();
	}

	void setPinned(boolean pinned) {
		this.pinned = pinned;
	}

	public ModelIdentity getIdentity() {
		return identity;
	}

	public NativeEngineHandle getHandle() {
		return handle;
	}

	public ModelFamily getFamily() {
		return handle.getFamily();
	}

	public long getEstimatedSizeBytes() {
		return estimatedSizeBytes;
	}

	public long getLoadDurationMs() {
		return loadDurationMs;
	}

	@Nullable
	public LoadPlan getLoadPlan() {
		return loadPlan;
	}

	public long getCreatedAt() {
		return createdAt;
	}

	public long getLastAccess() {
		return lastAccess;
	}

	public long getHitCount() {
		return hitCount;
	}

	public boolean isPinned() {
		return pinned;
	}

	@Override
	public String toString() {
		return "CacheEntry{" + identity + ", " + getFamily() + ", " + estimatedSizeBytes / (1024 * 1024) + "MB, hits="
			+ hitCount + (pinned ? ", pinned" : "") + "}";
	}
}
