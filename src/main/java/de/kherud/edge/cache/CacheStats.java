package de.kherud.edge.cache;

/**
 * Counters of a {@link ModelCache} at one point in time.
 */
public record CacheStats(int entries, long totalBytes, long hits, long misses, long evictions) {

	public double hitRate() {
		long lookups = hits + misses;
		return lookups > 0 ? (double) hits / lookups : 0.0;
	}

	@Override
	public String toString() {
		return String.format("CacheStats{entries=%d, size=%dMB, hits=%d, misses=%d, evictions=%d, hitRate=%.1f%%}",
			entries, totalBytes / (1024 * 1024), hits, misses, evictions, hitRate() * 100);
	}
}
