package de.kherud.edge.cache;

/**
 * Per-family cache bounds. Both limits hold after every insert, except that a single entry larger than
 * {@code maxBytes} is still admitted as the only entry of its family.
 *
 * @param maxEntries most entries the family may hold, at least 1
 * @param maxBytes   most estimated bytes the family may hold, at least 1
 */
public record FamilyBudget(int maxEntries, long maxBytes) {

	private static final long MB = 1024L * 1024L;

	public static final FamilyBudget DEFAULT = ofMegabytes(2, 4096);

	public FamilyBudget {
		if (maxEntries < 1) {
			throw new IllegalArgumentException("maxEntries must be at least 1: " + maxEntries);
		}
		if (maxBytes < 1) {
			throw new IllegalArgumentException("maxBytes must be at least 1: " + maxBytes);
		}
	}

	public static FamilyBudget ofMegabytes(int maxEntries, long maxMemoryMb) {
		return new FamilyBudget(maxEntries, maxMemoryMb * MB);
	}
}
