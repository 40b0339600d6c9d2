package com.phillippitts.modelrelay.service.cache;

/**
 * Snapshot of response cache usage. Counters reset on {@link ResponseCache#clear()}.
 */
public record CacheStats(int entries, int maxEntries, long hits, long misses) {

    public static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0);

    /** Hits over lookups, 0.0 before the first lookup. */
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
