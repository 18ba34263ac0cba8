package com.creditgate.cache;

import java.time.Instant;

public class CacheStats {

    private final long totalEntries;
    private final long totalHits;
    private final Instant lastHitAt;

    public CacheStats(long totalEntries, long totalHits, Instant lastHitAt) {
        this.totalEntries = totalEntries;
        this.totalHits = totalHits;
        this.lastHitAt = lastHitAt;
    }

    public long getTotalEntries() {
        return totalEntries;
    }

    public long getTotalHits() {
        return totalHits;
    }

    /**
     * @return time of the most recent hit, null if no entry was ever hit
     */
    public Instant getLastHitAt() {
        return lastHitAt;
    }
}
