package com.creditgate.ratelimit;

/**
 * Raw result of a window operation against the store.
 *
 * @see RateLimitStore
 */
public final class WindowSnapshot {

    private final boolean admitted;
    private final long count;
    private final Long oldestTimestampMs;

    public WindowSnapshot(boolean admitted, long count, Long oldestTimestampMs) {
        this.admitted = admitted;
        this.count = count;
        this.oldestTimestampMs = oldestTimestampMs;
    }

    public boolean isAdmitted() {
        return admitted;
    }

    /**
     * Entries in the window after the operation, including the caller's when admitted.
     */
    public long getCount() {
        return count;
    }

    /**
     * Score of the oldest surviving entry, null when the window is empty.
     */
    public Long getOldestTimestampMs() {
        return oldestTimestampMs;
    }
}
