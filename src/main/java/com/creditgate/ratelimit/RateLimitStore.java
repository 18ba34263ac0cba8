package com.creditgate.ratelimit;

import java.util.Collection;

/**
 * Atomic key-value primitives the admission strategies are built on.
 * Every method is atomic per key; implementations signal an unreachable
 * backend with {@link RateLimitBackendException}.
 */
public interface RateLimitStore {

    /**
     * Evicts entries at or before {@code nowMs - windowMs}, inserts the request and counts,
     * all in one transaction. An insert that pushes the count over {@code limit} is undone.
     */
    WindowSnapshot recordInTransaction(String key, String member, long nowMs, long windowMs, int limit);

    /**
     * Evicts, counts and conditionally inserts in one server-side evaluation, so two callers
     * can never both see a free last slot.
     */
    WindowSnapshot recordAtomically(String key, String member, long nowMs, long windowMs, int limit);

    /**
     * Reads the window without consuming a slot.
     */
    WindowSnapshot peekWindow(String key, long nowMs, long windowMs);

    /**
     * Drains the bucket for the time elapsed since the last leak, then adds one unit
     * if the level is below capacity.
     */
    BucketSnapshot drip(String key, double nowSeconds, int capacity, double leakRatePerSecond, long ttlSeconds);

    /**
     * Current drained level without adding a unit.
     */
    double peekBucket(String key, double nowSeconds, double leakRatePerSecond);

    void delete(Collection<String> keys);
}
