package com.creditgate.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-node rate limit store for development and tests.
 * Each key is updated inside {@link ConcurrentHashMap#compute}, which gives the
 * same per-key atomicity the Redis transaction and scripts provide.
 * State is lost on restart and not shared between instances. Keys that go idle are
 * only dropped by {@link #evictExpired}, which {@link InMemoryRateLimitCleanupTask} runs.
 */
@Component
@ConditionalOnProperty(name = "app.rate-limit.store", havingValue = "memory")
public class InMemoryRateLimitStore implements RateLimitStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryRateLimitStore.class);

    private final ConcurrentHashMap<String, WindowLog> windows = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    public InMemoryRateLimitStore() {
        logger.info("Rate limit store: in-memory (not shared between instances)");
    }

    @Override
    public WindowSnapshot recordInTransaction(String key, String member, long nowMs, long windowMs, int limit) {
        return record(key, member, nowMs, windowMs, limit);
    }

    @Override
    public WindowSnapshot recordAtomically(String key, String member, long nowMs, long windowMs, int limit) {
        return record(key, member, nowMs, windowMs, limit);
    }

    private WindowSnapshot record(String key, String member, long nowMs, long windowMs, int limit) {
        WindowSnapshot[] result = new WindowSnapshot[1];
        windows.compute(key, (k, existing) -> {
            WindowLog log = existing != null ? existing : new WindowLog();
            log.windowMs = windowMs;
            log.evictBefore(nowMs);

            Long oldest = oldest(log.entries);
            if (log.entries.size() >= limit) {
                result[0] = new WindowSnapshot(false, log.entries.size(), oldest);
            } else {
                log.entries.add(new Entry(member, nowMs));
                result[0] = new WindowSnapshot(true, log.entries.size(), oldest != null ? oldest : nowMs);
            }
            return log.entries.isEmpty() ? null : log;
        });
        return result[0];
    }

    @Override
    public WindowSnapshot peekWindow(String key, long nowMs, long windowMs) {
        WindowSnapshot[] result = new WindowSnapshot[] {new WindowSnapshot(true, 0, null)};
        windows.computeIfPresent(key, (k, log) -> {
            long windowStart = nowMs - windowMs;
            List<Entry> live = log.entries.stream().filter(entry -> entry.score > windowStart).toList();
            result[0] = new WindowSnapshot(true, live.size(), oldest(live));
            return log;
        });
        return result[0];
    }

    @Override
    public BucketSnapshot drip(String key, double nowSeconds, int capacity, double leakRatePerSecond, long ttlSeconds) {
        BucketSnapshot[] result = new BucketSnapshot[1];
        buckets.compute(key, (k, existing) -> {
            Bucket bucket = existing == null || existing.expiresAt <= nowSeconds
                    ? new Bucket(0, nowSeconds, nowSeconds + ttlSeconds)
                    : existing;

            double level = drained(bucket, nowSeconds, leakRatePerSecond);
            if (level < capacity) {
                level += 1;
                result[0] = new BucketSnapshot(true, level);
                return new Bucket(level, nowSeconds, nowSeconds + ttlSeconds);
            }
            result[0] = new BucketSnapshot(false, level);
            return bucket;
        });
        return result[0];
    }

    @Override
    public double peekBucket(String key, double nowSeconds, double leakRatePerSecond) {
        Bucket bucket = buckets.get(key);
        if (bucket == null || bucket.expiresAt <= nowSeconds) {
            return 0;
        }
        return drained(bucket, nowSeconds, leakRatePerSecond);
    }

    @Override
    public void delete(Collection<String> keys) {
        for (String key : keys) {
            windows.remove(key);
            buckets.remove(key);
        }
    }

    /**
     * Drops window entries older than their key's last window and buckets past their TTL,
     * removing keys left empty.
     *
     * @return number of keys removed
     */
    public int evictExpired(long nowMs) {
        int removed = 0;
        for (String key : windows.keySet()) {
            boolean[] dropped = new boolean[1];
            windows.computeIfPresent(key, (k, log) -> {
                log.evictBefore(nowMs);
                dropped[0] = log.entries.isEmpty();
                return dropped[0] ? null : log;
            });
            if (dropped[0]) {
                removed++;
            }
        }
        double nowSeconds = nowMs / 1000.0;
        for (String key : buckets.keySet()) {
            boolean[] dropped = new boolean[1];
            buckets.computeIfPresent(key, (k, bucket) -> {
                dropped[0] = bucket.expiresAt <= nowSeconds;
                return dropped[0] ? null : bucket;
            });
            if (dropped[0]) {
                removed++;
            }
        }
        return removed;
    }

    int size() {
        return windows.size() + buckets.size();
    }

    private static double drained(Bucket bucket, double nowSeconds, double leakRatePerSecond) {
        double leaked = Math.max(0, nowSeconds - bucket.lastLeak) * leakRatePerSecond;
        return Math.max(0, bucket.level - leaked);
    }

    private static Long oldest(List<Entry> log) {
        return log.stream().map(entry -> entry.score).min(Long::compare).orElse(null);
    }

    private static final class WindowLog {
        private final List<Entry> entries = new ArrayList<>();
        private long windowMs;

        private void evictBefore(long nowMs) {
            long windowStart = nowMs - windowMs;
            entries.removeIf(entry -> entry.score <= windowStart);
        }
    }

    private static final class Entry {
        private final String member;
        private final long score;

        private Entry(String member, long score) {
            this.member = member;
            this.score = score;
        }

        @Override
        public String toString() {
            return member + "@" + score;
        }
    }

    private static final class Bucket {
        private final double level;
        private final double lastLeak;
        private final double expiresAt;

        private Bucket(double level, double lastLeak, double expiresAt) {
            this.level = level;
            this.lastLeak = lastLeak;
            this.expiresAt = expiresAt;
        }
    }
}
