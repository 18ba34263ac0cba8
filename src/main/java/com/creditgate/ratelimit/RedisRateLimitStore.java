package com.creditgate.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Redis-backed rate limit store shared by every application instance.
 *
 * The fixed window runs as a MULTI/EXEC transaction; the sliding window and the
 * leaky bucket run as Lua scripts, which Redis executes one at a time per server,
 * so no two callers can interleave on a key.
 * Any Redis failure is rethrown as {@link RateLimitBackendException}.
 */
@Component
@ConditionalOnProperty(name = "app.rate-limit.store", havingValue = "redis", matchIfMissing = true)
public class RedisRateLimitStore implements RateLimitStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisRateLimitStore.class);

    /**
     * KEYS[1] window key; ARGV: now_ms, window_start_ms, limit, window_ms, member.
     * Returns {admitted (0/1), count, oldest_score or ''}.
     */
    private static final String SLIDING_WINDOW_SCRIPT = """
            local key = KEYS[1]
            local now = tonumber(ARGV[1])
            local window_start = tonumber(ARGV[2])
            local limit = tonumber(ARGV[3])
            local window_ms = tonumber(ARGV[4])
            local member = ARGV[5]

            redis.call('ZREMRANGEBYSCORE', key, '-inf', window_start)
            local count = redis.call('ZCARD', key)
            local oldest = redis.call('ZRANGE', key, 0, 0, 'WITHSCORES')

            if count >= limit then
                return {0, count, oldest[2] or ''}
            end

            redis.call('ZADD', key, now, member)
            redis.call('PEXPIRE', key, window_ms)
            return {1, count + 1, oldest[2] or ARGV[1]}
            """;

    /**
     * KEYS[1] bucket hash; ARGV: now_seconds, capacity, leak_rate, ttl_seconds.
     * Returns {admitted (0/1), level}. A rejected call leaves the stored state untouched.
     */
    private static final String LEAKY_BUCKET_SCRIPT = """
            local key = KEYS[1]
            local now = tonumber(ARGV[1])
            local capacity = tonumber(ARGV[2])
            local leak_rate = tonumber(ARGV[3])
            local ttl = tonumber(ARGV[4])

            local bucket = redis.call('HMGET', key, 'level', 'last_leak')
            local level = tonumber(bucket[1]) or 0
            local last_leak = tonumber(bucket[2]) or now

            local leaked = math.max(0, now - last_leak) * leak_rate
            level = math.max(0, level - leaked)

            if level < capacity then
                level = level + 1
                redis.call('HSET', key, 'level', tostring(level), 'last_leak', tostring(now))
                redis.call('EXPIRE', key, ttl)
                return {1, tostring(level)}
            end
            return {0, tostring(level)}
            """;

    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> SLIDING_WINDOW = new DefaultRedisScript<>(SLIDING_WINDOW_SCRIPT, List.class);
    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> LEAKY_BUCKET = new DefaultRedisScript<>(LEAKY_BUCKET_SCRIPT, List.class);

    private final StringRedisTemplate redisTemplate;

    public RedisRateLimitStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        logger.info("Rate limit store: redis");
    }

    @Override
    public WindowSnapshot recordInTransaction(String key, String member, long nowMs, long windowMs, int limit) {
        long windowStart = nowMs - windowMs;
        List<Object> results;
        try {
            results = redisTemplate.execute(new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings({"unchecked", "rawtypes"})
                public List<Object> execute(RedisOperations operations) throws DataAccessException {
                    operations.multi();
                    ZSetOperations<String, String> zset = operations.opsForZSet();
                    zset.removeRangeByScore(key, 0, windowStart);
                    zset.add(key, member, nowMs);
                    zset.zCard(key);
                    zset.rangeWithScores(key, 0, 0);
                    operations.expire(key, Duration.ofMillis(windowMs));
                    return operations.exec();
                }
            });
        } catch (DataAccessException e) {
            throw new RateLimitBackendException("Redis transaction failed for " + key, e);
        }

        if (results == null || results.size() < 4) {
            throw new RateLimitBackendException("Redis transaction for " + key + " was discarded");
        }

        long count = toLong(results.get(2));
        Long oldest = oldestScore(results.get(3));
        if (count <= limit) {
            return new WindowSnapshot(true, count, oldest);
        }

        // Over the limit: give the slot back so rejected calls do not extend the window
        try {
            redisTemplate.opsForZSet().remove(key, member);
        } catch (DataAccessException e) {
            logger.warn("Could not remove rejected entry from {}: {}", key, e.getMessage());
        }
        return new WindowSnapshot(false, count - 1, oldest);
    }

    @Override
    @SuppressWarnings("unchecked")
    public WindowSnapshot recordAtomically(String key, String member, long nowMs, long windowMs, int limit) {
        List<Object> result;
        try {
            result = redisTemplate.execute(SLIDING_WINDOW, List.of(key),
                    String.valueOf(nowMs),
                    String.valueOf(nowMs - windowMs),
                    String.valueOf(limit),
                    String.valueOf(windowMs),
                    member);
        } catch (DataAccessException e) {
            throw new RateLimitBackendException("Sliding window script failed for " + key, e);
        }

        if (result == null || result.size() < 3) {
            throw new RateLimitBackendException("Unexpected sliding window reply for " + key + ": " + result);
        }
        String oldest = String.valueOf(result.get(2));
        return new WindowSnapshot(toLong(result.get(0)) == 1L, toLong(result.get(1)),
                oldest.isEmpty() ? null : (long) Double.parseDouble(oldest));
    }

    @Override
    public WindowSnapshot peekWindow(String key, long nowMs, long windowMs) {
        long windowStart = nowMs - windowMs;
        try {
            ZSetOperations<String, String> zset = redisTemplate.opsForZSet();
            Long count = zset.count(key, windowStart + 1, Double.MAX_VALUE);
            Set<ZSetOperations.TypedTuple<String>> oldest =
                    zset.rangeByScoreWithScores(key, windowStart + 1, Double.MAX_VALUE, 0, 1);
            return new WindowSnapshot(true, count == null ? 0 : count, oldestScore(oldest));
        } catch (DataAccessException e) {
            throw new RateLimitBackendException("Redis read failed for " + key, e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public BucketSnapshot drip(String key, double nowSeconds, int capacity, double leakRatePerSecond, long ttlSeconds) {
        List<Object> result;
        try {
            result = redisTemplate.execute(LEAKY_BUCKET, List.of(key),
                    String.valueOf(nowSeconds),
                    String.valueOf(capacity),
                    String.valueOf(leakRatePerSecond),
                    String.valueOf(ttlSeconds));
        } catch (DataAccessException e) {
            throw new RateLimitBackendException("Leaky bucket script failed for " + key, e);
        }

        if (result == null || result.size() < 2) {
            throw new RateLimitBackendException("Unexpected leaky bucket reply for " + key + ": " + result);
        }
        return new BucketSnapshot(toLong(result.get(0)) == 1L, Double.parseDouble(String.valueOf(result.get(1))));
    }

    @Override
    public double peekBucket(String key, double nowSeconds, double leakRatePerSecond) {
        List<Object> fields;
        try {
            fields = redisTemplate.opsForHash().multiGet(key, List.<Object>of("level", "last_leak"));
        } catch (DataAccessException e) {
            throw new RateLimitBackendException("Redis read failed for " + key, e);
        }
        if (fields == null || fields.get(0) == null || fields.get(1) == null) {
            return 0;
        }
        double level = Double.parseDouble(fields.get(0).toString());
        double lastLeak = Double.parseDouble(fields.get(1).toString());
        return Math.max(0, level - Math.max(0, nowSeconds - lastLeak) * leakRatePerSecond);
    }

    @Override
    public void delete(Collection<String> keys) {
        try {
            redisTemplate.delete(keys);
        } catch (DataAccessException e) {
            throw new RateLimitBackendException("Redis delete failed for " + keys, e);
        }
    }

    private static long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value == null) {
            throw new RateLimitBackendException("Missing numeric value in Redis reply");
        }
        return Long.parseLong(value.toString());
    }

    @SuppressWarnings("unchecked")
    private static Long oldestScore(Object range) {
        if (!(range instanceof Set<?> tuples) || tuples.isEmpty()) {
            return null;
        }
        Object first = tuples.iterator().next();
        if (first instanceof ZSetOperations.TypedTuple<?> tuple && tuple.getScore() != null) {
            return tuple.getScore().longValue();
        }
        return null;
    }
}
