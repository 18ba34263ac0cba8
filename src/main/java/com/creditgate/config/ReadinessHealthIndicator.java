package com.creditgate.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Readiness of the relational store and, when the limiter uses it, Redis.
 * Redis being down only degrades readiness: the limiter fails open.
 */
@Component
public class ReadinessHealthIndicator implements HealthIndicator {

    private final DataSource dataSource;
    private final ObjectProvider<RedisConnectionFactory> redisConnectionFactory;
    private final boolean redisBacked;

    public ReadinessHealthIndicator(DataSource dataSource,
                                    ObjectProvider<RedisConnectionFactory> redisConnectionFactory,
                                    @Value("${app.rate-limit.store:redis}") String rateLimitStore) {
        this.dataSource = dataSource;
        this.redisConnectionFactory = redisConnectionFactory;
        this.redisBacked = "redis".equalsIgnoreCase(rateLimitStore);
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        boolean databaseUp = checkDatabase(details);
        String redis = redisBacked ? checkRedis(details) : "NOT_USED";
        details.put("redis", redis);

        if (!databaseUp) {
            return Health.down().withDetails(details).build();
        }
        if ("DOWN".equals(redis)) {
            return Health.status("DEGRADED").withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }

    private boolean checkDatabase(Map<String, Object> details) {
        try (Connection connection = dataSource.getConnection()) {
            boolean valid = connection.isValid(5);
            details.put("database", valid ? "UP" : "DOWN");
            return valid;
        } catch (SQLException e) {
            details.put("database", "DOWN");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }

    private String checkRedis(Map<String, Object> details) {
        RedisConnectionFactory factory = redisConnectionFactory.getIfAvailable();
        if (factory == null) {
            return "DOWN";
        }
        try (RedisConnection connection = factory.getConnection()) {
            return "PONG".equalsIgnoreCase(connection.ping()) ? "UP" : "DOWN";
        } catch (RuntimeException e) {
            details.put("redisError", e.getMessage());
            return "DOWN";
        }
    }
}
