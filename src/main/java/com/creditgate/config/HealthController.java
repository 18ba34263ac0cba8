package com.creditgate.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ReadinessHealthIndicator readinessHealthIndicator;

    public HealthController(ReadinessHealthIndicator readinessHealthIndicator) {
        this.readinessHealthIndicator = readinessHealthIndicator;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Health health = readinessHealthIndicator.health();

        Map<String, Object> response = new HashMap<>();
        response.put("status", health.getStatus().getCode());
        response.put("timestamp", Instant.now().toString());

        Map<String, Object> checks = new HashMap<>();
        checks.put("db", health.getDetails().getOrDefault("database", "UNKNOWN"));
        checks.put("redis", health.getDetails().getOrDefault("redis", "UNKNOWN"));
        response.put("checks", checks);

        HttpStatus status = Status.DOWN.equals(health.getStatus())
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }
}
