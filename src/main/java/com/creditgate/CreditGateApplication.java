package com.creditgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class CreditGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditGateApplication.class, args);
    }

    /**
     * Enable scheduling only when maintenance tasks are enabled.
     * Disabled in tests so sweeps only run when a test calls them.
     */
    @EnableScheduling
    @ConditionalOnProperty(name = "app.maintenance.enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfiguration {
    }
}
