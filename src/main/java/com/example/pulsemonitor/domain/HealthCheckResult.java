package com.example.pulsemonitor.domain;

import java.time.Instant;

/**
 * Outcome of checking one metric against its health bands.
 */
public record HealthCheckResult(String metric, double value, HealthStatus status, String message, Instant timestamp) {

    public enum HealthStatus {
        HEALTHY, DEGRADED, UNHEALTHY, CRITICAL
    }

    public boolean healthy() {
        return status == HealthStatus.HEALTHY;
    }

    public Severity severity() {
        return switch (status) {
            case HEALTHY -> Severity.LOW;
            case DEGRADED -> Severity.MEDIUM;
            case UNHEALTHY -> Severity.HIGH;
            case CRITICAL -> Severity.CRITICAL;
        };
    }
}
