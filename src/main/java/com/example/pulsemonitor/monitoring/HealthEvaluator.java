package com.example.pulsemonitor.monitoring;

import com.example.pulsemonitor.config.MonitorProperties;
import com.example.pulsemonitor.domain.HealthCheckResult;
import com.example.pulsemonitor.domain.HealthCheckResult.HealthStatus;
import com.example.pulsemonitor.domain.SystemMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Grades each metric of a sample against its configured bands
 * (degraded / unhealthy / critical, all inclusive lower bounds).
 */
@Component
@RequiredArgsConstructor
public class HealthEvaluator {

    private final MonitorProperties properties;

    public List<HealthCheckResult> evaluate(SystemMetrics metrics) {
        Map<String, MonitorProperties.HealthConfig.Band> bands = properties.getHealth().getThresholds();
        List<HealthCheckResult> results = new ArrayList<>();

        metrics.metricValues().forEach((metric, value) -> {
            MonitorProperties.HealthConfig.Band band = bands.get(metric);
            if (band == null) return;
            HealthStatus status = grade(value, band);
            results.add(new HealthCheckResult(metric, value, status,
                    String.format("%s at %.2f is %s", metric, value, status.name().toLowerCase()),
                    metrics.getTimestamp()));
        });
        return results;
    }

    static HealthStatus grade(double value, MonitorProperties.HealthConfig.Band band) {
        if (value >= band.getCritical()) return HealthStatus.CRITICAL;
        if (value >= band.getUnhealthy()) return HealthStatus.UNHEALTHY;
        if (value >= band.getDegraded()) return HealthStatus.DEGRADED;
        return HealthStatus.HEALTHY;
    }
}
