package com.example.pulsemonitor.event;

import com.example.pulsemonitor.domain.HealthCheckResult;

import java.util.List;

public record HealthDegradedEvent(List<HealthCheckResult> results) {
}
