package com.example.pulsemonitor.event;

import com.example.pulsemonitor.domain.SystemMetrics;

public record MetricsCollectedEvent(SystemMetrics metrics) {
}
