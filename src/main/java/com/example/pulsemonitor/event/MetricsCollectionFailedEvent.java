package com.example.pulsemonitor.event;

import java.time.Instant;

public record MetricsCollectionFailedEvent(String message, Throwable error, Instant timestamp) {
}
