package com.example.pulsemonitor.event;

import java.time.Instant;

public record ModelTrainingFailedEvent(String trainer, String metric, String reason, Instant timestamp) {
}
