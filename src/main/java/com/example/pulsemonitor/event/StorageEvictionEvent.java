package com.example.pulsemonitor.event;

import java.time.Instant;

/**
 * Entries left a bounded series, either by count overflow or by retention cleanup.
 */
public record StorageEvictionEvent(String series, int evicted, Reason reason, Instant timestamp) {

    public enum Reason {
        CAPACITY, RETENTION
    }
}
