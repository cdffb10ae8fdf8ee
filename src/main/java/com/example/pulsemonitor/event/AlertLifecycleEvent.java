package com.example.pulsemonitor.event;

import com.example.pulsemonitor.domain.Alert;

/**
 * Published on every alert state change. {@code alert} is a snapshot taken
 * at the time of the change.
 */
public record AlertLifecycleEvent(Type type, Alert alert) {

    public enum Type {
        FIRED, ACKNOWLEDGED, RESOLVED
    }
}
