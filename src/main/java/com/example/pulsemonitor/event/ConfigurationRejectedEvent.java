package com.example.pulsemonitor.event;

public record ConfigurationRejectedEvent(String kind, String name, String reason) {
}
