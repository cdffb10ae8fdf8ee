package com.example.pulsemonitor.event;

import com.example.pulsemonitor.domain.Alert;

import java.util.List;

public record AlertEscalatedEvent(Alert alert, int level, List<String> channels) {
}
