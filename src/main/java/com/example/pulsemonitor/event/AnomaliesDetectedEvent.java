package com.example.pulsemonitor.event;

import com.example.pulsemonitor.domain.AnomalyResult;

import java.util.List;

public record AnomaliesDetectedEvent(List<AnomalyResult> anomalies) {
}
