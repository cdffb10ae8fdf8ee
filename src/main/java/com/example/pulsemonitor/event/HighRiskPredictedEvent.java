package com.example.pulsemonitor.event;

import com.example.pulsemonitor.domain.PredictionResult;

import java.util.List;

public record HighRiskPredictedEvent(List<PredictionResult> predictions) {
}
