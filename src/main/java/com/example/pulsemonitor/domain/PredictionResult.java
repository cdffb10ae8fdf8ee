package com.example.pulsemonitor.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PredictionResult {

    public enum Trend {
        INCREASING, DECREASING, STABLE
    }

    public enum RiskLevel {
        LOW, MEDIUM, HIGH
    }

    String metric;
    double currentValue;
    double predictedValue;
    double confidence;
    int timeHorizonMinutes;
    Trend trend;
    RiskLevel riskLevel;
    Instant timestamp;
}
