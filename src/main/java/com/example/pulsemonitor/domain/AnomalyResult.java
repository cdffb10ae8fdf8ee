package com.example.pulsemonitor.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A live value flagged as inconsistent with its trained model.
 */
@Value
@Builder
public class AnomalyResult {
    String metric;
    double value;
    double expectedMin;
    double expectedMax;
    /** |z| divided by the detector sensitivity. */
    double score;
    Severity severity;
    Instant timestamp;
    AnomalyModel.ModelType modelType;
    String description;
}
