package com.example.pulsemonitor.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Forecasting model selected for one metric.
 * <ul>
 *   <li>LINEAR: [intercept, slope]</li>
 *   <li>EXPONENTIAL: [alpha, lastSmoothed]</li>
 *   <li>ARIMA: [arCoeff, maCoeff, lastValue, lastDiff]</li>
 * </ul>
 */
@Value
@Builder
@Jacksonized
public class PredictionModel {

    public enum ModelType {
        LINEAR, EXPONENTIAL, ARIMA
    }

    String metric;
    ModelType type;
    List<Double> coefficients;
    double accuracy;
    int trainingDataCount;
    Instant lastTrained;

    public double coefficient(int index) {
        return coefficients.get(index);
    }
}
