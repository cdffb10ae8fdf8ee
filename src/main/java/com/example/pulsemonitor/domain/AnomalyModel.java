package com.example.pulsemonitor.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.List;

/**
 * Per-metric model used by the anomaly detector. One of three variants,
 * serialized with a "type" discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AnomalyModel.Statistical.class, name = "statistical"),
        @JsonSubTypes.Type(value = AnomalyModel.Seasonal.class, name = "seasonal"),
        @JsonSubTypes.Type(value = AnomalyModel.Trend.class, name = "trend")
})
public interface AnomalyModel {

    enum ModelType {
        STATISTICAL, SEASONAL, TREND
    }

    String metric();

    Instant lastTrained();

    double accuracy();

    ModelType modelType();

    /**
     * Expected value for the observation at the given series position.
     */
    double expectedCenter(long position);

    /**
     * Spread used to turn a deviation into a z-score.
     */
    double spread();

    record Statistical(String metric, double mean, double stdDev, double threshold,
                       Instant lastTrained, double accuracy) implements AnomalyModel {

        @Override
        public ModelType modelType() {
            return ModelType.STATISTICAL;
        }

        @Override
        public double expectedCenter(long position) {
            return mean;
        }

        @Override
        public double spread() {
            return stdDev;
        }
    }

    /**
     * Seasonal decomposition: centered seasonal buckets, an OLS trend and a
     * statistical summary of what remains.
     */
    record Seasonal(String metric, List<Double> seasonal, double trendSlope, double trendIntercept,
                    double trendValue, Statistical residual, Instant lastTrained,
                    double accuracy) implements AnomalyModel {

        @Override
        public ModelType modelType() {
            return ModelType.SEASONAL;
        }

        @Override
        public double expectedCenter(long position) {
            int period = seasonal.size();
            double seasonalComponent = period == 0 ? 0.0 : seasonal.get((int) (position % period));
            return trendValue + seasonalComponent + residual.mean();
        }

        @Override
        public double spread() {
            return residual.stdDev();
        }
    }

    /**
     * Drift-only model for monotonically moving metrics such as disk usage.
     */
    record Trend(String metric, double trendSlope, double trendIntercept, double trendValue,
                 Statistical residual, Instant lastTrained, double accuracy) implements AnomalyModel {

        @Override
        public ModelType modelType() {
            return ModelType.TREND;
        }

        @Override
        public double expectedCenter(long position) {
            return trendValue + residual.mean();
        }

        @Override
        public double spread() {
            return residual.stdDev();
        }
    }
}
