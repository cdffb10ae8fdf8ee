package com.example.pulsemonitor.analytics;

import com.example.pulsemonitor.config.MonitorProperties;
import com.example.pulsemonitor.domain.AnomalyResult;
import com.example.pulsemonitor.domain.PredictionModel;
import com.example.pulsemonitor.domain.PredictionResult;
import com.example.pulsemonitor.domain.PredictionResult.RiskLevel;
import com.example.pulsemonitor.domain.PredictionResult.Trend;
import com.example.pulsemonitor.domain.SystemMetrics;
import com.example.pulsemonitor.event.HighRiskPredictedEvent;
import com.example.pulsemonitor.event.ModelTrainingFailedEvent;
import com.example.pulsemonitor.exception.InsufficientDataException;
import com.example.pulsemonitor.storage.StorageManager;
import com.example.pulsemonitor.storage.TimeRange;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Fault Predictor - forecasts each metric at several horizons and grades
 * the risk of each forecast.
 *
 * Three candidate models are fitted per metric after IQR outlier removal
 * (linear regression, exponential smoothing and a differenced AR(1) with a
 * fixed MA term); the most accurate one is kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FaultPredictor {

    private static final double TREND_THRESHOLD = 0.01;
    private static final int SEASONAL_LAG = 24;
    private static final double DEFAULT_BREACH_THRESHOLD = 100.0;

    private final StorageManager storageManager;
    private final MonitorProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private volatile Map<String, PredictionModel> models = Map.of();

    record RiskFactors(double trend, double volatility, double seasonality, double anomalyFrequency) {
        static final RiskFactors NONE = new RiskFactors(0, 0, 0, 0);
    }

    public record ModelInfo(String metric, PredictionModel.ModelType type, double accuracy,
                            Instant lastTrained, int dataPoints) {
    }

    /**
     * Train every metric from the configured window of stored samples.
     *
     * @throws InsufficientDataException when the window holds fewer samples than required
     */
    public void trainPredictionModels() {
        MonitorProperties.PredictionConfig config = properties.getPrediction();
        List<SystemMetrics> history = storageManager
                .getMetrics(TimeRange.lastOf(config.getTrainingWindow(), clock)).join();
        if (history.size() < config.getMinTrainingData()) {
            InsufficientDataException failure =
                    new InsufficientDataException("all metrics", history.size(), config.getMinTrainingData());
            eventPublisher.publishEvent(new ModelTrainingFailedEvent(
                    "prediction", null, failure.getMessage(), clock.instant()));
            throw failure;
        }

        Map<String, List<Double>> series = new LinkedHashMap<>();
        for (SystemMetrics sample : history) {
            sample.metricValues().forEach((metric, value) -> {
                if (value != null && Double.isFinite(value)) {
                    series.computeIfAbsent(metric, k -> new ArrayList<>()).add(value);
                }
            });
        }

        Map<String, PredictionModel> trained = new HashMap<>();
        series.forEach((metric, values) -> {
            if (metric.startsWith(SystemMetrics.CUSTOM_PREFIX) && values.size() < config.getMinTrainingData()) {
                log.debug("Skipping prediction model for {}: {} points", metric, values.size());
                return;
            }
            try {
                trained.put(metric, fitBest(metric, Statistics.toArray(values)));
            } catch (RuntimeException e) {
                log.warn("Prediction model training failed for {}: {}", metric, e.getMessage());
                eventPublisher.publishEvent(new ModelTrainingFailedEvent(
                        "prediction", metric, e.getMessage(), clock.instant()));
            }
        });

        commit(trained);
        log.info("Trained {} prediction models from {} samples", trained.size(), history.size());
    }

    /**
     * Retrain a single metric from explicit data.
     */
    public PredictionModel updateModel(String metric, List<Double> data) {
        int required = properties.getPrediction().getMinTrainingData();
        if (data == null || data.size() < required) {
            throw new InsufficientDataException(metric, data == null ? 0 : data.size(), required);
        }
        PredictionModel model = fitBest(metric, Statistics.toArray(data));
        commit(Map.of(metric, model));
        log.info("Prediction model updated for {} ({}, accuracy {})", metric, model.getType(),
                String.format("%.3f", model.getAccuracy()));
        return model;
    }

    /**
     * Forecast every modelled metric at every configured horizon.
     */
    public List<PredictionResult> predict(SystemMetrics currentMetrics) {
        MonitorProperties.PredictionConfig config = properties.getPrediction();
        Map<String, Double> current = currentMetrics.metricValues();
        List<PredictionResult> predictions = new ArrayList<>();
        if (models.isEmpty()) return predictions;

        TimeRange window = TimeRange.lastOf(config.getRiskWindow(), clock);
        List<SystemMetrics> recent = storageManager.getMetrics(window).join();
        List<AnomalyResult> anomalies = storageManager.getAnomalies(window).join();

        for (PredictionModel model : models.values()) {
            Double currentValue = current.get(model.getMetric());
            if (currentValue == null) continue;

            RiskFactors risk = riskFactors(model.getMetric(), recent, anomalies);
            Trend trend = determineTrend(model, currentValue);
            for (int horizon : config.getHorizonsMinutes()) {
                Forecast forecast = forecast(model, horizon);
                predictions.add(PredictionResult.builder()
                        .metric(model.getMetric())
                        .currentValue(currentValue)
                        .predictedValue(forecast.value())
                        .confidence(forecast.confidence())
                        .timeHorizonMinutes(horizon)
                        .trend(trend)
                        .riskLevel(assessRisk(forecast, currentValue, risk))
                        .timestamp(currentMetrics.getTimestamp())
                        .build());
            }
        }

        if (!predictions.isEmpty()) {
            storageManager.storePredictions(predictions).exceptionally(e -> {
                log.error("Failed to store predictions: {}", e.getMessage());
                return null;
            });
        }

        List<PredictionResult> highRisk = predictions.stream()
                .filter(p -> p.getRiskLevel() == RiskLevel.HIGH)
                .toList();
        if (!highRisk.isEmpty()) {
            Counter.builder("pulse.predictions.high_risk").register(meterRegistry).increment(highRisk.size());
            log.warn("{} high-risk predictions for {}", highRisk.size(),
                    highRisk.stream().map(PredictionResult::getMetric).distinct().toList());
            eventPublisher.publishEvent(new HighRiskPredictedEvent(highRisk));
        }
        return predictions;
    }

    /**
     * Probability that the metric breaches its failure threshold within the horizon.
     *
     * @return empty when there is no model or no recent data for the metric
     */
    public Optional<Double> getFailureProbability(String metric, int horizonMinutes) {
        PredictionModel model = models.get(metric);
        if (model == null) return Optional.empty();

        MonitorProperties.PredictionConfig config = properties.getPrediction();
        List<SystemMetrics> baseline = storageManager
                .getMetrics(TimeRange.lastOf(config.getFailureBaselineWindow(), clock)).join();
        List<Double> values = baseline.stream()
                .map(m -> m.metricValue(metric))
                .filter(Objects::nonNull)
                .toList();
        if (values.isEmpty()) return Optional.empty();

        Forecast forecast = forecast(model, horizonMinutes);
        double threshold = config.getBreachThresholds().getOrDefault(metric, DEFAULT_BREACH_THRESHOLD);
        if (forecast.value() <= threshold) return Optional.of(0.05);

        TimeRange window = TimeRange.lastOf(config.getRiskWindow(), clock);
        RiskFactors risk = riskFactors(metric, storageManager.getMetrics(window).join(),
                storageManager.getAnomalies(window).join());
        double exceedance = (forecast.value() - threshold) / threshold;
        double base = Math.min(0.9, exceedance * forecast.confidence());
        double adjustment = (risk.volatility() + risk.anomalyFrequency()) / 2;
        return Optional.of(Math.min(0.95, base + adjustment * 0.1));
    }

    public Optional<PredictionModel> getModel(String metric) {
        return Optional.ofNullable(models.get(metric));
    }

    public List<ModelInfo> getModelInfo() {
        return models.values().stream()
                .map(m -> new ModelInfo(m.getMetric(), m.getType(), m.getAccuracy(),
                        m.getLastTrained(), m.getTrainingDataCount()))
                .sorted(Comparator.comparing(ModelInfo::metric))
                .toList();
    }

    private void commit(Map<String, PredictionModel> trained) {
        if (trained.isEmpty()) return;
        Map<String, PredictionModel> next = new HashMap<>(models);
        next.putAll(trained);
        models = Map.copyOf(next);
        trained.values().forEach(model -> storageManager.storePredictionModel(model).exceptionally(e -> {
            log.error("Failed to persist prediction model for {}: {}", model.getMetric(), e.getMessage());
            return null;
        }));
    }

    // --- fitting ---

    PredictionModel fitBest(String metric, double[] raw) {
        double[] data = Statistics.removeOutliers(raw);
        if (data.length < 3) {
            throw new InsufficientDataException(metric, data.length, 3);
        }
        Instant now = clock.instant();
        return Stream.of(fitLinear(metric, data, now), fitExponential(metric, data, now), fitArima(metric, data, now))
                .reduce((best, candidate) -> candidate.getAccuracy() > best.getAccuracy() ? candidate : best)
                .orElseThrow();
    }

    PredictionModel fitLinear(String metric, double[] data, Instant now) {
        Statistics.Line line = Statistics.ols(data);
        double mean = Statistics.mean(data);
        double total = 0;
        double residual = 0;
        for (int i = 0; i < data.length; i++) {
            total += (data[i] - mean) * (data[i] - mean);
            residual += Math.pow(data[i] - line.at(i), 2);
        }
        double rSquared = total == 0 ? 0.0 : Math.max(0.0, 1 - residual / total);
        return model(metric, PredictionModel.ModelType.LINEAR, List.of(line.intercept(), line.slope()),
                rSquared, data.length, now);
    }

    PredictionModel fitExponential(String metric, double[] data, Instant now) {
        double alpha = properties.getPrediction().getSmoothingAlpha();
        double[] smoothed = new double[data.length];
        smoothed[0] = data[0];
        for (int i = 1; i < data.length; i++) {
            smoothed[i] = alpha * data[i] + (1 - alpha) * smoothed[i - 1];
        }
        double errorSum = 0;
        for (int i = 1; i < data.length; i++) {
            errorSum += Math.abs(data[i] - smoothed[i - 1]);
        }
        double accuracy = rangeAccuracy(errorSum / (data.length - 1), data);
        return model(metric, PredictionModel.ModelType.EXPONENTIAL,
                List.of(alpha, smoothed[smoothed.length - 1]), accuracy, data.length, now);
    }

    /**
     * ARIMA(1,1,1)-like: AR(1) fitted on first differences, fixed MA term.
     * Falls back to the linear fit when there are too few differences.
     */
    PredictionModel fitArima(String metric, double[] data, Instant now) {
        int m = data.length - 1;
        if (m < 2) return fitLinear(metric, data, now);
        double[] diff = new double[m];
        for (int i = 0; i < m; i++) diff[i] = data[i + 1] - data[i];

        int n = m - 1;
        double sumCurr = 0, sumPrev = 0, sumCross = 0, sumPrevSq = 0;
        for (int i = 0; i < n; i++) {
            sumCurr += diff[i + 1];
            sumPrev += diff[i];
            sumCross += diff[i + 1] * diff[i];
            sumPrevSq += diff[i] * diff[i];
        }
        double denominator = n * sumPrevSq - sumPrev * sumPrev;
        double ar = denominator == 0 ? 0.0 : (n * sumCross - sumCurr * sumPrev) / denominator;

        // one-step-ahead errors: predict data[i + 2] from data[i + 1] and the diff that led to it
        double errorSum = 0;
        for (int i = 0; i < data.length - 2; i++) {
            double predicted = data[i + 1] + ar * diff[i];
            errorSum += Math.abs(predicted - data[i + 2]);
        }
        double accuracy = rangeAccuracy(errorSum / (data.length - 2), data);
        double ma = properties.getPrediction().getArimaMaCoefficient();
        return model(metric, PredictionModel.ModelType.ARIMA,
                List.of(ar, ma, data[data.length - 1], diff[m - 1]), accuracy, data.length, now);
    }

    private static double rangeAccuracy(double meanError, double[] data) {
        double range = Statistics.max(data) - Statistics.min(data);
        if (range == 0) return meanError == 0 ? 1.0 : 0.0;
        return Math.max(0.0, 1 - meanError / range);
    }

    private static PredictionModel model(String metric, PredictionModel.ModelType type, List<Double> coefficients,
                                         double accuracy, int count, Instant now) {
        return PredictionModel.builder()
                .metric(metric)
                .type(type)
                .coefficients(coefficients)
                .accuracy(accuracy)
                .trainingDataCount(count)
                .lastTrained(now)
                .build();
    }

    // --- forecasting & risk ---

    record Forecast(double value, double confidence) {
    }

    static Forecast forecast(PredictionModel model, int horizonMinutes) {
        double value = switch (model.getType()) {
            case LINEAR -> model.coefficient(0) + model.coefficient(1) * horizonMinutes;
            case EXPONENTIAL -> model.coefficient(1);
            case ARIMA -> model.coefficient(2) + model.coefficient(0) * model.coefficient(3) * (horizonMinutes / 5.0);
        };
        double confidence = Math.max(0.1, model.getAccuracy() * Math.exp(-horizonMinutes / 60.0));
        return new Forecast(Math.max(0.0, value), confidence);
    }

    static Trend determineTrend(PredictionModel model, double currentValue) {
        if (model.getType() == PredictionModel.ModelType.LINEAR) {
            double slope = model.coefficient(1);
            if (slope > TREND_THRESHOLD) return Trend.INCREASING;
            if (slope < -TREND_THRESHOLD) return Trend.DECREASING;
            return Trend.STABLE;
        }
        double projected = forecast(model, 5).value();
        if (currentValue == 0) {
            return projected > 0 ? Trend.INCREASING : Trend.STABLE;
        }
        double change = (projected - currentValue) / currentValue;
        if (change > TREND_THRESHOLD) return Trend.INCREASING;
        if (change < -TREND_THRESHOLD) return Trend.DECREASING;
        return Trend.STABLE;
    }

    RiskLevel assessRisk(Forecast forecast, double currentValue, RiskFactors risk) {
        MonitorProperties.PredictionConfig.RiskWeights weights = properties.getPrediction().getRiskWeights();
        MonitorProperties.PredictionConfig.RiskThresholds thresholds = properties.getPrediction().getRiskThresholds();

        double changeRatio = currentValue == 0
                ? (forecast.value() == 0 ? 0.0 : 1.0)
                : Math.abs(forecast.value() - currentValue) / Math.abs(currentValue);
        double overall = changeRatio * weights.getChangeRatio()
                + risk.volatility() * weights.getVolatility()
                + Math.abs(risk.trend()) * weights.getTrend()
                + risk.anomalyFrequency() * weights.getAnomalyFrequency()
                + (1 - forecast.confidence()) * weights.getUncertainty();

        if (overall >= thresholds.getHigh()) return RiskLevel.HIGH;
        if (overall >= thresholds.getMedium()) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    static RiskFactors riskFactors(String metric, List<SystemMetrics> recent, List<AnomalyResult> anomalies) {
        double[] values = recent.stream()
                .map(m -> m.metricValue(metric))
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .toArray();
        if (values.length == 0) return RiskFactors.NONE;

        double mean = Statistics.mean(values);
        double trend = 0.0;
        if (values.length >= 2 && mean > 0) {
            trend = Statistics.ols(values).slope() / mean;
        }
        double volatility = mean > 0 ? Statistics.stdDev(values) / mean : 0.0;
        long metricAnomalies = anomalies.stream().filter(a -> metric.equals(a.getMetric())).count();
        double frequency = (double) metricAnomalies / Math.max(1, recent.size());

        return new RiskFactors(
                Statistics.clamp(trend, -1, 1),
                Statistics.clamp(volatility, 0, 1),
                Statistics.clamp(seasonality(values), 0, 1),
                Statistics.clamp(frequency, 0, 1));
    }

    /**
     * Lag-24 autocorrelation magnitude relative to the mean square.
     */
    private static double seasonality(double[] values) {
        if (values.length < SEASONAL_LAG) return 0.0;
        double correlation = 0;
        int count = 0;
        for (int i = 0; i < values.length - SEASONAL_LAG; i++) {
            correlation += values[i] * values[i + SEASONAL_LAG];
            count++;
        }
        if (count == 0) return 0.0;
        double meanSquare = 0;
        for (double v : values) meanSquare += v * v;
        meanSquare /= values.length;
        return meanSquare > 0 ? Math.abs(correlation / count) / meanSquare : 0.0;
    }
}
