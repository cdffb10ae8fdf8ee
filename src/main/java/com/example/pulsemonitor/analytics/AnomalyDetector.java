package com.example.pulsemonitor.analytics;

import com.example.pulsemonitor.config.MonitorProperties;
import com.example.pulsemonitor.domain.AnomalyModel;
import com.example.pulsemonitor.domain.AnomalyResult;
import com.example.pulsemonitor.domain.Severity;
import com.example.pulsemonitor.domain.SystemMetrics;
import com.example.pulsemonitor.event.AnomaliesDetectedEvent;
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
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Anomaly Detector - fits one model per metric from history and scores live
 * samples against it.
 *
 * Models live in an immutable map behind a volatile reference; retraining
 * builds a new map and swaps it in, so a concurrent {@link #detect} sees
 * either the old or the new model, never a half-built one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnomalyDetector {

    /** Share of detrended variance the seasonal profile must explain to be used. */
    static final double SEASONAL_STRENGTH_THRESHOLD = 0.3;
    private static final double MIN_SPREAD = 1e-9;

    private final StorageManager storageManager;
    private final MonitorProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private volatile Map<String, ModelSlot> models = Map.of();

    /**
     * A model plus the series position of the next live observation, used to
     * pick the seasonal bucket.
     */
    private record ModelSlot(AnomalyModel model, AtomicLong nextPosition) {
    }

    public record ModelInfo(String metric, AnomalyModel.ModelType type, double accuracy, Instant lastTrained) {
    }

    /**
     * Train from the configured window of stored metrics.
     */
    public void trainFromStorage() {
        TimeRange range = TimeRange.lastOf(properties.getAnomaly().getTrainingWindow(), clock);
        trainModels(storageManager.getMetrics(range).join());
    }

    /**
     * Fit a model for every metric present in the history. Metrics with enough
     * points are trained and swapped in; metrics below the minimum keep their
     * previous model.
     *
     * @throws InsufficientDataException after committing the successful metrics,
     *                                   if any metric lacked data
     */
    public void trainModels(List<SystemMetrics> historical) {
        MonitorProperties.AnomalyConfig config = properties.getAnomaly();
        Map<String, List<Double>> series = collectSeries(historical);
        Map<String, ModelSlot> trained = new HashMap<>();
        List<InsufficientDataException> failures = new ArrayList<>();

        series.forEach((metric, values) -> {
            if (values.size() < config.getMinTrainingPoints()) {
                InsufficientDataException failure =
                        new InsufficientDataException(metric, values.size(), config.getMinTrainingPoints());
                log.warn("Anomaly model training skipped: {}", failure.getMessage());
                eventPublisher.publishEvent(new ModelTrainingFailedEvent(
                        "anomaly", metric, failure.getMessage(), clock.instant()));
                failures.add(failure);
                return;
            }
            double[] data = Statistics.toArray(values);
            AnomalyModel model = fit(metric, data);
            trained.put(metric, new ModelSlot(model, new AtomicLong(data.length)));
        });

        if (!trained.isEmpty()) {
            Map<String, ModelSlot> next = new HashMap<>(models);
            next.putAll(trained);
            models = Map.copyOf(next);
            trained.values().forEach(slot -> storageManager.storeAnomalyModel(slot.model())
                    .exceptionally(e -> {
                        log.error("Failed to persist anomaly model for {}: {}", slot.model().metric(), e.getMessage());
                        return null;
                    }));
            log.info("Trained {} anomaly models from {} samples", trained.size(), historical.size());
        }

        if (!failures.isEmpty()) {
            InsufficientDataException first = failures.get(0);
            failures.stream().skip(1).forEach(first::addSuppressed);
            throw first;
        }
    }

    /**
     * Score a live sample against every trained model.
     *
     * @return anomalies only; empty when everything is within range
     */
    public List<AnomalyResult> detect(SystemMetrics sample) {
        double sensitivity = properties.getAnomaly().getSensitivity();
        Map<String, Double> values = sample.metricValues();
        List<AnomalyResult> anomalies = new ArrayList<>();

        for (ModelSlot slot : models.values()) {
            AnomalyModel model = slot.model();
            Double value = values.get(model.metric());
            if (value == null) continue;

            long position = slot.nextPosition().getAndIncrement();
            double center = model.expectedCenter(position);
            double spread = Math.max(model.spread(), MIN_SPREAD);
            double z = (value - center) / spread;
            if (Math.abs(z) <= sensitivity) continue;

            double score = Math.abs(z) / sensitivity;
            double min = center - sensitivity * spread;
            double max = center + sensitivity * spread;
            anomalies.add(AnomalyResult.builder()
                    .metric(model.metric())
                    .value(value)
                    .expectedMin(min)
                    .expectedMax(max)
                    .score(score)
                    .severity(severityFor(score))
                    .timestamp(sample.getTimestamp())
                    .modelType(model.modelType())
                    .description(String.format("%s value %.2f outside expected range [%.2f, %.2f] (z=%.2f, %s model)",
                            model.metric(), value, min, max, z, model.modelType().name().toLowerCase()))
                    .build());
        }

        if (!anomalies.isEmpty()) {
            Counter.builder("pulse.anomalies.detected").register(meterRegistry).increment(anomalies.size());
            log.info("Detected {} anomalies at {}", anomalies.size(), sample.getTimestamp());
            storageManager.storeAnomalyResults(anomalies).exceptionally(e -> {
                log.error("Failed to store anomaly batch: {}", e.getMessage());
                return null;
            });
            eventPublisher.publishEvent(new AnomaliesDetectedEvent(List.copyOf(anomalies)));
        }
        return anomalies;
    }

    public Optional<AnomalyModel> getModel(String metric) {
        return Optional.ofNullable(models.get(metric)).map(ModelSlot::model);
    }

    public List<ModelInfo> getModelInfo() {
        return models.values().stream()
                .map(ModelSlot::model)
                .map(m -> new ModelInfo(m.metric(), m.modelType(), m.accuracy(), m.lastTrained()))
                .sorted(Comparator.comparing(ModelInfo::metric))
                .toList();
    }

    static Severity severityFor(double score) {
        if (score > 5) return Severity.CRITICAL;
        if (score > 3) return Severity.HIGH;
        if (score > 2) return Severity.MEDIUM;
        return Severity.LOW;
    }

    // --- fitting ---

    AnomalyModel fit(String metric, double[] data) {
        MonitorProperties.AnomalyConfig config = properties.getAnomaly();
        Instant now = clock.instant();
        double sensitivity = config.getSensitivity();

        if (config.getTrendMetrics().contains(metric)) {
            return fitTrend(metric, data, sensitivity, now);
        }

        int period = Math.min(config.getMaxSeasonLength(), data.length / 4);
        if (period >= 2) {
            AnomalyModel.Seasonal seasonal = fitSeasonal(metric, data, period, sensitivity, now);
            if (seasonalStrength(data, seasonal) >= SEASONAL_STRENGTH_THRESHOLD) {
                return seasonal;
            }
        }
        return fitStatistical(metric, data, sensitivity, now);
    }

    private AnomalyModel.Statistical fitStatistical(String metric, double[] data, double sensitivity, Instant now) {
        double mean = Statistics.mean(data);
        double std = Statistics.stdDev(data);
        return new AnomalyModel.Statistical(metric, mean, std, sensitivity * std, now,
                withinBand(data, mean, std, sensitivity));
    }

    private AnomalyModel.Seasonal fitSeasonal(String metric, double[] data, int period,
                                              double sensitivity, Instant now) {
        double[] bucketSums = new double[period];
        int[] bucketCounts = new int[period];
        for (int i = 0; i < data.length; i++) {
            bucketSums[i % period] += data[i];
            bucketCounts[i % period]++;
        }
        double[] raw = new double[period];
        for (int k = 0; k < period; k++) {
            raw[k] = bucketCounts[k] == 0 ? 0.0 : bucketSums[k] / bucketCounts[k];
        }
        double level = Statistics.mean(raw);
        List<Double> seasonal = new ArrayList<>(period);
        for (double v : raw) seasonal.add(v - level);

        Statistics.Line line = Statistics.ols(data);
        double[] residuals = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            residuals[i] = data[i] - seasonal.get(i % period) - line.at(i);
        }
        AnomalyModel.Statistical residual = fitStatistical(metric, residuals, sensitivity, now);
        return new AnomalyModel.Seasonal(metric, List.copyOf(seasonal), line.slope(), line.intercept(),
                line.at(data.length - 1), residual, now, residual.accuracy());
    }

    private AnomalyModel.Trend fitTrend(String metric, double[] data, double sensitivity, Instant now) {
        Statistics.Line line = Statistics.ols(data);
        double[] residuals = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            residuals[i] = data[i] - line.at(i);
        }
        AnomalyModel.Statistical residual = fitStatistical(metric, residuals, sensitivity, now);
        return new AnomalyModel.Trend(metric, line.slope(), line.intercept(), line.at(data.length - 1),
                residual, now, residual.accuracy());
    }

    private static double seasonalStrength(double[] data, AnomalyModel.Seasonal model) {
        double[] detrended = new double[data.length];
        double[] seasonalPart = new double[data.length];
        int period = model.seasonal().size();
        for (int i = 0; i < data.length; i++) {
            detrended[i] = data[i] - (model.trendIntercept() + model.trendSlope() * i);
            seasonalPart[i] = model.seasonal().get(i % period);
        }
        double total = Math.pow(Statistics.stdDev(detrended), 2);
        if (total == 0.0) return 0.0;
        return Math.pow(Statistics.stdDev(seasonalPart), 2) / total;
    }

    private static double withinBand(double[] data, double mean, double std, double sensitivity) {
        if (data.length == 0) return 0.0;
        double limit = sensitivity * std;
        long inside = 0;
        for (double v : data) {
            if (Math.abs(v - mean) <= limit) inside++;
        }
        return (double) inside / data.length;
    }

    private static Map<String, List<Double>> collectSeries(List<SystemMetrics> historical) {
        Map<String, List<Double>> series = new LinkedHashMap<>();
        for (SystemMetrics sample : historical) {
            sample.metricValues().forEach((metric, value) -> {
                List<Double> values = series.computeIfAbsent(metric, k -> new ArrayList<>());
                if (value != null && Double.isFinite(value)) {
                    values.add(value);
                }
            });
        }
        return series;
    }
}
