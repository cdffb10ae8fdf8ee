package com.example.pulsemonitor.storage;

import com.example.pulsemonitor.config.MonitorProperties;
import com.example.pulsemonitor.domain.Alert;
import com.example.pulsemonitor.domain.AnomalyModel;
import com.example.pulsemonitor.domain.AnomalyResult;
import com.example.pulsemonitor.domain.HealthCheckResult;
import com.example.pulsemonitor.domain.PredictionModel;
import com.example.pulsemonitor.domain.PredictionResult;
import com.example.pulsemonitor.domain.SystemMetrics;
import com.example.pulsemonitor.event.StorageEvictionEvent;
import com.example.pulsemonitor.exception.UnknownEntityException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Function;

/**
 * Bounded in-memory store. Every time series is a ring buffer capped at
 * {@code maxEntries}; a periodic cleanup pass purges anything older than the
 * retention window. Models are kept as JSON documents keyed by metric name so
 * a reload goes through the same serialization a persistent backend would.
 */
@Slf4j
@Service
public class InMemoryStorageManager implements StorageManager {

    private final MonitorProperties.StorageConfig config;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final TaskScheduler scheduler;

    private final BoundedTimeSeries<SystemMetrics> metrics;
    private final BoundedTimeSeries<HealthCheckResult> healthResults;
    private final BoundedTimeSeries<AnomalyResult> anomalies;
    private final BoundedTimeSeries<PredictionResult> predictions;
    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();
    private final Map<String, String> anomalyModels = new ConcurrentHashMap<>();
    private final Map<String, String> predictionModels = new ConcurrentHashMap<>();

    private final Object cleanupLock = new Object();
    private ScheduledFuture<?> cleanupTask;

    public InMemoryStorageManager(MonitorProperties properties,
                                  ObjectMapper objectMapper,
                                  ApplicationEventPublisher eventPublisher,
                                  Clock clock,
                                  @Qualifier("monitoringScheduler") TaskScheduler scheduler) {
        this.config = properties.getStorage();
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.scheduler = scheduler;

        int maxEntries = config.getMaxEntries();
        this.metrics = new BoundedTimeSeries<>("metrics", maxEntries, SystemMetrics::getTimestamp);
        this.healthResults = new BoundedTimeSeries<>("health", maxEntries, HealthCheckResult::timestamp);
        this.anomalies = new BoundedTimeSeries<>("anomalies", maxEntries, AnomalyResult::getTimestamp);
        this.predictions = new BoundedTimeSeries<>("predictions", maxEntries, PredictionResult::getTimestamp);
    }

    @PostConstruct
    public void init() {
        if (config.isCleanupEnabled()) {
            startCleanup();
        }
    }

    @PreDestroy
    public void shutdown() {
        stopCleanup();
    }

    // --- writes ---

    @Override
    public CompletableFuture<Void> storeMetrics(List<SystemMetrics> batch) {
        return append(metrics, batch, SystemMetrics::getTimestamp);
    }

    @Override
    public CompletableFuture<Void> storeHealthResults(List<HealthCheckResult> batch) {
        return append(healthResults, batch, HealthCheckResult::timestamp);
    }

    @Override
    public CompletableFuture<Void> storeAnomalyResults(List<AnomalyResult> batch) {
        return append(anomalies, batch, AnomalyResult::getTimestamp);
    }

    @Override
    public CompletableFuture<Void> storePredictions(List<PredictionResult> batch) {
        return append(predictions, batch, PredictionResult::getTimestamp);
    }

    @Override
    public CompletableFuture<Void> storeAlert(Alert alert) {
        if (alert == null || alert.getId() == null || alert.getTimestamp() == null) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Alert requires an id and a timestamp"));
        }
        alerts.put(alert.getId(), alert.copy());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> updateAlert(Alert alert) {
        if (alert == null || alert.getId() == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Alert id is required"));
        }
        Alert replaced = alerts.computeIfPresent(alert.getId(), (id, existing) -> alert.copy());
        if (replaced == null) {
            return CompletableFuture.failedFuture(new UnknownEntityException("alert", alert.getId()));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> storeAnomalyModel(AnomalyModel model) {
        return storeDocument(anomalyModels, model.metric(),
                () -> objectMapper.writerFor(AnomalyModel.class).writeValueAsString(model));
    }

    @Override
    public CompletableFuture<Void> storePredictionModel(PredictionModel model) {
        return storeDocument(predictionModels, model.getMetric(),
                () -> objectMapper.writeValueAsString(model));
    }

    // --- reads ---

    @Override
    public CompletableFuture<List<SystemMetrics>> getMetrics(TimeRange range) {
        return CompletableFuture.completedFuture(metrics.range(range.start(), range.end()));
    }

    @Override
    public CompletableFuture<List<SystemMetrics>> getLatestMetrics(int count) {
        return CompletableFuture.completedFuture(metrics.latest(count));
    }

    @Override
    public CompletableFuture<List<HealthCheckResult>> getHealthResults(TimeRange range) {
        return CompletableFuture.completedFuture(healthResults.range(range.start(), range.end()));
    }

    @Override
    public CompletableFuture<List<AnomalyResult>> getAnomalies(TimeRange range) {
        return CompletableFuture.completedFuture(anomalies.range(range.start(), range.end()));
    }

    @Override
    public CompletableFuture<List<PredictionResult>> getPredictions(TimeRange range) {
        return CompletableFuture.completedFuture(predictions.range(range.start(), range.end()));
    }

    @Override
    public CompletableFuture<Optional<Alert>> getAlert(String id) {
        return CompletableFuture.completedFuture(Optional.ofNullable(alerts.get(id)).map(Alert::copy));
    }

    @Override
    public CompletableFuture<List<Alert>> getAlerts(TimeRange range) {
        return CompletableFuture.completedFuture(alerts.values().stream()
                .filter(a -> range.contains(a.getTimestamp()))
                .sorted(Comparator.comparing(Alert::getTimestamp))
                .map(Alert::copy)
                .toList());
    }

    @Override
    public CompletableFuture<List<Alert>> getActiveAlerts() {
        return CompletableFuture.completedFuture(alerts.values().stream()
                .filter(a -> a.getStatus() != Alert.AlertStatus.RESOLVED)
                .sorted(Comparator.comparing(Alert::getTimestamp))
                .map(Alert::copy)
                .toList());
    }

    @Override
    public CompletableFuture<Optional<AnomalyModel>> getAnomalyModel(String metric) {
        return readDocument(anomalyModels.get(metric), AnomalyModel.class);
    }

    @Override
    public CompletableFuture<Optional<PredictionModel>> getPredictionModel(String metric) {
        return readDocument(predictionModels.get(metric), PredictionModel.class);
    }

    @Override
    public CompletableFuture<List<AggregatedPoint>> aggregateMetrics(String metric, TimeRange range,
                                                                     Duration bucket,
                                                                     AggregatedPoint.Aggregation aggregation) {
        Duration width = bucket != null ? bucket : config.getAggregationBucket();
        long widthMillis = width.toMillis();
        if (widthMillis <= 0) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Bucket width must be positive"));
        }

        Map<Long, List<Double>> buckets = new TreeMap<>();
        for (SystemMetrics sample : metrics.range(range.start(), range.end())) {
            Double value = sample.metricValue(metric);
            if (value == null) continue;
            long key = Math.floorDiv(sample.getTimestamp().toEpochMilli(), widthMillis);
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }

        List<AggregatedPoint> points = new ArrayList<>(buckets.size());
        buckets.forEach((key, values) -> points.add(new AggregatedPoint(
                Instant.ofEpochMilli(key * widthMillis), reduce(values, aggregation), values.size())));
        return CompletableFuture.completedFuture(points);
    }

    @Override
    public CompletableFuture<Map<String, Integer>> getStats() {
        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("metrics", metrics.size());
        stats.put("health", healthResults.size());
        stats.put("anomalies", anomalies.size());
        stats.put("predictions", predictions.size());
        stats.put("alerts", alerts.size());
        stats.put("anomalyModels", anomalyModels.size());
        stats.put("predictionModels", predictionModels.size());
        return CompletableFuture.completedFuture(stats);
    }

    // --- retention ---

    public void startCleanup() {
        synchronized (cleanupLock) {
            if (cleanupTask != null) return;
            cleanupTask = scheduler.scheduleWithFixedDelay(this::runCleanupSafely, config.getCleanupInterval());
            log.info("Storage cleanup scheduled every {} (retention {}, resolved alerts {})",
                    config.getCleanupInterval(), config.getRetention(), config.effectiveResolvedAlertRetention());
        }
    }

    public void stopCleanup() {
        synchronized (cleanupLock) {
            if (cleanupTask == null) return;
            cleanupTask.cancel(false);
            cleanupTask = null;
            log.info("Storage cleanup stopped");
        }
    }

    /**
     * Purge time-series entries older than the retention window and alerts
     * resolved longer ago than the resolved-alert retention.
     *
     * @return total number of entries removed
     */
    public int runCleanup() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(config.getRetention());
        Instant resolvedCutoff = now.minus(config.effectiveResolvedAlertRetention());

        int removed = 0;
        for (BoundedTimeSeries<?> series : List.of(metrics, healthResults, anomalies, predictions)) {
            int purged = series.purgeOlderThan(cutoff);
            if (purged > 0) {
                publishEviction(series.getName(), purged, StorageEvictionEvent.Reason.RETENTION);
            }
            removed += purged;
        }

        int alertsBefore = alerts.size();
        alerts.values().removeIf(a -> a.getStatus() == Alert.AlertStatus.RESOLVED
                && resolutionTime(a).isBefore(resolvedCutoff));
        int purgedAlerts = alertsBefore - alerts.size();
        if (purgedAlerts > 0) {
            publishEviction("alerts", purgedAlerts, StorageEvictionEvent.Reason.RETENTION);
        }
        removed += purgedAlerts;

        log.debug("Storage cleanup removed {} entries", removed);
        return removed;
    }

    private void runCleanupSafely() {
        try {
            runCleanup();
        } catch (Exception e) {
            log.error("Storage cleanup failed: {}", e.getMessage(), e);
        }
    }

    // --- helpers ---

    private <T> CompletableFuture<Void> append(BoundedTimeSeries<T> series, List<T> batch,
                                               Function<T, Instant> timestampOf) {
        if (batch == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Batch is required"));
        }
        for (T entry : batch) {
            if (entry == null || timestampOf.apply(entry) == null) {
                return CompletableFuture.failedFuture(new IllegalArgumentException(
                        "Rejected " + series.getName() + " batch: every entry needs a timestamp"));
            }
        }
        int evicted = series.appendAll(List.copyOf(batch));
        if (evicted > 0) {
            log.debug("Evicted {} oldest {} entries (capacity {})", evicted, series.getName(), series.getCapacity());
            publishEviction(series.getName(), evicted, StorageEvictionEvent.Reason.CAPACITY);
        }
        return CompletableFuture.completedFuture(null);
    }

    private CompletableFuture<Void> storeDocument(Map<String, String> documents, String key, JsonWriter writer) {
        if (key == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Model metric is required"));
        }
        try {
            documents.put(key, writer.write());
            return CompletableFuture.completedFuture(null);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Failed to serialize model for " + key, e));
        }
    }

    private <T> CompletableFuture<Optional<T>> readDocument(String json, Class<T> type) {
        if (json == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        try {
            return CompletableFuture.completedFuture(Optional.of(objectMapper.readValue(json, type)));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Corrupt " + type.getSimpleName() + " document", e));
        }
    }

    private static Instant resolutionTime(Alert alert) {
        return alert.getResolvedAt() != null ? alert.getResolvedAt() : alert.getTimestamp();
    }

    private void publishEviction(String series, int count, StorageEvictionEvent.Reason reason) {
        eventPublisher.publishEvent(new StorageEvictionEvent(series, count, reason, clock.instant()));
    }

    private static double reduce(List<Double> values, AggregatedPoint.Aggregation aggregation) {
        return switch (aggregation) {
            case AVG -> values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            case MIN -> values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
            case MAX -> values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            case SUM -> values.stream().mapToDouble(Double::doubleValue).sum();
        };
    }

    @FunctionalInterface
    private interface JsonWriter {
        String write() throws JsonProcessingException;
    }
}
