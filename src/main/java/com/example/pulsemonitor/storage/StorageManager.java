package com.example.pulsemonitor.storage;

import com.example.pulsemonitor.domain.Alert;
import com.example.pulsemonitor.domain.AnomalyModel;
import com.example.pulsemonitor.domain.AnomalyResult;
import com.example.pulsemonitor.domain.HealthCheckResult;
import com.example.pulsemonitor.domain.PredictionModel;
import com.example.pulsemonitor.domain.PredictionResult;
import com.example.pulsemonitor.domain.SystemMetrics;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Time-indexed persistence shared by every monitoring component.
 *
 * <p>Operations are asynchronous so that an I/O-bound backend can sit behind
 * the same contract. Batch writes are all-or-nothing: a rejected batch leaves
 * the store untouched and completes the future exceptionally.
 */
public interface StorageManager {

    CompletableFuture<Void> storeMetrics(List<SystemMetrics> metrics);

    CompletableFuture<Void> storeHealthResults(List<HealthCheckResult> results);

    CompletableFuture<Void> storeAnomalyResults(List<AnomalyResult> anomalies);

    CompletableFuture<Void> storePredictions(List<PredictionResult> predictions);

    CompletableFuture<Void> storeAlert(Alert alert);

    /**
     * Replace a stored alert. Fails with
     * {@link com.example.pulsemonitor.exception.UnknownEntityException} when the id is not stored.
     */
    CompletableFuture<Void> updateAlert(Alert alert);

    CompletableFuture<Void> storeAnomalyModel(AnomalyModel model);

    CompletableFuture<Void> storePredictionModel(PredictionModel model);

    CompletableFuture<List<SystemMetrics>> getMetrics(TimeRange range);

    CompletableFuture<List<SystemMetrics>> getLatestMetrics(int count);

    CompletableFuture<List<HealthCheckResult>> getHealthResults(TimeRange range);

    CompletableFuture<List<AnomalyResult>> getAnomalies(TimeRange range);

    CompletableFuture<List<PredictionResult>> getPredictions(TimeRange range);

    CompletableFuture<Optional<Alert>> getAlert(String id);

    CompletableFuture<List<Alert>> getAlerts(TimeRange range);

    /**
     * Alerts that are not yet resolved, oldest first.
     */
    CompletableFuture<List<Alert>> getActiveAlerts();

    CompletableFuture<Optional<AnomalyModel>> getAnomalyModel(String metric);

    CompletableFuture<Optional<PredictionModel>> getPredictionModel(String metric);

    /**
     * Reduce a named metric into fixed-width buckets keyed by floor(timestamp / bucket).
     */
    CompletableFuture<List<AggregatedPoint>> aggregateMetrics(String metric, TimeRange range,
                                                              Duration bucket, AggregatedPoint.Aggregation aggregation);

    /**
     * Entry counts per stored kind.
     */
    CompletableFuture<Map<String, Integer>> getStats();
}
