package com.example.pulsemonitor.monitoring;

import com.example.pulsemonitor.analytics.AnomalyDetector;
import com.example.pulsemonitor.analytics.FaultPredictor;
import com.example.pulsemonitor.config.MonitorProperties;
import com.example.pulsemonitor.domain.Alert;
import com.example.pulsemonitor.domain.AnomalyResult;
import com.example.pulsemonitor.domain.HealthCheckResult;
import com.example.pulsemonitor.domain.PredictionResult;
import com.example.pulsemonitor.domain.SystemMetrics;
import com.example.pulsemonitor.event.HealthDegradedEvent;
import com.example.pulsemonitor.event.MetricsCollectedEvent;
import com.example.pulsemonitor.exception.InsufficientDataException;
import com.example.pulsemonitor.service.AlertManager;
import com.example.pulsemonitor.storage.StorageManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * Core Monitoring Service - runs every collected sample through the
 * pipeline: store, grade health, detect anomalies, evaluate alert rules,
 * forecast. Also owns the periodic model retraining.
 *
 * Each stage is isolated; a failing stage is logged and the remaining
 * stages still run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonitoringService {

    private final StorageManager storageManager;
    private final HealthEvaluator healthEvaluator;
    private final AnomalyDetector anomalyDetector;
    private final FaultPredictor faultPredictor;
    private final AlertManager alertManager;
    private final MonitorProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    @Qualifier("monitoringScheduler")
    private final TaskScheduler scheduler;

    private final List<ScheduledFuture<?>> retrainingTasks = new ArrayList<>();

    public record CycleSummary(List<HealthCheckResult> health, List<AnomalyResult> anomalies,
                               List<PredictionResult> predictions, List<Alert> alerts) {
    }

    @EventListener
    public void onMetricsCollected(MetricsCollectedEvent event) {
        process(event.metrics());
    }

    public CycleSummary process(SystemMetrics metrics) {
        Timer.Sample timer = Timer.start(meterRegistry);
        List<Alert> alerts = new ArrayList<>();

        stage("store", () -> storageManager.storeMetrics(List.of(metrics)).join());

        List<HealthCheckResult> health = stage("health", () -> {
            List<HealthCheckResult> results = healthEvaluator.evaluate(metrics);
            storageManager.storeHealthResults(results).join();
            List<HealthCheckResult> degraded = results.stream().filter(r -> !r.healthy()).toList();
            if (!degraded.isEmpty()) {
                eventPublisher.publishEvent(new HealthDegradedEvent(degraded));
            }
            return results;
        }, List.of());
        alerts.addAll(stage("health-rules", () -> alertManager.processHealthResults(health), List.of()));

        List<AnomalyResult> anomalies = List.of();
        if (properties.getAnomaly().isEnabled()) {
            anomalies = stage("anomaly", () -> anomalyDetector.detect(metrics), List.of());
            List<AnomalyResult> detected = anomalies;
            alerts.addAll(stage("anomaly-rules", () -> alertManager.processAnomalyResults(detected), List.of()));
        }

        List<PredictionResult> predictions = List.of();
        if (properties.getPrediction().isEnabled()) {
            predictions = stage("prediction", () -> faultPredictor.predict(metrics), List.of());
        }

        timer.stop(Timer.builder("pulse.pipeline.duration").register(meterRegistry));
        return new CycleSummary(health, anomalies, predictions, List.copyOf(alerts));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void scheduleRetraining() {
        synchronized (retrainingTasks) {
            if (!retrainingTasks.isEmpty()) return;
            if (properties.getAnomaly().isEnabled()) {
                schedule(properties.getAnomaly().getRetrainInterval(), this::retrainAnomalyModels);
            }
            if (properties.getPrediction().isEnabled()) {
                schedule(properties.getPrediction().getRetrainInterval(), this::retrainPredictionModels);
            }
        }
    }

    @PreDestroy
    public void stopRetraining() {
        synchronized (retrainingTasks) {
            retrainingTasks.forEach(task -> task.cancel(false));
            retrainingTasks.clear();
        }
    }

    public void retrainAnomalyModels() {
        try {
            anomalyDetector.trainFromStorage();
        } catch (InsufficientDataException e) {
            log.info("Anomaly retraining incomplete: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Anomaly retraining failed: {}", e.getMessage(), e);
        }
    }

    public void retrainPredictionModels() {
        try {
            faultPredictor.trainPredictionModels();
        } catch (InsufficientDataException e) {
            log.info("Prediction retraining skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Prediction retraining failed: {}", e.getMessage(), e);
        }
    }

    private void schedule(Duration interval, Runnable task) {
        retrainingTasks.add(scheduler.scheduleWithFixedDelay(task, clock.instant().plus(interval), interval));
        log.info("Model retraining scheduled every {}", interval);
    }

    private void stage(String name, Runnable action) {
        stage(name, () -> {
            action.run();
            return null;
        }, null);
    }

    private <T> T stage(String name, Supplier<T> action, T fallback) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            log.error("Pipeline stage {} failed: {}", name, e.getMessage());
            return fallback;
        }
    }
}
