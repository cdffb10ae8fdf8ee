package com.example.pulsemonitor.monitoring;

import com.example.pulsemonitor.config.MonitorProperties;
import com.example.pulsemonitor.domain.SystemMetrics;
import com.example.pulsemonitor.event.MetricsCollectedEvent;
import com.example.pulsemonitor.event.MetricsCollectionFailedEvent;
import com.example.pulsemonitor.exception.CollectionException;
import io.micrometer.core.instrument.Counter;
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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Metrics Collector - samples host resources and registered custom metrics.
 *
 * The periodic loop is single-flight: a tick that arrives while the previous
 * sample is still running is skipped. Sampling failures are published as
 * events and never stop the loop.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsCollector {

    private final SystemProbe systemProbe;
    private final MonitorProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    @Qualifier("monitoringScheduler")
    private final TaskScheduler scheduler;
    @Qualifier("collectorExecutor")
    private final Executor collectorExecutor;

    private final Map<String, CustomMetricSource> customMetrics = new ConcurrentHashMap<>();
    private final AtomicBoolean sampling = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private ScheduledFuture<?> periodicTask;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        MonitorProperties.CollectorConfig config = properties.getCollector();
        if (!config.isEnabled()) {
            log.info("Metrics collection disabled");
            return;
        }
        startPeriodic(config.getInterval());
    }

    /**
     * Take one snapshot.
     *
     * @throws CollectionException when the CPU, memory or disk probe fails
     */
    public SystemMetrics sampleOnce() {
        Timer.Sample timer = Timer.start(meterRegistry);
        try {
            SystemMetrics metrics = SystemMetrics.builder()
                    .timestamp(clock.instant())
                    .cpu(probe("cpu", systemProbe::readCpu))
                    .memory(probe("memory", systemProbe::readMemory))
                    .disk(probe("disk", systemProbe::readDisk))
                    .network(probe("network", systemProbe::readNetwork))
                    .custom(collectCustomMetrics())
                    .build();
            timer.stop(Timer.builder("pulse.collector.sample.duration")
                    .tag("outcome", "success")
                    .register(meterRegistry));
            return metrics;
        } catch (CollectionException e) {
            timer.stop(Timer.builder("pulse.collector.sample.duration")
                    .tag("outcome", "failure")
                    .register(meterRegistry));
            throw e;
        }
    }

    public void startPeriodic(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sampling interval must be positive: " + interval);
        }
        synchronized (lifecycleLock) {
            if (periodicTask != null) {
                log.debug("Metrics collection already running");
                return;
            }
            periodicTask = scheduler.scheduleAtFixedRate(this::tick, interval);
            log.info("Metrics collection started (interval: {})", interval);
        }
    }

    /**
     * Stop the periodic loop. Safe to call more than once.
     */
    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (periodicTask == null) return;
            periodicTask.cancel(false);
            periodicTask = null;
            log.info("Metrics collection stopped");
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return periodicTask != null;
        }
    }

    /**
     * One sampling tick: sample and publish, or publish the failure.
     *
     * @return false when skipped because a previous tick is still in flight
     */
    boolean tick() {
        if (!sampling.compareAndSet(false, true)) {
            Counter.builder("pulse.collector.ticks.skipped").register(meterRegistry).increment();
            log.debug("Skipping sampling tick, previous sample still in flight");
            return false;
        }
        try {
            SystemMetrics metrics = sampleOnce();
            eventPublisher.publishEvent(new MetricsCollectedEvent(metrics));
        } catch (Exception e) {
            log.warn("Metrics collection failed: {}", e.getMessage());
            eventPublisher.publishEvent(new MetricsCollectionFailedEvent(e.getMessage(), e, clock.instant()));
        } finally {
            sampling.set(false);
        }
        return true;
    }

    public void registerCustomMetric(String name, CustomMetricSource source) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Custom metric name is required");
        }
        customMetrics.put(name, source);
        log.info("Registered custom metric: {}", name);
    }

    public boolean unregisterCustomMetric(String name) {
        return customMetrics.remove(name) != null;
    }

    public Set<String> getCustomMetricNames() {
        return new TreeSet<>(customMetrics.keySet());
    }

    private Map<String, Double> collectCustomMetrics() {
        Map<String, CompletableFuture<Double>> pending = new LinkedHashMap<>();
        customMetrics.forEach((name, source) -> pending.put(name,
                CompletableFuture.supplyAsync(() -> readCustom(name, source), collectorExecutor)
                        .exceptionally(e -> {
                            log.warn("Custom metric {} failed: {}", name, e.getMessage());
                            return 0.0;
                        })));

        CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();

        Map<String, Double> values = new LinkedHashMap<>();
        pending.forEach((name, future) -> values.put(name, future.join()));
        return values;
    }

    private static double readCustom(String name, CustomMetricSource source) {
        try {
            return source.read();
        } catch (Exception e) {
            throw new CollectionException("Custom metric " + name + " failed", e);
        }
    }

    private static <T> T probe(String name, Supplier<T> read) {
        try {
            return read.get();
        } catch (CollectionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollectionException("Probe " + name + " failed: " + e.getMessage(), e);
        }
    }
}
