package com.example.pulsemonitor.analytics;

import com.example.pulsemonitor.MutableClock;
import com.example.pulsemonitor.TestSamples;
import com.example.pulsemonitor.config.MonitorProperties;
import com.example.pulsemonitor.domain.AnomalyModel;
import com.example.pulsemonitor.domain.AnomalyResult;
import com.example.pulsemonitor.domain.Severity;
import com.example.pulsemonitor.domain.SystemMetrics;
import com.example.pulsemonitor.event.AnomaliesDetectedEvent;
import com.example.pulsemonitor.event.ModelTrainingFailedEvent;
import com.example.pulsemonitor.exception.InsufficientDataException;
import com.example.pulsemonitor.storage.StorageManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntToDoubleFunction;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class AnomalyDetectorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");
    private static final int PERIOD = 24;

    private StorageManager storage;
    private ApplicationEventPublisher publisher;
    private MonitorProperties properties;
    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        storage = mock(StorageManager.class);
        when(storage.storeAnomalyModel(any())).thenReturn(CompletableFuture.completedFuture(null));
        when(storage.storeAnomalyResults(anyList())).thenReturn(CompletableFuture.completedFuture(null));
        publisher = mock(ApplicationEventPublisher.class);
        properties = new MonitorProperties();
        detector = new AnomalyDetector(storage, properties, publisher, new SimpleMeterRegistry(),
                new MutableClock(T0.plus(Duration.ofDays(1))));
    }

    private static List<SystemMetrics> cpuSeries(int count, IntToDoubleFunction value) {
        List<SystemMetrics> samples = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            samples.add(TestSamples.cpu(T0.plusSeconds(60L * i), value.applyAsDouble(i)));
        }
        return samples;
    }

    private static double sine(int i) {
        return 50 + 10 * Math.sin(2 * Math.PI * i / PERIOD);
    }

    @Test
    void seasonalModelFlagsSpikesButNotTheNormalCycle() {
        Random noise = new Random(7);
        detector.trainModels(cpuSeries(240, i -> sine(i) + noise.nextGaussian() * 0.5));

        AnomalyModel model = detector.getModel("cpu").orElseThrow();
        assertEquals(AnomalyModel.ModelType.SEASONAL, model.modelType());
        assertEquals(PERIOD, ((AnomalyModel.Seasonal) model).seasonal().size());

        List<AnomalyResult> normal = detector.detect(TestSamples.cpu(T0.plusSeconds(60L * 240), sine(240)));
        assertTrue(normal.isEmpty());

        List<AnomalyResult> spike = detector.detect(TestSamples.cpu(T0.plusSeconds(60L * 241), sine(241) + 30));
        assertEquals(1, spike.size());
        AnomalyResult anomaly = spike.get(0);
        assertEquals("cpu", anomaly.getMetric());
        assertEquals(Severity.CRITICAL, anomaly.getSeverity());
        assertTrue(anomaly.getValue() > anomaly.getExpectedMax());
        assertEquals(AnomalyModel.ModelType.SEASONAL, anomaly.getModelType());

        verify(storage).storeAnomalyResults(spike);
        verify(publisher).publishEvent(any(AnomaliesDetectedEvent.class));
    }

    @Test
    void noiseWithoutCycleGetsStatisticalModelAndDiskGetsTrend() {
        Random noise = new Random(11);
        List<SystemMetrics> samples = new ArrayList<>();
        for (int i = 0; i < 480; i++) {
            samples.add(TestSamples.full(T0.plusSeconds(60L * i), 40 + noise.nextGaussian() * 3,
                    60 + noise.nextGaussian(), 50 + 0.01 * i, 20));
        }

        detector.trainModels(samples);

        assertEquals(AnomalyModel.ModelType.STATISTICAL, detector.getModel("cpu").orElseThrow().modelType());
        assertEquals(AnomalyModel.ModelType.TREND, detector.getModel("disk").orElseThrow().modelType());
        assertEquals(4, detector.getModelInfo().size());
    }

    @Test
    void flagsExactlyWhenZScoreExceedsSensitivity() {
        properties.getAnomaly().setSensitivity(2.0);
        Random noise = new Random(3);
        detector.trainModels(cpuSeries(480, i -> 50 + noise.nextGaussian() * 4));

        AnomalyModel.Statistical model = (AnomalyModel.Statistical) detector.getModel("cpu").orElseThrow();
        double inside = model.mean() + 1.99 * model.stdDev();
        double outside = model.mean() - 2.01 * model.stdDev();

        assertTrue(detector.detect(TestSamples.cpu(T0, inside)).isEmpty());
        List<AnomalyResult> flagged = detector.detect(TestSamples.cpu(T0, outside));
        assertEquals(1, flagged.size());
        assertEquals(2.01 / 2.0, flagged.get(0).getScore(), 1e-6);
        assertEquals(Severity.LOW, flagged.get(0).getSeverity());
    }

    @Test
    void insufficientDataKeepsPreviousModel() {
        detector.trainModels(cpuSeries(60, i -> 50 + (i % 5)));
        AnomalyModel before = detector.getModel("cpu").orElseThrow();

        InsufficientDataException error = assertThrows(InsufficientDataException.class,
                () -> detector.trainModels(cpuSeries(30, i -> 90)));

        assertEquals("cpu", error.getMetric());
        assertEquals(30, error.getAvailable());
        assertEquals(50, error.getRequired());
        assertSame(before, detector.getModel("cpu").orElseThrow());
        verify(publisher).publishEvent(any(ModelTrainingFailedEvent.class));
    }

    @Test
    void shortMetricDoesNotBlockOtherMetrics() {
        List<SystemMetrics> samples = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            SystemMetrics base = TestSamples.cpu(T0.plusSeconds(60L * i), 50 + (i % 7));
            samples.add(i < 20 ? TestSamples.withCustom(base, Map.of("queue", 5.0 + i)) : base);
        }

        InsufficientDataException error = assertThrows(InsufficientDataException.class,
                () -> detector.trainModels(samples));

        assertEquals("custom_queue", error.getMetric());
        assertTrue(detector.getModel("cpu").isPresent());
        assertTrue(detector.getModel("custom_queue").isEmpty());
        verify(storage, times(1)).storeAnomalyModel(any());
    }

    @Test
    void severityBands() {
        assertEquals(Severity.CRITICAL, AnomalyDetector.severityFor(5.01));
        assertEquals(Severity.HIGH, AnomalyDetector.severityFor(5.0));
        assertEquals(Severity.HIGH, AnomalyDetector.severityFor(3.01));
        assertEquals(Severity.MEDIUM, AnomalyDetector.severityFor(3.0));
        assertEquals(Severity.MEDIUM, AnomalyDetector.severityFor(2.01));
        assertEquals(Severity.LOW, AnomalyDetector.severityFor(2.0));
        assertEquals(Severity.LOW, AnomalyDetector.severityFor(1.1));
    }

    @Test
    void detectWithoutModelsReturnsNothing() {
        assertTrue(detector.detect(TestSamples.cpu(T0, 99)).isEmpty());
        verifyNoInteractions(publisher);
    }
}
