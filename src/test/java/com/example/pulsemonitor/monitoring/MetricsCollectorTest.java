package com.example.pulsemonitor.monitoring;

import com.example.pulsemonitor.MutableClock;
import com.example.pulsemonitor.config.MonitorProperties;
import com.example.pulsemonitor.domain.SystemMetrics;
import com.example.pulsemonitor.event.MetricsCollectedEvent;
import com.example.pulsemonitor.event.MetricsCollectionFailedEvent;
import com.example.pulsemonitor.exception.CollectionException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MetricsCollectorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private SystemProbe probe;
    private ApplicationEventPublisher publisher;
    private TaskScheduler scheduler;
    private SimpleMeterRegistry meterRegistry;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        probe = mock(SystemProbe.class);
        publisher = mock(ApplicationEventPublisher.class);
        scheduler = mock(TaskScheduler.class);
        meterRegistry = new SimpleMeterRegistry();
        collector = new MetricsCollector(probe, new MonitorProperties(), publisher, meterRegistry,
                new MutableClock(NOW), scheduler, Runnable::run);

        when(probe.readCpu()).thenReturn(SystemMetrics.Cpu.builder().usage(42.0).cores(8).build());
        when(probe.readMemory()).thenReturn(SystemMetrics.Memory.builder().total(1000).used(250).free(750).build());
        when(probe.readDisk()).thenReturn(SystemMetrics.Disk.builder().total(200).used(50).free(150).path("/").build());
        when(probe.readNetwork()).thenReturn(SystemMetrics.Network.builder().latency(12.5).build());
    }

    @Test
    void sampleOnceCombinesProbesAndCustomMetrics() {
        collector.registerCustomMetric("queue_depth", () -> 17.0);

        SystemMetrics metrics = collector.sampleOnce();

        assertEquals(NOW, metrics.getTimestamp());
        assertEquals(42.0, metrics.metricValue("cpu"));
        assertEquals(25.0, metrics.metricValue("memory"), 1e-9);
        assertEquals(25.0, metrics.metricValue("disk"), 1e-9);
        assertEquals(12.5, metrics.metricValue("network"));
        assertEquals(17.0, metrics.metricValue("custom_queue_depth"));
    }

    @Test
    void failingCustomMetricYieldsZeroWithoutAffectingOthers() {
        collector.registerCustomMetric("broken", () -> {
            throw new IllegalStateException("source down");
        });
        collector.registerCustomMetric("healthy", () -> 3.0);

        SystemMetrics metrics = collector.sampleOnce();

        assertEquals(0.0, metrics.getCustom().get("broken"));
        assertEquals(3.0, metrics.getCustom().get("healthy"));
        assertEquals(42.0, metrics.metricValue("cpu"));
    }

    @Test
    void probeFailureSurfacesAsCollectionException() {
        when(probe.readMemory()).thenThrow(new IllegalStateException("no counters"));

        CollectionException error = assertThrows(CollectionException.class, () -> collector.sampleOnce());

        assertTrue(error.getMessage().contains("memory"));
    }

    @Test
    void tickPublishesFailureAndKeepsLoopAlive() {
        when(probe.readDisk()).thenThrow(new IllegalStateException("disk gone"));

        assertTrue(collector.tick());

        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publishEvent(events.capture());
        assertInstanceOf(MetricsCollectionFailedEvent.class, events.getValue());

        reset(probe);
        when(probe.readCpu()).thenReturn(SystemMetrics.Cpu.builder().usage(1.0).build());
        when(probe.readMemory()).thenReturn(SystemMetrics.Memory.builder().total(1).build());
        when(probe.readDisk()).thenReturn(SystemMetrics.Disk.builder().total(1).build());
        when(probe.readNetwork()).thenReturn(SystemMetrics.Network.builder().build());

        assertTrue(collector.tick());
        verify(publisher).publishEvent(any(MetricsCollectedEvent.class));
    }

    @Test
    void overlappingTickIsSkipped() throws Exception {
        CountDownLatch inProbe = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(probe.readCpu()).thenAnswer(invocation -> {
            inProbe.countDown();
            release.await(5, TimeUnit.SECONDS);
            return SystemMetrics.Cpu.builder().usage(10.0).build();
        });

        AtomicBoolean firstRan = new AtomicBoolean();
        Thread first = new Thread(() -> firstRan.set(collector.tick()));
        first.start();
        assertTrue(inProbe.await(5, TimeUnit.SECONDS));

        assertFalse(collector.tick());

        release.countDown();
        first.join(5000);
        assertTrue(firstRan.get());
        assertEquals(1.0, meterRegistry.counter("pulse.collector.ticks.skipped").count());
        verify(publisher, times(1)).publishEvent(any(MetricsCollectedEvent.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    void startIsSingleAndStopIsIdempotent() {
        ScheduledFuture<Object> task = mock(ScheduledFuture.class);
        doReturn(task).when(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(5)));

        collector.startPeriodic(Duration.ofSeconds(5));
        collector.startPeriodic(Duration.ofSeconds(5));
        assertTrue(collector.isRunning());

        collector.stop();
        collector.stop();

        assertFalse(collector.isRunning());
        verify(scheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(5)));
        verify(task, times(1)).cancel(false);
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> collector.startPeriodic(Duration.ZERO));
        verifyNoInteractions(scheduler);
    }

    @Test
    void customMetricRegistry() {
        collector.registerCustomMetric("b", () -> 1);
        collector.registerCustomMetric("a", () -> 2);

        assertEquals(List.of("a", "b"), List.copyOf(collector.getCustomMetricNames()));
        assertTrue(collector.unregisterCustomMetric("a"));
        assertFalse(collector.unregisterCustomMetric("a"));
        assertThrows(IllegalArgumentException.class, () -> collector.registerCustomMetric(" ", () -> 0));
    }
}
