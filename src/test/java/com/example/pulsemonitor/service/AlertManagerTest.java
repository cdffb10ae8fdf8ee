package com.example.pulsemonitor.service;

import com.example.pulsemonitor.MutableClock;
import com.example.pulsemonitor.config.AppConfig;
import com.example.pulsemonitor.config.MonitorProperties;
import com.example.pulsemonitor.domain.Alert;
import com.example.pulsemonitor.domain.AlertRule;
import com.example.pulsemonitor.domain.AnomalyModel;
import com.example.pulsemonitor.domain.AnomalyResult;
import com.example.pulsemonitor.domain.HealthCheckResult;
import com.example.pulsemonitor.domain.HealthCheckResult.HealthStatus;
import com.example.pulsemonitor.domain.Severity;
import com.example.pulsemonitor.event.AlertLifecycleEvent;
import com.example.pulsemonitor.event.ConfigurationRejectedEvent;
import com.example.pulsemonitor.exception.ConfigurationException;
import com.example.pulsemonitor.exception.UnknownEntityException;
import com.example.pulsemonitor.storage.InMemoryStorageManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AlertManagerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private MonitorProperties properties;
    private EscalationService escalationService;
    private ApplicationEventPublisher publisher;
    private InMemoryStorageManager storage;
    private AlertManager alertManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        properties = new MonitorProperties();
        properties.getStorage().setCleanupEnabled(false);
        escalationService = mock(EscalationService.class);
        publisher = mock(ApplicationEventPublisher.class);
        storage = new InMemoryStorageManager(properties, new AppConfig().objectMapper(), publisher, clock,
                mock(TaskScheduler.class));
        alertManager = new AlertManager(storage, escalationService, properties, publisher,
                new SimpleMeterRegistry(), clock);
    }

    static AlertRule cpuRule(int duration, long cooldownSeconds) {
        return AlertRule.builder()
                .id("high-cpu")
                .name("High CPU usage")
                .source(AlertRule.SignalSource.HEALTH)
                .cooldownSeconds(cooldownSeconds)
                .conditions(List.of(AlertRule.AlertCondition.builder()
                        .metric("cpu").operator(AlertRule.Operator.GT).threshold(90).duration(duration)
                        .build()))
                .escalationPolicy(AlertRule.EscalationPolicy.builder()
                        .levels(List.of(AlertRule.EscalationLevel.builder()
                                .delayMinutes(0).channels(List.of("slack")).severity(Severity.HIGH).build()))
                        .build())
                .build();
    }

    private List<Alert> feedCpu(double... values) {
        List<Alert> fired = new ArrayList<>();
        for (double value : values) {
            HealthStatus status = value >= 95 ? HealthStatus.CRITICAL
                    : value >= 85 ? HealthStatus.UNHEALTHY : HealthStatus.HEALTHY;
            fired.addAll(alertManager.processHealthResults(List.of(
                    new HealthCheckResult("cpu", value, status, "cpu at " + value, clock.instant()))));
            clock.advance(Duration.ofSeconds(1));
        }
        return fired;
    }

    @Test
    void threeConsecutiveBreachesFireOneAlertAndStartEscalation() {
        alertManager.addRule(cpuRule(3, 300));

        List<Alert> fired = feedCpu(91, 92, 93);

        assertEquals(1, fired.size());
        Alert alert = fired.get(0);
        assertEquals("high-cpu", alert.getRuleId());
        assertEquals(Severity.HIGH, alert.getSeverity());
        assertEquals(93.0, alert.getValue());
        assertEquals(Alert.AlertStatus.ACTIVE, alert.getStatus());
        assertEquals(List.of(alert), alertManager.getActiveAlerts());

        AlertRule rule = alertManager.getRule("high-cpu").orElseThrow();
        assertEquals(1, rule.getTriggerCount());
        assertEquals(alert.getTimestamp(), rule.getLastTriggeredAt());
        verify(escalationService).start(eq(alert), eq(rule.getEscalationPolicy()), any());
    }

    @Test
    void mismatchResetsTheConsecutiveCounter() {
        alertManager.addRule(cpuRule(3, 0));

        List<Alert> fired = new ArrayList<>();
        fired.addAll(feedCpu(95, 95, 50));
        assertTrue(fired.isEmpty());

        fired.addAll(feedCpu(95, 95));
        assertTrue(fired.isEmpty());

        fired.addAll(feedCpu(95));
        assertEquals(1, fired.size());
        assertEquals(Severity.CRITICAL, fired.get(0).getSeverity());
    }

    @Test
    void firingResetsCounterSoNextAlertNeedsAFullSequence() {
        alertManager.addRule(cpuRule(2, 0));

        assertEquals(1, feedCpu(95, 95).size());
        assertEquals(0, feedCpu(95).size());
        assertEquals(1, feedCpu(95).size());
    }

    @Test
    void cooldownSuppressesRepeatFiring() {
        alertManager.addRule(cpuRule(1, 300));

        assertEquals(1, feedCpu(95).size());
        assertEquals(0, feedCpu(95).size());

        clock.advance(Duration.ofSeconds(300));
        assertEquals(1, feedCpu(95).size());
        assertEquals(2, alertManager.getRule("high-cpu").orElseThrow().getTriggerCount());
    }

    @Test
    void disabledRulesAndOtherSourcesAreIgnored() {
        alertManager.addRule(cpuRule(1, 0));
        alertManager.setRuleEnabled("high-cpu", false);

        assertTrue(feedCpu(99).isEmpty());

        alertManager.setRuleEnabled("high-cpu", true);
        List<Alert> fromAnomaly = alertManager.processAnomalyResults(List.of(anomaly("cpu", 99, 12.0)));
        assertTrue(fromAnomaly.isEmpty());
        assertThrows(UnknownEntityException.class, () -> alertManager.setRuleEnabled("nope", true));
    }

    @Test
    void wildcardAnomalyRuleMatchesOnScore() {
        alertManager.addRule(AlertRule.builder()
                .id("anomaly-detected")
                .name("Anomaly detected")
                .source(AlertRule.SignalSource.ANOMALY)
                .cooldownSeconds(0)
                .conditions(List.of(AlertRule.AlertCondition.builder()
                        .metric(AlertManager.ANY_METRIC).operator(AlertRule.Operator.GT).threshold(2.0).build()))
                .build());

        assertTrue(alertManager.processAnomalyResults(List.of(anomaly("memory", 70, 1.5))).isEmpty());
        List<Alert> fired = alertManager.processAnomalyResults(List.of(anomaly("memory", 95, 4.2)));

        assertEquals(1, fired.size());
        assertEquals("memory", fired.get(0).getMetric());
        assertEquals(Severity.HIGH, fired.get(0).getSeverity());
        assertTrue(feedCpu(99).isEmpty());
    }

    @Test
    void lifecycleTransitions() {
        alertManager.addRule(cpuRule(1, 0));
        Alert alert = feedCpu(96).get(0);

        Alert acknowledged = alertManager.acknowledge(alert.getId(), "alice");
        assertEquals(Alert.AlertStatus.ACKNOWLEDGED, acknowledged.getStatus());
        assertEquals("alice", acknowledged.getAcknowledgedBy());
        assertThrows(IllegalStateException.class, () -> alertManager.acknowledge(alert.getId(), "bob"));
        assertEquals(1, alertManager.getActiveAlerts().size());

        clock.advance(Duration.ofMinutes(10));
        Alert resolved = alertManager.resolve(alert.getId(), "bob", "scaled out");
        assertEquals(Alert.AlertStatus.RESOLVED, resolved.getStatus());
        assertEquals("scaled out", resolved.getResolutionNote());
        assertThrows(IllegalStateException.class, () -> alertManager.resolve(alert.getId(), "bob", "again"));
        assertTrue(alertManager.getActiveAlerts().isEmpty());

        assertThrows(UnknownEntityException.class, () -> alertManager.acknowledge("missing", "alice"));

        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(publisher, atLeast(3)).publishEvent(events.capture());
        List<AlertLifecycleEvent.Type> types = events.getAllValues().stream()
                .filter(AlertLifecycleEvent.class::isInstance)
                .map(e -> ((AlertLifecycleEvent) e).type())
                .toList();
        assertEquals(List.of(AlertLifecycleEvent.Type.FIRED, AlertLifecycleEvent.Type.ACKNOWLEDGED,
                AlertLifecycleEvent.Type.RESOLVED), types);
    }

    @Test
    void activeAlertCanBeResolvedDirectly() {
        alertManager.addRule(cpuRule(1, 0));
        Alert alert = feedCpu(96).get(0);

        assertEquals(Alert.AlertStatus.RESOLVED, alertManager.resolve(alert.getId(), "ops", null).getStatus());
    }

    @Test
    void escalationLevelOnlyRisesWhileActive() {
        alertManager.addRule(cpuRule(1, 0));
        Alert alert = feedCpu(96).get(0);

        assertEquals(1, alertManager.raiseEscalationLevel(alert.getId(), 1).orElseThrow().getEscalationLevel());
        assertTrue(alertManager.raiseEscalationLevel(alert.getId(), 1).isEmpty());
        assertEquals(3, alertManager.raiseEscalationLevel(alert.getId(), 3).orElseThrow().getEscalationLevel());
        assertTrue(alertManager.raiseEscalationLevel(alert.getId(), 2).isEmpty());
        assertEquals(3, alertManager.getAlert(alert.getId()).orElseThrow().getEscalationLevel());

        alertManager.acknowledge(alert.getId(), "alice");
        assertTrue(alertManager.raiseEscalationLevel(alert.getId(), 4).isEmpty());
    }

    @Test
    void invalidRulesAreRejected() {
        AlertRule noConditions = cpuRule(1, 0).toBuilder().conditions(List.of()).build();
        AlertRule zeroDuration = cpuRule(0, 0);
        AlertRule levelWithoutChannels = cpuRule(1, 0).toBuilder()
                .escalationPolicy(AlertRule.EscalationPolicy.builder()
                        .levels(List.of(AlertRule.EscalationLevel.builder().delayMinutes(5).build()))
                        .build())
                .build();

        assertThrows(ConfigurationException.class, () -> alertManager.addRule(noConditions));
        assertThrows(ConfigurationException.class, () -> alertManager.addRule(zeroDuration));
        assertThrows(ConfigurationException.class, () -> alertManager.addRule(levelWithoutChannels));
        assertTrue(alertManager.getRules().isEmpty());
        verify(publisher, times(3)).publishEvent(any(ConfigurationRejectedEvent.class));
    }

    @Test
    void configuredRulesAreLoadedAndBadOnesSkipped() {
        properties.getAlerting().getRules().add(cpuRule(3, 300));
        properties.getAlerting().getRules().add(AlertRule.builder().id("broken").name("Broken").build());

        alertManager.loadConfiguredRules();

        assertEquals(List.of("high-cpu"), alertManager.getRules().stream().map(AlertRule::getId).toList());
        assertTrue(alertManager.removeRule("high-cpu"));
        assertFalse(alertManager.removeRule("high-cpu"));
    }

    @Test
    void statsSummarizeAlertsAndRules() {
        alertManager.addRule(cpuRule(1, 0));
        Alert first = feedCpu(96).get(0);
        feedCpu(91);
        Alert third = feedCpu(97).get(0);
        alertManager.acknowledge(first.getId(), "alice");
        clock.advance(Duration.ofSeconds(60));
        alertManager.resolve(third.getId(), "bob", "fixed");

        AlertManager.AlertStats stats = alertManager.getAlertStats();

        assertEquals(1, stats.rules());
        assertEquals(1, stats.enabledRules());
        assertEquals(3, stats.total());
        assertEquals(1, stats.active());
        assertEquals(1, stats.acknowledged());
        assertEquals(1, stats.resolved());
        assertEquals(61.0, stats.meanResolutionSeconds(), 1e-9);
        assertEquals(2L, stats.bySeverity().get(Severity.CRITICAL));
        assertEquals(1L, stats.bySeverity().get(Severity.HIGH));
    }

    private AnomalyResult anomaly(String metric, double value, double score) {
        return AnomalyResult.builder()
                .metric(metric)
                .value(value)
                .expectedMin(40)
                .expectedMax(60)
                .score(score)
                .severity(score > 3 ? Severity.HIGH : Severity.MEDIUM)
                .timestamp(clock.instant())
                .modelType(AnomalyModel.ModelType.STATISTICAL)
                .description(metric + " anomaly")
                .build();
    }
}
