package com.example.pulsemonitor.service;

import com.example.pulsemonitor.config.MonitorProperties;
import com.example.pulsemonitor.domain.Alert;
import com.example.pulsemonitor.domain.AlertRule;
import com.example.pulsemonitor.domain.AlertRule.SignalSource;
import com.example.pulsemonitor.domain.AnomalyResult;
import com.example.pulsemonitor.domain.HealthCheckResult;
import com.example.pulsemonitor.domain.Severity;
import com.example.pulsemonitor.event.AlertLifecycleEvent;
import com.example.pulsemonitor.event.ConfigurationRejectedEvent;
import com.example.pulsemonitor.exception.ConfigurationException;
import com.example.pulsemonitor.exception.UnknownEntityException;
import com.example.pulsemonitor.storage.StorageManager;
import com.example.pulsemonitor.storage.TimeRange;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Alert Manager - evaluates rules against health and anomaly signals and
 * owns the alert lifecycle (active, acknowledged, resolved).
 *
 * Each rule condition keeps a consecutive-match counter per metric; the rule
 * fires once the counter reaches the condition's duration and the rule is
 * outside its cooldown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertManager {

    /** Condition metric that matches any anomaly metric. */
    public static final String ANY_METRIC = "*";

    private final StorageManager storageManager;
    private final EscalationService escalationService;
    private final MonitorProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();
    private final Map<String, Integer> matchCounters = new ConcurrentHashMap<>();
    private final Object evaluationLock = new Object();
    private final Object alertLock = new Object();

    public record AlertStats(int rules, int enabledRules, long active, long acknowledged, long resolved,
                             long total, double meanResolutionSeconds, Map<Severity, Long> bySeverity) {
    }

    /** One incoming signal, normalized from a health or anomaly result. */
    private record Signal(SignalSource source, String metric, double value, Severity severity, String detail) {
    }

    @PostConstruct
    public void loadConfiguredRules() {
        if (!properties.getAlerting().isEnabled()) {
            log.info("Alerting disabled, no rules loaded");
            return;
        }
        for (AlertRule rule : properties.getAlerting().getRules()) {
            try {
                addRule(rule);
            } catch (ConfigurationException e) {
                log.error("Alert rule {} rejected: {}", rule.getId(), e.getMessage());
            }
        }
        log.info("Loaded {} alert rules", rules.size());
    }

    // --- rule registry ---

    /**
     * @throws ConfigurationException if the rule is malformed
     */
    public void addRule(AlertRule rule) {
        try {
            validate(rule);
        } catch (ConfigurationException e) {
            eventPublisher.publishEvent(new ConfigurationRejectedEvent("rule",
                    rule == null ? null : rule.getId(), e.getMessage()));
            throw e;
        }
        rules.put(rule.getId(), rule.toBuilder().build());
        log.info("Registered alert rule {} ({})", rule.getId(), rule.getName());
    }

    public boolean removeRule(String ruleId) {
        synchronized (evaluationLock) {
            matchCounters.keySet().removeIf(key -> key.startsWith(ruleId + "|"));
            return rules.remove(ruleId) != null;
        }
    }

    public Optional<AlertRule> getRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId)).map(r -> r.toBuilder().build());
    }

    public List<AlertRule> getRules() {
        return rules.values().stream()
                .map(r -> r.toBuilder().build())
                .sorted(Comparator.comparing(AlertRule::getId))
                .toList();
    }

    public void setRuleEnabled(String ruleId, boolean enabled) {
        synchronized (evaluationLock) {
            AlertRule rule = rules.get(ruleId);
            if (rule == null) throw new UnknownEntityException("rule", ruleId);
            rule.setEnabled(enabled);
            if (!enabled) {
                matchCounters.keySet().removeIf(key -> key.startsWith(ruleId + "|"));
            }
        }
        log.info("Alert rule {} {}", ruleId, enabled ? "enabled" : "disabled");
    }

    // --- evaluation ---

    public List<Alert> processHealthResults(List<HealthCheckResult> results) {
        return process(results.stream()
                .map(r -> new Signal(SignalSource.HEALTH, r.metric(), r.value(), r.severity(), r.message()))
                .toList());
    }

    /**
     * Anomaly signals are matched on the anomaly score, so thresholds in
     * anomaly rules are expressed in multiples of the detection sensitivity.
     */
    public List<Alert> processAnomalyResults(List<AnomalyResult> anomalies) {
        return process(anomalies.stream()
                .map(a -> new Signal(SignalSource.ANOMALY, a.getMetric(), a.getScore(), a.getSeverity(),
                        a.getDescription()))
                .toList());
    }

    private List<Alert> process(List<Signal> signals) {
        if (!properties.getAlerting().isEnabled() || signals.isEmpty()) return List.of();

        List<Alert> fired = new ArrayList<>();
        synchronized (evaluationLock) {
            for (Signal signal : signals) {
                for (AlertRule rule : rules.values()) {
                    if (!rule.isEnabled() || !rule.getSource().accepts(signal.source())) continue;
                    for (AlertRule.AlertCondition condition : rule.getConditions()) {
                        if (!appliesTo(condition, signal)) continue;
                        evaluate(rule, condition, signal).ifPresent(fired::add);
                    }
                }
            }
        }
        fired.forEach(this::startEscalation);
        return fired;
    }

    private Optional<Alert> evaluate(AlertRule rule, AlertRule.AlertCondition condition, Signal signal) {
        String key = rule.getId() + "|" + signal.metric();
        if (!condition.matches(signal.value())) {
            matchCounters.remove(key);
            return Optional.empty();
        }

        int count = matchCounters.merge(key, 1, Integer::sum);
        if (count < condition.getDuration()) return Optional.empty();
        matchCounters.remove(key);

        Instant now = clock.instant();
        if (inCooldown(rule, now)) {
            log.debug("Rule {} matched for {} but is in cooldown", rule.getId(), signal.metric());
            return Optional.empty();
        }
        return Optional.of(fire(rule, condition, signal, now));
    }

    private boolean inCooldown(AlertRule rule, Instant now) {
        Instant last = rule.getLastTriggeredAt();
        return last != null && now.isBefore(last.plus(Duration.ofSeconds(rule.getCooldownSeconds())));
    }

    private Alert fire(AlertRule rule, AlertRule.AlertCondition condition, Signal signal, Instant now) {
        Alert alert = Alert.builder()
                .id(UUID.randomUUID().toString())
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .severity(signal.severity())
                .message(String.format("%s: %s %s %.2f (value %.2f, %d consecutive) - %s",
                        rule.getName(), signal.metric(), condition.getOperator().name().toLowerCase(),
                        condition.getThreshold(), signal.value(), condition.getDuration(), signal.detail()))
                .metric(signal.metric())
                .value(signal.value())
                .threshold(condition.getThreshold())
                .timestamp(now)
                .build();

        storageManager.storeAlert(alert).join();
        rule.setLastTriggeredAt(now);
        rule.setTriggerCount(rule.getTriggerCount() + 1);

        Counter.builder("pulse.alerts.fired")
                .tag("rule", rule.getId())
                .tag("severity", alert.getSeverity().name())
                .register(meterRegistry)
                .increment();
        log.warn("Alert fired [{}] {}", alert.getSeverity(), alert.getMessage());
        eventPublisher.publishEvent(new AlertLifecycleEvent(AlertLifecycleEvent.Type.FIRED, alert.copy()));
        return alert.copy();
    }

    private void startEscalation(Alert alert) {
        AlertRule rule = rules.get(alert.getRuleId());
        if (rule == null) return;
        escalationService.start(alert, rule.getEscalationPolicy(), this::raiseEscalationLevel);
    }

    private static boolean appliesTo(AlertRule.AlertCondition condition, Signal signal) {
        String metric = condition.getMetric();
        if (metric == null) return false;
        if (ANY_METRIC.equals(metric)) return signal.source() == SignalSource.ANOMALY;
        return metric.equals(signal.metric());
    }

    // --- lifecycle ---

    public Alert acknowledge(String alertId, String who) {
        synchronized (alertLock) {
            Alert alert = load(alertId);
            if (alert.getStatus() != Alert.AlertStatus.ACTIVE) {
                throw new IllegalStateException("Alert " + alertId + " is " + alert.getStatus() + ", cannot acknowledge");
            }
            alert.setStatus(Alert.AlertStatus.ACKNOWLEDGED);
            alert.setAcknowledgedBy(who);
            alert.setAcknowledgedAt(clock.instant());
            storageManager.updateAlert(alert).join();
            log.info("Alert {} acknowledged by {}", alertId, who);
            eventPublisher.publishEvent(new AlertLifecycleEvent(AlertLifecycleEvent.Type.ACKNOWLEDGED, alert.copy()));
            return alert.copy();
        }
    }

    public Alert resolve(String alertId, String who, String note) {
        synchronized (alertLock) {
            Alert alert = load(alertId);
            if (alert.getStatus() == Alert.AlertStatus.RESOLVED) {
                throw new IllegalStateException("Alert " + alertId + " is already resolved");
            }
            alert.setStatus(Alert.AlertStatus.RESOLVED);
            alert.setResolvedBy(who);
            alert.setResolvedAt(clock.instant());
            alert.setResolutionNote(note);
            storageManager.updateAlert(alert).join();
            log.info("Alert {} resolved by {}", alertId, who);
            eventPublisher.publishEvent(new AlertLifecycleEvent(AlertLifecycleEvent.Type.RESOLVED, alert.copy()));
            return alert.copy();
        }
    }

    /**
     * Raise the escalation level of a still-active alert. Returns empty, and
     * changes nothing, when the alert is gone, no longer active, or already
     * at or above the requested level.
     */
    Optional<Alert> raiseEscalationLevel(String alertId, int level) {
        synchronized (alertLock) {
            Optional<Alert> stored = storageManager.getAlert(alertId).join();
            if (stored.isEmpty() || !stored.get().isActive()) return Optional.empty();
            Alert alert = stored.get();
            if (level <= alert.getEscalationLevel()) return Optional.empty();
            alert.setEscalationLevel(level);
            storageManager.updateAlert(alert).join();
            return Optional.of(alert.copy());
        }
    }

    private Alert load(String alertId) {
        return storageManager.getAlert(alertId).join()
                .orElseThrow(() -> new UnknownEntityException("alert", alertId));
    }

    // --- queries ---

    public List<Alert> getActiveAlerts() {
        return storageManager.getActiveAlerts().join();
    }

    public Optional<Alert> getAlert(String alertId) {
        return storageManager.getAlert(alertId).join();
    }

    public AlertStats getAlertStats() {
        List<Alert> all = storageManager.getAlerts(new TimeRange(Instant.EPOCH, clock.instant())).join();
        long active = all.stream().filter(a -> a.getStatus() == Alert.AlertStatus.ACTIVE).count();
        long acknowledged = all.stream().filter(a -> a.getStatus() == Alert.AlertStatus.ACKNOWLEDGED).count();
        List<Alert> resolved = all.stream().filter(a -> a.getStatus() == Alert.AlertStatus.RESOLVED).toList();
        double meanResolution = resolved.stream()
                .filter(a -> a.getResolvedAt() != null && a.getTimestamp() != null)
                .mapToLong(a -> Duration.between(a.getTimestamp(), a.getResolvedAt()).toSeconds())
                .average()
                .orElse(0.0);

        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) bySeverity.put(severity, 0L);
        all.forEach(a -> bySeverity.merge(a.getSeverity(), 1L, Long::sum));

        int enabled = (int) rules.values().stream().filter(AlertRule::isEnabled).count();
        return new AlertStats(rules.size(), enabled, active, acknowledged, resolved.size(), all.size(),
                meanResolution, bySeverity);
    }

    private static void validate(AlertRule rule) {
        if (rule == null) throw new ConfigurationException("Rule is required");
        if (isBlank(rule.getId())) throw new ConfigurationException("Rule id is required");
        if (isBlank(rule.getName())) throw new ConfigurationException("Rule " + rule.getId() + " has no name");
        if (rule.getConditions() == null || rule.getConditions().isEmpty()) {
            throw new ConfigurationException("Rule " + rule.getId() + " has no conditions");
        }
        if (rule.getCooldownSeconds() < 0) {
            throw new ConfigurationException("Rule " + rule.getId() + " has a negative cooldown");
        }
        if (rule.getSource() == null) {
            throw new ConfigurationException("Rule " + rule.getId() + " has no signal source");
        }
        for (AlertRule.AlertCondition condition : rule.getConditions()) {
            if (condition == null || isBlank(condition.getMetric()) || condition.getOperator() == null) {
                throw new ConfigurationException("Rule " + rule.getId() + " has a condition without metric or operator");
            }
            if (condition.getDuration() < 1) {
                throw new ConfigurationException("Rule " + rule.getId() + " condition on "
                        + condition.getMetric() + " needs a duration of at least 1");
            }
        }
        AlertRule.EscalationPolicy policy = rule.getEscalationPolicy();
        if (policy != null && policy.getLevels() != null) {
            long previousDelay = -1;
            for (AlertRule.EscalationLevel level : policy.getLevels()) {
                if (level == null || level.getChannels() == null || level.getChannels().isEmpty()) {
                    throw new ConfigurationException("Rule " + rule.getId() + " has an escalation level without channels");
                }
                if (level.getDelayMinutes() < 0 || level.getDelayMinutes() < previousDelay) {
                    throw new ConfigurationException("Rule " + rule.getId()
                            + " escalation delays must be non-negative and ascending");
                }
                previousDelay = level.getDelayMinutes();
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
