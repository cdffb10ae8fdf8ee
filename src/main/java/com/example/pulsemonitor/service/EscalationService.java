package com.example.pulsemonitor.service;

import com.example.pulsemonitor.domain.Alert;
import com.example.pulsemonitor.domain.AlertRule;
import com.example.pulsemonitor.event.AlertEscalatedEvent;
import com.example.pulsemonitor.notification.NotificationOutcome;
import com.example.pulsemonitor.notification.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Escalation Engine - walks a fired alert through its policy's levels.
 *
 * Every level is a one-shot task at fire time plus the level's delay, and is
 * notified with the level's severity when it sets one. Pending tasks are
 * never cancelled: each one asks the {@link EscalationTarget} to raise the
 * level, and a target that is no longer active turns the task into a no-op.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationService {

    /**
     * Owner of the alert state. Raises the level only when the alert is still
     * active and the new level is higher than the current one.
     */
    @FunctionalInterface
    public interface EscalationTarget {
        Optional<Alert> raiseLevel(String alertId, int level);
    }

    private final NotificationService notificationService;
    private final ApplicationEventPublisher eventPublisher;
    @Qualifier("escalationScheduler")
    private final TaskScheduler escalationScheduler;

    public void start(Alert alert, AlertRule.EscalationPolicy policy, EscalationTarget target) {
        if (policy == null || policy.getLevels() == null || policy.getLevels().isEmpty()) {
            log.debug("Alert {} has no escalation levels", alert.getId());
            return;
        }
        Instant firedAt = alert.getTimestamp();
        List<AlertRule.EscalationLevel> levels = policy.getLevels();
        for (int i = 0; i < levels.size(); i++) {
            int level = i + 1;
            AlertRule.EscalationLevel config = levels.get(i);
            Instant runAt = firedAt.plus(Duration.ofMinutes(config.getDelayMinutes()));
            escalationScheduler.schedule(() -> escalate(alert.getId(), level, config, target), runAt);
        }
        log.info("Escalation scheduled for alert {} ({} levels)", alert.getId(), levels.size());
    }

    void escalate(String alertId, int level, AlertRule.EscalationLevel config, EscalationTarget target) {
        try {
            Optional<Alert> raised = target.raiseLevel(alertId, level);
            if (raised.isEmpty()) {
                log.debug("Escalation level {} for alert {} skipped", level, alertId);
                return;
            }
            Alert alert = withLevelSeverity(raised.get(), config);
            log.warn("Escalating alert {} to level {} via {}", alertId, level, config.getChannels());
            List<NotificationOutcome> outcomes = notificationService.send(alert, level, config.getChannels());
            long failed = outcomes.stream().filter(o -> !o.success()).count();
            if (failed > 0) {
                log.warn("Escalation level {} for alert {}: {} of {} channels failed",
                        level, alertId, failed, outcomes.size());
            }
            eventPublisher.publishEvent(new AlertEscalatedEvent(alert, level, List.copyOf(config.getChannels())));
        } catch (RuntimeException e) {
            log.error("Escalation level {} for alert {} failed: {}", level, alertId, e.getMessage(), e);
        }
    }

    private static Alert withLevelSeverity(Alert alert, AlertRule.EscalationLevel config) {
        if (config.getSeverity() == null || config.getSeverity() == alert.getSeverity()) return alert;
        return alert.toBuilder().severity(config.getSeverity()).build();
    }
}
