package com.example.pulsemonitor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Defines alerting rules over metric thresholds, with hysteresis, cooldown
 * and an escalation policy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {

    private String id;

    private String name;

    private String description;

    @Builder.Default
    private List<AlertCondition> conditions = new ArrayList<>();

    @Builder.Default
    private EscalationPolicy escalationPolicy = new EscalationPolicy();

    /** Which signal kind feeds this rule. */
    @Builder.Default
    private SignalSource source = SignalSource.ANY;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private long cooldownSeconds = 300;

    private Instant lastTriggeredAt;

    @Builder.Default
    private int triggerCount = 0;

    public enum SignalSource {
        HEALTH, ANOMALY, ANY;

        public boolean accepts(SignalSource incoming) {
            return this == ANY || this == incoming;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AlertCondition {

        private String metric;

        private Operator operator;

        private double threshold;

        /** Consecutive matching evaluations required before the rule fires. */
        @Builder.Default
        private int duration = 1;

        public boolean matches(double value) {
            return operator.test(value, threshold);
        }
    }

    public enum Operator {
        GT, GTE, LT, LTE, EQ;

        public boolean test(double value, double threshold) {
            return switch (this) {
                case GT -> value > threshold;
                case GTE -> value >= threshold;
                case LT -> value < threshold;
                case LTE -> value <= threshold;
                case EQ -> value == threshold;
            };
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EscalationPolicy {

        @Builder.Default
        private List<EscalationLevel> levels = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EscalationLevel {

        private long delayMinutes;

        @Builder.Default
        private List<String> channels = new ArrayList<>();

        private Severity severity;
    }
}
