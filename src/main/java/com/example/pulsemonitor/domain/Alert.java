package com.example.pulsemonitor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An alert raised when a rule fires. Mutated only through acknowledge,
 * resolve and escalation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    private String id;

    private String ruleId;

    private String ruleName;

    private Severity severity;

    private String message;

    private String metric;

    private double value;

    private double threshold;

    private Instant timestamp;

    @Builder.Default
    private AlertStatus status = AlertStatus.ACTIVE;

    @Builder.Default
    private int escalationLevel = 0;

    private String acknowledgedBy;

    private Instant acknowledgedAt;

    private String resolvedBy;

    private Instant resolvedAt;

    private String resolutionNote;

    public enum AlertStatus {
        ACTIVE, ACKNOWLEDGED, RESOLVED
    }

    public boolean isActive() {
        return status == AlertStatus.ACTIVE;
    }

    public Alert copy() {
        return toBuilder().build();
    }
}
