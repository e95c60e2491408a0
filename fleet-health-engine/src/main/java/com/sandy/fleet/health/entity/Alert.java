package com.sandy.fleet.health.entity;

import com.sandy.fleet.health.tools.JsonConverters;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Alert raised by the analytics engine (risk, prediction, hour anomaly, ...).
 * Lifecycle is owned by AlertService; do not flip the flags directly.
 */
@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alert_forklift_type", columnList = "forkliftId, type")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 64)
    private String forkliftId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AlertType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private AlertSeverity severity = AlertSeverity.MEDIUM;

    @Column(nullable = false, length = 255)
    private String title;

    /** Human readable message. */
    @Column(length = 1000)
    private String message;

    @Column(length = 4000)
    @Convert(converter = JsonConverters.ContextMap.class)
    private Map<String, Object> contextData;

    /** Threshold used to trigger (numeric). */
    private Double thresholdValue;
    /** Actual value that crossed it. */
    private Double actualValue;

    /** Stable key identifying the logical condition (e.g. high_risk_FL-001). */
    @Column(length = 160)
    private String recurrenceKey;

    /**
     * Equals the dedup key while the alert is unresolved, null once resolved or dismissed.
     * The unique constraint on it allows at most one open alert per key.
     */
    @Column(name = "open_recurrence_key", length = 160, unique = true)
    private String openRecurrenceKey;

    private LocalDateTime createdAt;

    // lifecycle
    @Builder.Default
    private boolean active = true;

    private boolean acknowledged;
    private String acknowledgedBy;
    private LocalDateTime acknowledgedAt;

    private boolean resolved;
    private String resolvedBy;
    private LocalDateTime resolvedAt;
    @Column(length = 500)
    private String resolutionNotes;

    /** Dismissed without action (terminal). */
    private boolean dismissed;
    private LocalDateTime dismissedAt;

    private LocalDateTime snoozeUntil;

    // notification tracking
    private boolean emailSent;
    private LocalDateTime emailSentAt;
    private boolean smsSent;
    private LocalDateTime smsSentAt;
    private boolean webhookSent;
    private LocalDateTime webhookSentAt;

    public boolean isTerminal() {
        return resolved || dismissed;
    }

    public Status getStatus() {
        if (resolved) return Status.RESOLVED;
        if (dismissed) return Status.DISMISSED;
        if (!active) return Status.SNOOZED;
        if (acknowledged) return Status.ACKNOWLEDGED;
        return Status.ACTIVE;
    }

    public enum Status { ACTIVE, ACKNOWLEDGED, SNOOZED, RESOLVED, DISMISSED }
}
