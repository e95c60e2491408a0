package com.sandy.fleet.health.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** Audit trail of user actions taken on an alert. */
@Entity
@Table(name = "alert_acknowledgments", indexes = {
        @Index(name = "idx_ack_alert", columnList = "alertId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertAcknowledgment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long alertId;
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Action action;

    @Column(length = 500)
    private String notes;
    private LocalDateTime snoozeUntil;
    private LocalDateTime createdAt;

    public enum Action { ACKNOWLEDGED, RESOLVED, SNOOZED, DISMISSED, REACTIVATED }
}
