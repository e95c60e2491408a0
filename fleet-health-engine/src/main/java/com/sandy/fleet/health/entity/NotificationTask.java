package com.sandy.fleet.health.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Outbound delivery queued for an alert. Dispatched asynchronously with bounded retries,
 * so delivery problems never reach the code path that persisted the alert.
 */
@Entity
@Table(name = "notification_tasks", indexes = {
        @Index(name = "idx_task_status_next", columnList = "status, nextAttemptAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationTask {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long alertId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Channel channel;

    /** Only for {@link Channel#WEBHOOK}. */
    private Long webhookId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private Status status = Status.PENDING;

    private int attempts;
    private LocalDateTime nextAttemptAt;
    @Column(length = 500)
    private String lastError;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;

    public enum Channel { EMAIL, SMS, WEBHOOK }

    public enum Status { PENDING, SENT, FAILED }
}
