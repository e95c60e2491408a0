package com.sandy.fleet.health.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

@Entity
@Table(name = "downtime_events", indexes = {
        @Index(name = "idx_downtime_forklift_start", columnList = "forkliftId, startTime")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DowntimeEvent {
    public static final double DEFAULT_COST_PER_HOUR = 150d;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String forkliftId;

    @Column(nullable = false)
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Double durationHours;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    @Builder.Default
    private Type type = Type.UNPLANNED;

    @Column(length = 32)
    private String rootCause;

    @Builder.Default
    private Double costPerHourDown = DEFAULT_COST_PER_HOUR;

    /**
     * Recorded duration, or start/end span when the duration was never filled in.
     * Open events without a duration count as zero.
     */
    public double effectiveDurationHours() {
        if (durationHours != null) return Math.max(0d, durationHours);
        if (startTime != null && endTime != null && endTime.isAfter(startTime)) {
            return Duration.between(startTime, endTime).toMinutes() / 60d;
        }
        return 0d;
    }

    public double effectiveCostPerHour() {
        return costPerHourDown == null ? DEFAULT_COST_PER_HOUR : costPerHourDown;
    }

    public enum Type { UNPLANNED, PLANNED, EMERGENCY }
}
