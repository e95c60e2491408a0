package com.sandy.fleet.health.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A single hour meter reading. Immutable once recorded, except for the
 * correction / validation columns which a reviewer sets at most once.
 */
@Entity
@Table(name = "hour_meter_readings", indexes = {
        @Index(name = "idx_reading_forklift_time", columnList = "forkliftId, recordedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HourMeterReading {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String forkliftId;

    @Column(nullable = false)
    private Double reading;
    private Double previousReading;
    private Double readingDelta;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    @Builder.Default
    private Source source = Source.MANUAL;
    private String recordedBy;
    private LocalDateTime recordedAt;

    // anomaly flag
    private boolean flagged;
    @Column(length = 255)
    private String flagReason;
    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private FlagSeverity flagSeverity;

    // correction
    private boolean corrected;
    private Double correctedValue;
    private String correctedBy;
    private LocalDateTime correctedAt;
    @Column(length = 500)
    private String correctionNotes;

    // validation
    private boolean validated;
    private String validatedBy;
    private LocalDateTime validatedAt;

    public enum Source { MANUAL, API, IOT, IMPORT }

    public enum FlagSeverity { WARNING, ERROR }
}
