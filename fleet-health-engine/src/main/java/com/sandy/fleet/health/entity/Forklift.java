package com.sandy.fleet.health.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Equipment snapshot consumed by the analytics engine.
 * The risk* / recommendedAction columns are a cache of the latest {@link RiskAssessment};
 * they are only written through ForkliftRiskProjection.
 */
@Entity
@Table(name = "forklifts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Forklift {
    @Id
    @Column(length = 64)
    private String id;
    private String model;
    private String manufacturer;
    /** Model year, used for age when no purchase date is known. */
    @Column(name = "model_year")
    private Integer year;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    @Builder.Default
    private FuelType fuelType = FuelType.ELECTRIC;

    @Enumerated(EnumType.STRING)
    @Column(length = 24)
    @Builder.Default
    private Status status = Status.ACTIVE;

    private String locationName;

    // hour meter
    @Builder.Default
    private Double currentHours = 0d;
    private Double lastHourReading;
    private LocalDateTime lastHourReadingDate;

    // service
    private LocalDate nextServiceDate;
    private Double nextServiceHours;
    @Builder.Default
    private Integer serviceIntervalHours = 250;
    @Builder.Default
    private Integer serviceIntervalDays = 90;

    // financial
    private LocalDate purchaseDate;
    private Double purchasePrice;
    @Builder.Default
    private Double depreciationRate = 0.15;
    @Builder.Default
    private Integer expectedLifespanYears = 10;

    // derived risk cache
    @Builder.Default
    private Integer riskScore = 1;
    @Column(length = 16)
    @Builder.Default
    private String riskLevel = "low";
    @Column(length = 4000)
    private String riskFactors;
    private LocalDateTime lastRiskAssessment;
    @Column(length = 32)
    private String recommendedAction;

    public boolean isElectric() {
        return fuelType == FuelType.ELECTRIC;
    }

    public enum FuelType { ELECTRIC, PROPANE, DIESEL, GAS }

    public enum Status { ACTIVE, MAINTENANCE, OUT_OF_SERVICE, RETIRED, PENDING_DISPOSAL }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Forklift forklift = (Forklift) o;
        return Objects.equals(id, forklift.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }
}
