package com.sandy.fleet.health.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Entity
@Table(name = "maintenance_records", indexes = {
        @Index(name = "idx_maintenance_forklift_date", columnList = "forkliftId, serviceDate")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String forkliftId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Type type;

    /** engine, transmission, hydraulic, electrical, tires, brakes, mast, battery, fuel_system, ... */
    @Column(length = 32)
    private String category;

    @Column(length = 1000)
    private String description;
    @Column(length = 2000)
    private String workPerformed;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    @Builder.Default
    private Status status = Status.COMPLETED;

    private LocalDate serviceDate;
    private Double hoursAtService;

    @Builder.Default
    private Double laborCost = 0d;
    @Builder.Default
    private Double partsCost = 0d;
    @Builder.Default
    private Double totalCost = 0d;

    public boolean isRepair() {
        return type == Type.REPAIR || type == Type.EMERGENCY;
    }

    public enum Type { PREVENTIVE, REPAIR, EMERGENCY, INSPECTION, WARRANTY, RECALL }

    public enum Status { SCHEDULED, IN_PROGRESS, COMPLETED, CANCELLED, DEFERRED }
}
