package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentHealth {
    private String componentKey;
    private String component;
    private String category;
    private double expectedLifeHours;
    private double hoursSinceService;
    private long remainingHours;
    /** Always within [0, 100]. */
    private double lifeUsedPercent;
    private Status status;
    private Urgency urgency;
    private LocalDate lastServiceDate;

    public enum Status { GOOD, MONITOR, DUE_SOON, OVERDUE }
}
