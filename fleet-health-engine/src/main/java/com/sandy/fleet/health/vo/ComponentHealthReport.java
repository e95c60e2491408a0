package com.sandy.fleet.health.vo;

import com.sandy.fleet.health.entity.Forklift;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentHealthReport {
    private String forkliftId;
    private double currentHours;
    private Forklift.FuelType fuelType;
    /** Sorted by urgency, then life used descending. */
    private List<ComponentHealth> components;
    private int criticalCount;
    private int warningCount;
}
