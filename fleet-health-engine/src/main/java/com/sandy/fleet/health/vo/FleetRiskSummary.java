package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FleetRiskSummary {
    private int totalUnits;
    private int criticalRisk;
    private int highRisk;
    private int mediumRisk;
    private int lowRisk;
    private double averageRiskScore;
    private int unitsNeedingReplacement;
}
