package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Sub-scores and overall score, each within [1, 10]. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskScores {
    private int age;
    private int hours;
    private int maintenanceCost;
    private int repairFrequency;
    private int downtime;
    private int overall;
}
