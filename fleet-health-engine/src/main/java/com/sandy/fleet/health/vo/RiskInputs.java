package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything the risk calculator needs about one unit, already aggregated
 * over the trailing 12 months and with defaults applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskInputs {
    private double ageYears;
    private double currentHours;
    private double purchasePrice;
    private double depreciationRate;
    private double expectedLifespanYears;

    private double maintenanceCost12Months;
    private int repairCount12Months;
    private int emergencyCount12Months;

    private double downtimeHours12Months;
    private double downtimeCost12Months;

    private boolean maintenanceOverdue;
}
