package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Rounded currency amounts and months. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialProjection {
    private long currentValue;
    private long projectedAnnualMaintenance;
    private long projectedDowntimeCost;
    private long projectedRepairCost;
    private long replacementCost;
    private long remainingLifeMonths;
    private long savingsIfReplaced;
    private long roiIfReplaced;
}
