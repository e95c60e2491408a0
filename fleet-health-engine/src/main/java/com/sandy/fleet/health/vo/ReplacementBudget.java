package com.sandy.fleet.health.vo;

import com.sandy.fleet.health.entity.RiskAssessment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplacementBudget {
    private int fiscalYear;
    /** Highest risk score first. */
    private List<Item> recommendations;
    private int totalUnitsRecommended;
    private long totalBudgetNeeded;
    private double projectedAnnualSavings;
    /** Null when the fleet shows no savings. */
    private Long fleetPaybackMonths;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        private String forkliftId;
        private String model;
        private String location;
        private int riskScore;
        private double currentHours;
        private long projectedAnnualMaintenanceCost;
        private long replacementCost;
        private long tradeInValue;
        private long netCost;
        /** Savings over the three year comparison divided by three. */
        private double annualSavings;
        private Long paybackMonths;
        private RiskAssessment.Urgency urgency;
    }
}
