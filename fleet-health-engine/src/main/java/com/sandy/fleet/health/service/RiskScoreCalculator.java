package com.sandy.fleet.health.service;

import com.sandy.fleet.health.config.RiskScoringPolicy;
import com.sandy.fleet.health.entity.RiskAssessment;
import com.sandy.fleet.health.vo.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pure scoring: turns aggregated {@link RiskInputs} into scores, factors,
 * recommendations and a financial projection. No repository access.
 */
@Component
@RequiredArgsConstructor
public class RiskScoreCalculator {

    static final double MAINTENANCE_TREND_PER_YEAR = 0.05;
    static final double REPLACEMENT_PRICE_FACTOR = 1.2;
    static final double NEW_UNIT_ANNUAL_COST_RATE = 0.03;
    static final double REPAIR_SHARE_OF_MAINTENANCE = 0.6;
    static final double MAX_COMPARISON_YEARS = 3;

    private final RiskScoringPolicy policy;

    public RiskEvaluation evaluate(RiskInputs in) {
        RiskScores scores = score(in);
        List<RiskFactor> factors = identifyRiskFactors(scores, in);
        FinancialProjection financials = project(in);
        RiskEvaluation.RiskEvaluationBuilder b = RiskEvaluation.builder()
                .scores(scores)
                .riskFactors(factors)
                .recommendations(recommend(scores.getOverall(), factors))
                .financials(financials);
        decide(scores.getOverall(), financials, b);
        return b.build();
    }

    public RiskScores score(RiskInputs in) {
        double costPercent = in.getMaintenanceCost12Months() / positivePrice(in.getPurchasePrice()) * 100;
        int age = bandScore(in.getAgeYears(), policy.getAge());
        int hours = bandScore(in.getCurrentHours(), policy.getHours());
        int cost = bandScore(costPercent, policy.getMaintenanceCostPercent());
        int repairs = bandScore(in.getRepairCount12Months(), policy.getRepairsPerYear());
        int downtime = bandScore(in.getDowntimeHours12Months(), policy.getDowntimeHoursPerYear());

        RiskScoringPolicy.Weights w = policy.getWeights();
        double weighted = age * w.getAge()
                + hours * w.getHours()
                + cost * w.getMaintenanceCost()
                + repairs * w.getRepairFrequency()
                + downtime * w.getDowntime();
        int overall = (int) Math.max(1, Math.min(10, Math.round(weighted)));
        return RiskScores.builder()
                .age(age).hours(hours).maintenanceCost(cost)
                .repairFrequency(repairs).downtime(downtime)
                .overall(overall)
                .build();
    }

    /**
     * Piecewise-linear mapping onto 1..10: [low, medium] to 1-4, [medium, high] to 4-7,
     * [high, critical] to 7-9, beyond critical 10. Non-finite input scores 1.
     */
    public int bandScore(double value, RiskScoringPolicy.Band band) {
        if (Double.isNaN(value) || value <= band.getLow()) return 1;
        if (value <= band.getMedium()) return ceil(1 + fraction(value, band.getLow(), band.getMedium()) * 3);
        if (value <= band.getHigh()) return ceil(4 + fraction(value, band.getMedium(), band.getHigh()) * 3);
        if (value <= band.getCritical()) return ceil(7 + fraction(value, band.getHigh(), band.getCritical()) * 2);
        return 10;
    }

    private static double fraction(double value, double from, double to) {
        double width = to - from;
        if (width <= 0) return 1d; // zero-width band: value sits on its upper edge
        return (value - from) / width;
    }

    private static int ceil(double v) {
        return (int) Math.ceil(v);
    }

    public List<RiskFactor> identifyRiskFactors(RiskScores s, RiskInputs in) {
        List<RiskFactor> factors = new ArrayList<>();
        if (s.getAge() >= 7) {
            factors.add(factor("age", s.getAge(), fmt("Equipment age is %.1f years", in.getAgeYears())));
        }
        if (s.getHours() >= 7) {
            factors.add(factor("hours", s.getHours(),
                    fmt("Operating hours (%.0f) approaching end of life threshold", in.getCurrentHours())));
        }
        if (s.getMaintenanceCost() >= 7) {
            factors.add(factor("maintenance_cost", s.getMaintenanceCost(),
                    fmt("Annual maintenance cost ($%.0f) exceeds threshold", in.getMaintenanceCost12Months())));
        }
        if (s.getRepairFrequency() >= 7) {
            factors.add(factor("repair_frequency", s.getRepairFrequency(),
                    in.getRepairCount12Months() + " repairs in last 12 months"));
        }
        if (in.getEmergencyCount12Months() >= 2) {
            factors.add(RiskFactor.builder()
                    .category("emergency_repairs")
                    .severity(in.getEmergencyCount12Months() >= 4 ? "critical" : "high")
                    .description(in.getEmergencyCount12Months() + " emergency repairs in last 12 months")
                    .build());
        }
        if (s.getDowntime() >= 7) {
            factors.add(factor("downtime", s.getDowntime(),
                    fmt("%.0f hours of downtime in last 12 months", in.getDowntimeHours12Months())));
        }
        if (in.isMaintenanceOverdue()) {
            factors.add(RiskFactor.builder()
                    .category("maintenance_overdue")
                    .severity("medium")
                    .description("Scheduled maintenance is overdue")
                    .build());
        }
        return factors;
    }

    private static RiskFactor factor(String category, int subScore, String description) {
        return RiskFactor.builder()
                .category(category)
                .severity(subScore >= 9 ? "critical" : "high")
                .description(description)
                .build();
    }

    public List<Recommendation> recommend(int overallScore, List<RiskFactor> factors) {
        List<Recommendation> out = new ArrayList<>();
        if (overallScore >= 9) {
            out.add(new Recommendation("critical", "Replace immediately",
                    "This unit has exceeded safe operating thresholds. Recommend immediate replacement to avoid safety issues and excessive costs."));
        } else if (overallScore >= 7) {
            out.add(new Recommendation("high", "Plan replacement",
                    "This unit should be scheduled for replacement within the next 6-12 months. Consider adding to next fiscal year budget."));
        } else if (overallScore >= 5) {
            out.add(new Recommendation("medium", "Monitor closely",
                    "Increase inspection frequency and track maintenance costs. Re-assess in 3 months."));
        }
        if (hasFactor(factors, "maintenance_overdue")) {
            out.add(new Recommendation("high", "Complete overdue maintenance",
                    "Schedule and complete overdue preventive maintenance immediately."));
        }
        if (hasFactor(factors, "repair_frequency")) {
            out.add(new Recommendation("medium", "Root cause analysis",
                    "Conduct root cause analysis on frequent repairs to identify systemic issues."));
        }
        if (hasFactor(factors, "downtime")) {
            out.add(new Recommendation("medium", "Improve reliability",
                    "Consider more frequent preventive maintenance or component upgrades to reduce unplanned downtime."));
        }
        return out;
    }

    private static boolean hasFactor(List<RiskFactor> factors, String category) {
        return factors.stream().anyMatch(f -> category.equals(f.getCategory()));
    }

    public FinancialProjection project(RiskInputs in) {
        double price = positivePrice(in.getPurchasePrice());
        double age = Math.max(0, in.getAgeYears());
        double currentValue = price * Math.pow(1 - in.getDepreciationRate(), age);

        double trend = 1 + age * MAINTENANCE_TREND_PER_YEAR;
        double projectedMaintenance = in.getMaintenanceCost12Months() * trend;
        double projectedDowntime = in.getDowntimeCost12Months() * trend;

        double replacementCost = price * REPLACEMENT_PRICE_FACTOR;
        double remainingLifeMonths = Math.max(0, (in.getExpectedLifespanYears() - age) * 12);

        double years = Math.min(MAX_COMPARISON_YEARS, remainingLifeMonths / 12);
        double continueCost = (projectedMaintenance + projectedDowntime) * years;
        double replaceCost = replacementCost + price * NEW_UNIT_ANNUAL_COST_RATE * years;
        // trade-in value offsets the replacement
        double savings = continueCost - replaceCost + currentValue;

        double netOutlay = replacementCost - currentValue;
        double roi = savings > 0 && netOutlay > 0 ? savings / netOutlay * 100 : 0;

        return FinancialProjection.builder()
                .currentValue(Math.round(currentValue))
                .projectedAnnualMaintenance(Math.round(projectedMaintenance))
                .projectedDowntimeCost(Math.round(projectedDowntime))
                .projectedRepairCost(Math.round(projectedMaintenance * REPAIR_SHARE_OF_MAINTENANCE))
                .replacementCost(Math.round(replacementCost))
                .remainingLifeMonths(Math.round(remainingLifeMonths))
                .savingsIfReplaced(Math.round(savings))
                .roiIfReplaced(Math.round(roi))
                .build();
    }

    private void decide(int overall, FinancialProjection financials, RiskEvaluation.RiskEvaluationBuilder b) {
        if (overall >= 9) {
            b.decision(RiskAssessment.Decision.REPLACE).urgency(RiskAssessment.Urgency.IMMEDIATE);
        } else if (overall >= 7) {
            b.decision(financials.getSavingsIfReplaced() > 0 ? RiskAssessment.Decision.REPLACE : RiskAssessment.Decision.MONITOR)
                    .urgency(RiskAssessment.Urgency.WITHIN_6_MONTHS);
        } else if (overall >= 5) {
            b.decision(RiskAssessment.Decision.MONITOR).urgency(RiskAssessment.Urgency.WITHIN_1_YEAR);
        } else if (overall >= 3) {
            b.decision(RiskAssessment.Decision.REPAIR).urgency(RiskAssessment.Urgency.WITHIN_2_YEARS);
        } else {
            b.decision(RiskAssessment.Decision.REPAIR).urgency(RiskAssessment.Urgency.NOT_NEEDED);
        }
    }

    private double positivePrice(double price) {
        return price > 0 ? price : policy.getDefaultPurchasePrice();
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
