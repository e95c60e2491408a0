package com.sandy.fleet.health.config;

import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Weights and threshold bands used by the risk scorer.
 * Defaults reproduce the production policy; override under {@code fleet.risk.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "fleet.risk")
public class RiskScoringPolicy {

    private Weights weights = new Weights();

    /** Age in years. */
    private Band age = new Band(3, 6, 8, 10);
    /** Operating hours on the meter. */
    private Band hours = new Band(5000, 10000, 15000, 20000);
    /** Trailing 12 month maintenance spend as percent of purchase price. */
    private Band maintenanceCostPercent = new Band(5, 10, 15, 20);
    /** Repair + emergency records in the trailing 12 months. */
    private Band repairsPerYear = new Band(2, 4, 6, 8);
    /** Downtime hours in the trailing 12 months. */
    private Band downtimeHoursPerYear = new Band(24, 72, 168, 336);

    /** Assumed when a unit has no purchase price. */
    private double defaultPurchasePrice = 25000;
    /** Assumed age when neither purchase date nor model year is known. */
    private double defaultAgeYears = 5;
    private double defaultDepreciationRate = 0.15;
    private int defaultLifespanYears = 10;

    /** Overall score at or above which a high_risk alert is raised. */
    private int alertThreshold = 7;

    @PostConstruct
    public void validate() {
        weights.validate();
        age.validate("age");
        hours.validate("hours");
        maintenanceCostPercent.validate("maintenanceCostPercent");
        repairsPerYear.validate("repairsPerYear");
        downtimeHoursPerYear.validate("downtimeHoursPerYear");
        if (defaultPurchasePrice <= 0) {
            throw new IllegalArgumentException("fleet.risk.default-purchase-price must be positive");
        }
    }

    @Data
    public static class Weights {
        private double age = 0.15;
        private double hours = 0.20;
        private double maintenanceCost = 0.25;
        private double repairFrequency = 0.20;
        private double downtime = 0.20;

        void validate() {
            double[] all = {age, hours, maintenanceCost, repairFrequency, downtime};
            double sum = 0;
            for (double w : all) {
                if (w < 0 || Double.isNaN(w)) {
                    throw new IllegalArgumentException("fleet.risk.weights must be non-negative: " + this);
                }
                sum += w;
            }
            if (Math.abs(sum - 1.0) > 0.001) {
                throw new IllegalArgumentException("fleet.risk.weights must sum to 1.0 but sum to " + sum);
            }
        }
    }

    /**
     * Four ascending thresholds. At or below {@code low} scores 1, beyond {@code critical} scores 10.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Band {
        private double low;
        private double medium;
        private double high;
        private double critical;

        void validate(String name) {
            if (!(low <= medium && medium <= high && high <= critical)) {
                throw new IllegalArgumentException("fleet.risk." + name + " thresholds must be ascending: " + this);
            }
        }
    }
}
