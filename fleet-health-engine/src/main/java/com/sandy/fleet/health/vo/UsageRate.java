package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageRate {
    private double hoursPerDay;
    private double hoursPerWeek;
    private double hoursPerMonth;
    /** Unflagged readings used; 0 for the purchase-date fallback. */
    private int dataPoints;
    private Reliability reliability;
    private int lookbackDays;

    public enum Reliability {
        HIGH, MEDIUM, LOW, ESTIMATED;

        public static Reliability forDataPoints(int points) {
            if (points >= 10) return HIGH;
            if (points >= 5) return MEDIUM;
            return LOW;
        }
    }
}
