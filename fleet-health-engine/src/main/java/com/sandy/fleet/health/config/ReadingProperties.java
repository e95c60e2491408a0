package com.sandy.fleet.health.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Defaults for hour meter anomaly detection. The jump threshold can be
 * overridden at runtime through the {@code hour_anomaly_jumpThreshold} setting.
 */
@Data
@Component
@ConfigurationProperties(prefix = "fleet.readings")
public class ReadingProperties {
    private double jumpThreshold = 100;
    /** Delta / elapsed wall clock hours above this ratio is physically implausible. */
    private double maxHoursPerElapsedHour = 1.5;
    /** Readings inspected for round-number and stagnant patterns. */
    private int patternLookback = 5;
    private int stagnantLookback = 3;
    private int usageLookbackDays = 90;
}
