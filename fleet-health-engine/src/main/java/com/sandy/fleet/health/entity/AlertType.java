package com.sandy.fleet.health.entity;

import java.util.Locale;

public enum AlertType {
    MAINTENANCE_DUE,
    MAINTENANCE_OVERDUE,
    HOUR_ANOMALY,
    HIGH_RISK,
    DOWNTIME,
    COST_THRESHOLD,
    SERVICE_REMINDER,
    INSPECTION_DUE,
    WARRANTY_EXPIRING,
    LIFECYCLE_ALERT,
    CUSTOM;

    /** Lower-case code used in recurrence keys and webhook event filters, e.g. {@code high_risk}. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlertType fromCode(String code) {
        if (code == null) throw new IllegalArgumentException("Alert type is required");
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid alert type: " + code, e);
        }
    }
}
