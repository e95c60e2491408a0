package com.sandy.fleet.health.entity;

import java.util.Locale;

/**
 * Alert severity. Listings order by {@link #rank()}: critical first.
 */
public enum AlertSeverity {
    CRITICAL(0), HIGH(1), MEDIUM(2), LOW(3);

    private final int rank;

    AlertSeverity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /** Critical and high alerts are pushed over email / sms. */
    public boolean isUrgent() {
        return this == CRITICAL || this == HIGH;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
