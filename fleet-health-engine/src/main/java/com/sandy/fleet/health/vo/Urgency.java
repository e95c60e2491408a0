package com.sandy.fleet.health.vo;

/** Ordering used for findings and component health: critical first. */
public enum Urgency {
    CRITICAL, HIGH, MEDIUM, LOW, NONE;

    public int rank() {
        return ordinal();
    }
}
