package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Static reference entry: expected hours until service for one subsystem.
 */
@Value
@AllArgsConstructor
public class ComponentLifecycleDefinition {
    String key;
    double expectedHours;
    /** Fraction of expected life at which the component is due soon. */
    double warningThreshold;
    /** Maintenance record category whose last service resets this component. */
    String category;
    Applicability applicability;

    public boolean appliesTo(boolean electric) {
        return switch (applicability) {
            case ALL -> true;
            case ELECTRIC_ONLY -> electric;
            case COMBUSTION_ONLY -> !electric;
        };
    }

    /** "drive_motor" to "Drive Motor". */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        for (String part : key.split("_")) {
            if (part.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }

    public enum Applicability { ALL, ELECTRIC_ONLY, COMBUSTION_ONLY }
}
