package com.sandy.fleet.health.service;

import com.sandy.fleet.health.vo.FailurePatternDefinition;
import com.sandy.fleet.health.vo.Urgency;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class FailurePatternCatalog {

    /** Fraction of a pattern's indicators that must be present for it to fire. */
    public static final double MATCH_RATIO = 0.66;

    private static final List<FailurePatternDefinition> PATTERNS = List.of(
            new FailurePatternDefinition("hydraulic_system_failure",
                    List.of("hydraulic_leak", "hydraulic_pressure", "hydraulic_noise"),
                    "Hydraulic pump failure likely", 0.85, Urgency.HIGH, 30),
            new FailurePatternDefinition("transmission_failure",
                    List.of("transmission_slip", "transmission_noise", "drive_hesitation"),
                    "Transmission failure imminent", 0.80, Urgency.CRITICAL, 14),
            new FailurePatternDefinition("battery_degradation",
                    List.of("reduced_runtime", "slow_charging", "capacity_loss"),
                    "Battery replacement needed soon", 0.90, Urgency.MEDIUM, 60),
            new FailurePatternDefinition("brake_system_wear",
                    List.of("brake_noise", "increased_stopping_distance", "brake_pedal_soft"),
                    "Brake system overhaul required", 0.88, Urgency.HIGH, 21),
            new FailurePatternDefinition("mast_chain_failure",
                    List.of("chain_noise", "uneven_lifting", "chain_stretch"),
                    "Mast chain replacement needed", 0.82, Urgency.HIGH, 30)
    );

    public List<FailurePatternDefinition> patterns() {
        return PATTERNS;
    }

    public static int requiredMatches(int indicators) {
        return (int) Math.ceil(MATCH_RATIO * indicators);
    }

    /** "hydraulic_leak" to "hydraulic leak". */
    public static String phrase(String keyword) {
        return keyword.replace('_', ' ').toLowerCase(Locale.ROOT);
    }
}
