package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertStats {
    private long totalAlerts;
    /** Active and unresolved (snoozed alerts excluded). */
    private long activeAlerts;
    private long snoozedAlerts;
    private long acknowledgedAlerts;
    /** Unresolved counts keyed by severity code, critical first. */
    private Map<String, Long> bySeverity;
    /** Unresolved counts keyed by type code. */
    private Map<String, Long> byType;
}
