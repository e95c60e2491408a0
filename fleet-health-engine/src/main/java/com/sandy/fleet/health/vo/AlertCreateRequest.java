package com.sandy.fleet.health.vo;

import com.sandy.fleet.health.entity.AlertSeverity;
import com.sandy.fleet.health.entity.AlertType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertCreateRequest {
    private String forkliftId;
    private AlertType type;
    private AlertSeverity severity;
    private String title;
    private String message;
    private Map<String, Object> contextData;
    private Double thresholdValue;
    private Double actualValue;
    /** When absent, alerts for a forklift dedup on {type}_{forkliftId}. */
    private String recurrenceKey;

    /**
     * Key used to collapse repeats into one open alert. An explicit recurrence key replaces the
     * implicit {@code {type}_{forkliftId}} key rather than adding to it, so an open alert raised
     * without a key for the same type and forklift does not suppress this one. Each alert carries
     * exactly one key. Returns {@code null} when neither is available, which disables dedup.
     */
    public String dedupKey() {
        if (recurrenceKey != null && !recurrenceKey.isBlank()) return recurrenceKey;
        if (forkliftId != null && type != null) return type.code() + "_" + forkliftId;
        return null;
    }
}
