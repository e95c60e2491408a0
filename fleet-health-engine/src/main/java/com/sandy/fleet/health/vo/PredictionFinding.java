package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionFinding {
    private FindingType type;
    private String title;
    private String description;
    /** Percent, 0-100. */
    private int confidence;
    private Urgency urgency;
    private Long daysUntil;
    private LocalDate predictedDate;
    private String component;
    private String category;
    private String patternName;
    private List<String> matchedIndicators;

    public enum FindingType {
        SCHEDULED_SERVICE, FAILURE_PATTERN, COMPONENT_LIFECYCLE;

        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
