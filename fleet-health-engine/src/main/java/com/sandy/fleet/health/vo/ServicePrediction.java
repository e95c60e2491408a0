package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServicePrediction {
    private String forkliftId;
    private double currentHours;
    /** Null when the usage rate could not be estimated. */
    private UsageRate usageRate;
    /** Soonest first. */
    private List<Candidate> candidates;
    private String recommendedAction;

    public Candidate soonest() {
        return candidates == null || candidates.isEmpty() ? null : candidates.get(0);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Candidate {
        private Basis type;
        private LocalDate predictedDate;
        private long daysUntil;
        private Long hoursRemaining;
        private double confidence;
        private String basis;
    }

    public enum Basis { HOURS_BASED, DATE_BASED }
}
