package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenancePrediction {
    private String forkliftId;
    private String forkliftModel;
    private String location;
    private double currentHours;
    private Integer riskScore;
    /** 0-100, capped. */
    private int urgencyScore;
    private Status overallStatus;
    /** Sorted by urgency. */
    private List<PredictionFinding> findings;
    private ServicePrediction servicePrediction;
    private ComponentHealthReport componentHealth;
    private List<FailurePatternMatch> failurePatterns;
    private LocalDateTime generatedAt;

    public enum Status {
        CRITICAL, WARNING, OK;

        public static Status forUrgencyScore(int score) {
            if (score >= 50) return CRITICAL;
            if (score >= 30) return WARNING;
            return OK;
        }
    }
}
