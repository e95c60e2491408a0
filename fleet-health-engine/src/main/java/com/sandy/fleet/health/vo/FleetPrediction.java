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
public class FleetPrediction {
    private Summary summary;
    /** Units with at least one finding, highest urgency score first. */
    private List<MaintenancePrediction> predictions;
    private LocalDateTime generatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int totalUnits;
        private int unitsWithPredictions;
        private int criticalCount;
        private int warningCount;
        private int okCount;
        private List<TopPrediction> topPredictions;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TopPrediction {
        private String forkliftId;
        private String model;
        private String location;
        private int urgencyScore;
        private MaintenancePrediction.Status status;
        private PredictionFinding topFinding;
    }
}
