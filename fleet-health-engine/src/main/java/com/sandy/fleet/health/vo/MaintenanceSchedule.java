package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceSchedule {
    private List<Item> schedule;
    private int totalItems;
    private int criticalItems;
    private int daysAhead;
    private LocalDateTime generatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        private String forkliftId;
        private String model;
        private String location;
        private String serviceType;
        private LocalDate predictedDate;
        private long daysUntil;
        /** Percent, 0-100. */
        private int confidence;
        private Urgency priority;
        private String component;
    }
}
