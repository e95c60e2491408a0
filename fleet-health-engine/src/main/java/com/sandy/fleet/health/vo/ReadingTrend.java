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
public class ReadingTrend {
    private String forkliftId;
    private int periodDays;
    private int readingsCount;
    private double firstReading;
    private double lastReading;
    private double totalHoursAdded;
    private double averageDailyHours;
    private double averageWeeklyHours;
    private double projectedAnnualHours;
    private int flaggedReadings;
    private List<Point> readings;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Point {
        private LocalDateTime date;
        private double reading;
        private Double delta;
        private boolean flagged;
    }
}
