package com.sandy.fleet.health.vo;

import com.sandy.fleet.health.entity.Alert;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertDashboard {
    private long totalActive;
    private Map<String, Long> bySeverity;
    private Map<String, Long> byType;
    /** Top active alerts in listing order. */
    private List<Alert> recentAlerts;
    private Trend trend;
    /** Alerts created per day over the trend window, oldest first. */
    private List<DailyCount> daily;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Trend {
        private long currentWeek;
        private long previousWeek;
        private long changePercent;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class DailyCount {
        private LocalDate day;
        private long count;
    }
}
