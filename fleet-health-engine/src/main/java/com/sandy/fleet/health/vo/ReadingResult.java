package com.sandy.fleet.health.vo;

import com.sandy.fleet.health.entity.Forklift;
import com.sandy.fleet.health.entity.HourMeterReading;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadingResult {
    private HourMeterReading reading;
    private List<ReadingAnomaly> anomalies;
    /** Forklift state after the reading was applied (or not). */
    private Forklift forklift;
    /** Anomaly alert raised for a flagged reading, null otherwise. */
    private Long alertId;
}
