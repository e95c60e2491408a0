package com.sandy.fleet.health.vo;

import com.sandy.fleet.health.entity.HourMeterReading;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadingAnomaly {
    private Type type;
    private HourMeterReading.FlagSeverity severity;
    private String description;
    private Double previousValue;
    private Double newValue;
    private Double delta;

    /** Only BACKWARD_READING and LARGE_JUMP flag a reading; the rest are advisory. */
    public enum Type {
        BACKWARD_READING, LARGE_JUMP, EXCEEDS_POSSIBLE, SUSPICIOUS_PATTERN, STAGNANT_READING;

        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
