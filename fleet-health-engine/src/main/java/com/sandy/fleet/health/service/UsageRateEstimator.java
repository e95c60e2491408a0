package com.sandy.fleet.health.service;

import com.sandy.fleet.health.config.ReadingProperties;
import com.sandy.fleet.health.entity.Forklift;
import com.sandy.fleet.health.entity.HourMeterReading;
import com.sandy.fleet.health.exception.ResourceNotFoundException;
import com.sandy.fleet.health.repository.ForkliftRepository;
import com.sandy.fleet.health.repository.HourMeterReadingRepository;
import com.sandy.fleet.health.vo.UsageRate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Average operating hours per day, derived from unflagged hour meter readings.
 * An empty result means there is not enough data to say anything.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UsageRateEstimator {

    private final ForkliftRepository forkliftRepository;
    private final HourMeterReadingRepository readingRepository;
    private final ReadingProperties readingProperties;
    private final Clock clock;

    public Optional<UsageRate> estimate(String forkliftId) {
        return estimate(forkliftId, readingProperties.getUsageLookbackDays());
    }

    public Optional<UsageRate> estimate(String forkliftId, int lookbackDays) {
        Forklift forklift = forkliftRepository.findById(forkliftId)
                .orElseThrow(() -> ResourceNotFoundException.of("Forklift", forkliftId));
        return estimate(forklift, lookbackDays);
    }

    public Optional<UsageRate> estimate(Forklift forklift) {
        return estimate(forklift, readingProperties.getUsageLookbackDays());
    }

    public Optional<UsageRate> estimate(Forklift forklift, int lookbackDays) {
        LocalDateTime since = LocalDateTime.now(clock).minusDays(lookbackDays);
        List<HourMeterReading> readings = readingRepository
                .findByForkliftIdAndFlaggedFalseAndRecordedAtAfterOrderByRecordedAtAscIdAsc(forklift.getId(), since);

        if (readings.size() >= 2) {
            HourMeterReading first = readings.get(0);
            HourMeterReading last = readings.get(readings.size() - 1);
            double days = Duration.between(first.getRecordedAt(), last.getRecordedAt()).toMillis() / 86_400_000d;
            double hoursPerDay = (last.getReading() - first.getReading()) / Math.max(1d, days);
            return Optional.of(rate(hoursPerDay, readings.size(),
                    UsageRate.Reliability.forDataPoints(readings.size()), lookbackDays));
        }

        LocalDate purchaseDate = forklift.getPurchaseDate();
        if (purchaseDate != null) {
            long daysOwned = ChronoUnit.DAYS.between(purchaseDate, LocalDate.now(clock));
            double current = forklift.getCurrentHours() == null ? 0 : forklift.getCurrentHours();
            return Optional.of(rate(current / Math.max(1, daysOwned), 0, UsageRate.Reliability.ESTIMATED, lookbackDays));
        }

        log.debug("No usage rate for forkliftId={}: {} readings in {} days and no purchase date",
                forklift.getId(), readings.size(), lookbackDays);
        return Optional.empty();
    }

    private static UsageRate rate(double hoursPerDay, int points, UsageRate.Reliability reliability, int lookbackDays) {
        return UsageRate.builder()
                .hoursPerDay(round2(hoursPerDay))
                .hoursPerWeek(round2(hoursPerDay * 7))
                .hoursPerMonth(round2(hoursPerDay * 30))
                .dataPoints(points)
                .reliability(reliability)
                .lookbackDays(lookbackDays)
                .build();
    }

    private static double round2(double v) {
        return Math.round(v * 100) / 100d;
    }
}
