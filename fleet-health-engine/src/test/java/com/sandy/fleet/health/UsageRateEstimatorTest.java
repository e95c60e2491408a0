package com.sandy.fleet.health;

import com.sandy.fleet.health.entity.Forklift;
import com.sandy.fleet.health.entity.HourMeterReading;
import com.sandy.fleet.health.exception.ResourceNotFoundException;
import com.sandy.fleet.health.repository.ForkliftRepository;
import com.sandy.fleet.health.repository.HourMeterReadingRepository;
import com.sandy.fleet.health.service.UsageRateEstimator;
import com.sandy.fleet.health.vo.UsageRate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class UsageRateEstimatorTest {

    @Autowired UsageRateEstimator usageRateEstimator;
    @Autowired ForkliftRepository forkliftRepository;
    @Autowired HourMeterReadingRepository readingRepository;

    LocalDateTime now;

    @BeforeEach
    void init() {
        readingRepository.deleteAll();
        forkliftRepository.deleteAll();
        now = LocalDateTime.now();
    }

    private void forklift(String id, LocalDate purchaseDate, double hours) {
        forkliftRepository.save(Forklift.builder().id(id).model("E20").currentHours(hours).purchaseDate(purchaseDate).build());
    }

    /** count readings, 5 days apart, ending today, 40 hours between each. */
    private void readings(String id, int count) {
        for (int i = 0; i < count; i++) {
            readingRepository.save(HourMeterReading.builder()
                    .forkliftId(id)
                    .reading(1000d + 40 * i)
                    .recordedAt(now.minusDays(5L * (count - 1 - i)).minusMinutes(1))
                    .build());
        }
    }

    @Test
    void tenOrMoreReadingsAreHighReliability() {
        forklift("U-1", null, 0);
        readings("U-1", 12);

        UsageRate rate = usageRateEstimator.estimate("U-1").orElseThrow();

        assertEquals(UsageRate.Reliability.HIGH, rate.getReliability());
        assertEquals(12, rate.getDataPoints());
        assertEquals(8.0, rate.getHoursPerDay(), 1e-9);
        assertEquals(56.0, rate.getHoursPerWeek(), 1e-9);
        assertEquals(240.0, rate.getHoursPerMonth(), 1e-9);
    }

    @Test
    void fiveToNineReadingsAreMediumAndFewerAreLow() {
        forklift("U-2", null, 0);
        readings("U-2", 6);
        forklift("U-3", null, 0);
        readings("U-3", 2);

        assertEquals(UsageRate.Reliability.MEDIUM, usageRateEstimator.estimate("U-2").orElseThrow().getReliability());
        UsageRate low = usageRateEstimator.estimate("U-3").orElseThrow();
        assertEquals(UsageRate.Reliability.LOW, low.getReliability());
        assertEquals(8.0, low.getHoursPerDay(), 1e-9);
    }

    @Test
    void flaggedAndOldReadingsAreIgnored() {
        forklift("U-4", null, 0);
        readingRepository.save(HourMeterReading.builder().forkliftId("U-4").reading(100d)
                .recordedAt(now.minusDays(200)).build());
        readingRepository.save(HourMeterReading.builder().forkliftId("U-4").reading(900d)
                .recordedAt(now.minusDays(3)).flagged(true).build());
        readingRepository.save(HourMeterReading.builder().forkliftId("U-4").reading(300d)
                .recordedAt(now.minusDays(2)).build());

        assertTrue(usageRateEstimator.estimate("U-4").isEmpty());
    }

    @Test
    void purchaseDateFallbackIsEstimated() {
        forklift("U-5", LocalDate.now().minusDays(100), 800);
        readings("U-5", 1);

        UsageRate rate = usageRateEstimator.estimate("U-5").orElseThrow();

        assertEquals(UsageRate.Reliability.ESTIMATED, rate.getReliability());
        assertEquals(0, rate.getDataPoints());
        assertEquals(8.0, rate.getHoursPerDay(), 1e-9);
    }

    @Test
    void noReadingsAndNoPurchaseDateIsNoResult() {
        forklift("U-6", null, 500);

        Optional<UsageRate> rate = usageRateEstimator.estimate("U-6");

        assertTrue(rate.isEmpty());
        assertThrows(ResourceNotFoundException.class, () -> usageRateEstimator.estimate("MISSING"));
    }
}
