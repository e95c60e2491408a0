package com.sandy.fleet.health;

import com.sandy.fleet.health.entity.Forklift;
import com.sandy.fleet.health.entity.MaintenanceRecord;
import com.sandy.fleet.health.repository.ForkliftRepository;
import com.sandy.fleet.health.repository.MaintenanceRecordRepository;
import com.sandy.fleet.health.service.FailurePatternMatcher;
import com.sandy.fleet.health.service.impl.SequentialFailurePatternMatcher;
import com.sandy.fleet.health.vo.FailurePatternMatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "fleet.prediction.pattern-matcher=sequential"
})
class SequentialFailurePatternMatcherTest {

    @Autowired FailurePatternMatcher failurePatternMatcher;
    @Autowired ForkliftRepository forkliftRepository;
    @Autowired MaintenanceRecordRepository maintenanceRepository;

    @BeforeEach
    void init() {
        maintenanceRepository.deleteAll();
        forkliftRepository.deleteAll();
        forkliftRepository.save(Forklift.builder().id("SQ-1").currentHours(3000d).build());
    }

    private void record(String description, int daysAgo) {
        maintenanceRepository.save(MaintenanceRecord.builder()
                .forkliftId("SQ-1")
                .type(MaintenanceRecord.Type.REPAIR)
                .category("transmission")
                .description(description)
                .serviceDate(LocalDate.now().minusDays(daysAgo))
                .build());
    }

    @Test
    void propertySelectsSequentialMatcher() {
        assertInstanceOf(SequentialFailurePatternMatcher.class, failurePatternMatcher);
    }

    @Test
    void indicatorsInChronologicalOrderFire() {
        record("Transmission slip when climbing", 60);
        record("Transmission noise at idle", 20);

        List<FailurePatternMatch> matches = failurePatternMatcher.detect("SQ-1");

        assertEquals(1, matches.size());
        assertEquals(List.of("transmission_slip", "transmission_noise"), matches.get(0).getMatchedIndicators());
        assertEquals(53, matches.get(0).getConfidence());
    }

    @Test
    void indicatorsOutOfOrderDoNotFire() {
        record("Transmission noise at idle", 60);
        record("Transmission slip when climbing", 20);

        assertTrue(failurePatternMatcher.detect("SQ-1").isEmpty());
    }

    @Test
    void indicatorsInTheSameRecordCount() {
        record("Transmission slip and transmission noise", 30);
        record("Routine inspection", 10);

        assertEquals(1, failurePatternMatcher.detect("SQ-1").size());
    }
}
