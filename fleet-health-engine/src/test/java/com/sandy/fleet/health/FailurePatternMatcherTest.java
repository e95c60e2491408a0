package com.sandy.fleet.health;

import com.sandy.fleet.health.entity.Forklift;
import com.sandy.fleet.health.entity.MaintenanceRecord;
import com.sandy.fleet.health.exception.ResourceNotFoundException;
import com.sandy.fleet.health.repository.ForkliftRepository;
import com.sandy.fleet.health.repository.MaintenanceRecordRepository;
import com.sandy.fleet.health.service.FailurePatternMatcher;
import com.sandy.fleet.health.service.impl.KeywordPresenceFailurePatternMatcher;
import com.sandy.fleet.health.vo.FailurePatternMatch;
import com.sandy.fleet.health.vo.Urgency;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class FailurePatternMatcherTest {

    @Autowired FailurePatternMatcher failurePatternMatcher;
    @Autowired ForkliftRepository forkliftRepository;
    @Autowired MaintenanceRecordRepository maintenanceRepository;

    @BeforeEach
    void init() {
        maintenanceRepository.deleteAll();
        forkliftRepository.deleteAll();
        forkliftRepository.save(Forklift.builder().id("FP-1").currentHours(3000d).build());
    }

    private void record(String category, String description, String work, int daysAgo, MaintenanceRecord.Status status) {
        maintenanceRepository.save(MaintenanceRecord.builder()
                .forkliftId("FP-1")
                .type(MaintenanceRecord.Type.REPAIR)
                .category(category)
                .description(description)
                .workPerformed(work)
                .status(status)
                .serviceDate(LocalDate.now().minusDays(daysAgo))
                .build());
    }

    @Test
    void keywordMatcherIsTheDefault() {
        assertInstanceOf(KeywordPresenceFailurePatternMatcher.class, failurePatternMatcher);
    }

    @Test
    void twoOfThreeIndicatorsFireThePattern() {
        record("hydraulic", "Operator reports Hydraulic LEAK near pump", "Replaced seal", 40, MaintenanceRecord.Status.COMPLETED);
        record("general", "Lift sluggish", "Measured low hydraulic pressure at relief valve", 10, MaintenanceRecord.Status.COMPLETED);

        List<FailurePatternMatch> matches = failurePatternMatcher.detect("FP-1");

        assertEquals(1, matches.size());
        FailurePatternMatch m = matches.get(0);
        assertEquals("hydraulic_system_failure", m.getPatternName());
        assertEquals("Hydraulic pump failure likely", m.getPrediction());
        assertEquals(List.of("hydraulic_leak", "hydraulic_pressure"), m.getMatchedIndicators());
        assertEquals(3, m.getTotalIndicators());
        assertEquals(57, m.getConfidence());
        assertEquals(Urgency.HIGH, m.getUrgency());
        assertEquals("Schedule inspection within 30 days", m.getRecommendedAction());
    }

    @Test
    void keywordOrderDoesNotMatter() {
        record("transmission", "Transmission noise under load", null, 60, MaintenanceRecord.Status.COMPLETED);
        record("transmission", "Transmission slip on ramp", null, 20, MaintenanceRecord.Status.COMPLETED);

        List<FailurePatternMatch> matches = failurePatternMatcher.detect("FP-1");

        assertEquals(1, matches.size());
        assertEquals("transmission_failure", matches.get(0).getPatternName());
        assertEquals(Urgency.CRITICAL, matches.get(0).getUrgency());
    }

    @Test
    void indicatorPhraseMustSitWithinOneRecord() {
        record("hydraulic", "Seat belt replaced", null, 60, MaintenanceRecord.Status.COMPLETED);
        record("hydraulic", "Leak at mast chain guard", null, 40, MaintenanceRecord.Status.COMPLETED);
        record("general", "Pressure washer used on cab", null, 20, MaintenanceRecord.Status.COMPLETED);

        assertTrue(failurePatternMatcher.detect("FP-1").isEmpty());
    }

    @Test
    void singleIndicatorOrSingleRecordIsNotEnough() {
        record("brakes", "Brake noise and brake pedal soft", null, 5, MaintenanceRecord.Status.COMPLETED);
        assertTrue(failurePatternMatcher.detect("FP-1").isEmpty());

        record("mast", "Chain noise", null, 3, MaintenanceRecord.Status.COMPLETED);
        List<FailurePatternMatch> matches = failurePatternMatcher.detect("FP-1");
        assertEquals(1, matches.size());
        assertEquals("brake_system_wear", matches.get(0).getPatternName());
    }

    @Test
    void cancelledAndOldRecordsAreOutsideTheCorpus() {
        record("battery", "Reduced runtime reported", null, 300, MaintenanceRecord.Status.COMPLETED);
        record("battery", "Slow charging", null, 30, MaintenanceRecord.Status.CANCELLED);
        record("battery", "Capacity loss measured", null, 10, MaintenanceRecord.Status.COMPLETED);
        record("general", "Routine inspection", null, 5, MaintenanceRecord.Status.COMPLETED);

        assertTrue(failurePatternMatcher.detect("FP-1").isEmpty());
        assertEquals(1, failurePatternMatcher.detect("FP-1", 365).size());
    }

    @Test
    void unknownForkliftIsNotFound() {
        assertThrows(ResourceNotFoundException.class, () -> failurePatternMatcher.detect("NOPE"));
    }
}
