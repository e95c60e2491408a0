package com.sandy.fleet.health;

import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.entity.AlertSeverity;
import com.sandy.fleet.health.entity.AlertType;
import com.sandy.fleet.health.entity.Forklift;
import com.sandy.fleet.health.entity.HourMeterReading;
import com.sandy.fleet.health.exception.ResourceNotFoundException;
import com.sandy.fleet.health.repository.*;
import com.sandy.fleet.health.service.ReadingIngestService;
import com.sandy.fleet.health.vo.BulkImportResult;
import com.sandy.fleet.health.vo.ReadingAnomaly;
import com.sandy.fleet.health.vo.ReadingImportItem;
import com.sandy.fleet.health.vo.ReadingResult;
import com.sandy.fleet.health.vo.ReadingTrend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class ReadingIngestServiceTest {

    @Autowired ReadingIngestService readingIngestService;
    @Autowired ForkliftRepository forkliftRepository;
    @Autowired HourMeterReadingRepository readingRepository;
    @Autowired AlertRepository alertRepository;
    @Autowired AlertAcknowledgmentRepository acknowledgmentRepository;
    @Autowired NotificationTaskRepository taskRepository;
    @Autowired SystemSettingRepository settingRepository;

    @BeforeEach
    void init() {
        taskRepository.deleteAll();
        acknowledgmentRepository.deleteAll();
        alertRepository.deleteAll();
        readingRepository.deleteAll();
        settingRepository.deleteAll();
        forkliftRepository.deleteAll();
    }

    private Forklift forklift(String id) {
        return forkliftRepository.save(Forklift.builder().id(id).model("CX-25").currentHours(0d).build());
    }

    private double currentHours(String id) {
        return forkliftRepository.findById(id).orElseThrow().getCurrentHours();
    }

    @Test
    void backwardReadingIsFlaggedAsErrorAndLeavesHoursUntouched() {
        forklift("FL-001");
        readingIngestService.recordReading("FL-001", 500d, HourMeterReading.Source.MANUAL, "tech");

        ReadingResult result = readingIngestService.recordReading("FL-001", 480d, HourMeterReading.Source.MANUAL, "tech");

        HourMeterReading reading = result.getReading();
        assertTrue(reading.isFlagged());
        assertEquals(HourMeterReading.FlagSeverity.ERROR, reading.getFlagSeverity());
        assertEquals(-20d, reading.getReadingDelta(), 1e-9);
        assertEquals("Hour meter went backwards by 20.0 hours", reading.getFlagReason());
        assertEquals(500d, currentHours("FL-001"), 1e-9);
        assertTrue(result.getAnomalies().stream().anyMatch(a -> a.getType() == ReadingAnomaly.Type.BACKWARD_READING));

        assertNotNull(result.getAlertId());
        Alert alert = alertRepository.findById(result.getAlertId()).orElseThrow();
        assertEquals(AlertType.HOUR_ANOMALY, alert.getType());
        assertEquals(AlertSeverity.HIGH, alert.getSeverity());
        assertEquals("Hour Meter Anomaly: FL-001", alert.getTitle());
        assertEquals("hour_anomaly_FL-001_" + reading.getId(), alert.getRecurrenceKey());
        assertEquals(480d, alert.getActualValue(), 1e-9);
        assertEquals(500d, alert.getThresholdValue(), 1e-9);
    }

    @Test
    void largeJumpIsFlaggedAsWarning() {
        forklift("FL-002");
        readingIngestService.recordReading("FL-002", 500d, HourMeterReading.Source.MANUAL, "tech");

        ReadingResult result = readingIngestService.recordReading("FL-002", 650d, HourMeterReading.Source.API, "tech");

        assertTrue(result.getReading().isFlagged());
        assertEquals(HourMeterReading.FlagSeverity.WARNING, result.getReading().getFlagSeverity());
        assertEquals("Unusually large increase of 150.0 hours", result.getReading().getFlagReason());
        assertEquals(500d, currentHours("FL-002"), 1e-9);
        Alert alert = alertRepository.findById(result.getAlertId()).orElseThrow();
        assertEquals(AlertSeverity.MEDIUM, alert.getSeverity());
    }

    @Test
    void normalIncreaseAdvancesCurrentHours() {
        forklift("FL-003");
        readingIngestService.recordReading("FL-003", 500d, HourMeterReading.Source.MANUAL, "tech");

        ReadingResult result = readingIngestService.recordReading("FL-003", 520d, HourMeterReading.Source.IOT, "tech");

        assertFalse(result.getReading().isFlagged());
        assertNull(result.getAlertId());
        assertEquals(520d, currentHours("FL-003"), 1e-9);
        Forklift f = forkliftRepository.findById("FL-003").orElseThrow();
        assertEquals(520d, f.getLastHourReading(), 1e-9);
        assertNotNull(f.getLastHourReadingDate());
        assertTrue(alertRepository.findAll().isEmpty());
    }

    @Test
    void firstReadingIsNeverAJump() {
        forklift("FL-004");
        ReadingResult result = readingIngestService.recordReading("FL-004", 4200d, HourMeterReading.Source.IMPORT, "tech");

        assertFalse(result.getReading().isFlagged());
        assertEquals(0d, result.getReading().getPreviousReading(), 1e-9);
        assertTrue(result.getAnomalies().isEmpty());
        assertEquals(4200d, currentHours("FL-004"), 1e-9);
    }

    @Test
    void invalidInputsAreRejected() {
        forklift("FL-005");
        assertThrows(IllegalArgumentException.class,
                () -> readingIngestService.recordReading("FL-005", -1d, HourMeterReading.Source.MANUAL, "tech"));
        assertThrows(IllegalArgumentException.class,
                () -> readingIngestService.recordReading("FL-005", Double.NaN, HourMeterReading.Source.MANUAL, "tech"));
        assertThrows(ResourceNotFoundException.class,
                () -> readingIngestService.recordReading("NOPE", 10d, HourMeterReading.Source.MANUAL, "tech"));
        assertThrows(IllegalArgumentException.class,
                () -> readingIngestService.recordReading(null, 10d, HourMeterReading.Source.MANUAL, "tech"));
    }

    @Test
    void anomalyAlertPointsAtCommittedReading() {
        forklift("FL-013");
        readingIngestService.recordReading("FL-013", 700d, HourMeterReading.Source.MANUAL, "tech");

        ReadingResult result = readingIngestService.recordReading("FL-013", 650d, HourMeterReading.Source.MANUAL, "tech");

        Long readingId = result.getReading().getId();
        HourMeterReading stored = readingRepository.findById(readingId).orElseThrow();
        assertTrue(stored.isFlagged());
        Alert alert = alertRepository.findById(result.getAlertId()).orElseThrow();
        assertEquals(readingId.longValue(), ((Number) alert.getContextData().get("reading_id")).longValue());
        assertEquals(List.of("backward_reading"), alert.getContextData().get("anomalies"));
        assertEquals(1, alertRepository.count());
    }

    @Test
    void jumpThresholdSettingOverridesDefault() {
        forklift("FL-006");
        readingIngestService.updateJumpThreshold(200);
        readingIngestService.recordReading("FL-006", 500d, HourMeterReading.Source.MANUAL, "tech");

        ReadingResult result = readingIngestService.recordReading("FL-006", 650d, HourMeterReading.Source.MANUAL, "tech");

        assertFalse(result.getReading().isFlagged());
        assertEquals(650d, currentHours("FL-006"), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> readingIngestService.updateJumpThreshold(0));
    }

    @Test
    void stagnantReadingIsAdvisoryOnly() {
        forklift("FL-007");
        for (int i = 0; i < 3; i++) {
            readingIngestService.recordReading("FL-007", 733d, HourMeterReading.Source.MANUAL, "tech");
        }
        ReadingResult result = readingIngestService.recordReading("FL-007", 733d, HourMeterReading.Source.MANUAL, "tech");

        assertFalse(result.getReading().isFlagged());
        assertTrue(result.getAnomalies().stream().anyMatch(a -> a.getType() == ReadingAnomaly.Type.STAGNANT_READING));
    }

    @Test
    void correctionForceAppliesValueAndResolvesAlert() {
        forklift("FL-008");
        readingIngestService.recordReading("FL-008", 500d, HourMeterReading.Source.MANUAL, "tech");
        ReadingResult flagged = readingIngestService.recordReading("FL-008", 480d, HourMeterReading.Source.MANUAL, "tech");
        Long readingId = flagged.getReading().getId();

        HourMeterReading corrected = readingIngestService.correctReading(readingId, 508d, "supervisor", "typo");

        assertTrue(corrected.isCorrected());
        assertTrue(corrected.isValidated());
        assertEquals(508d, corrected.getCorrectedValue(), 1e-9);
        assertEquals(508d, currentHours("FL-008"), 1e-9);
        Alert alert = alertRepository.findById(flagged.getAlertId()).orElseThrow();
        assertTrue(alert.isResolved());
        assertEquals("Corrected to 508.0 hours", alert.getResolutionNotes());

        assertThrows(IllegalStateException.class,
                () -> readingIngestService.correctReading(readingId, 510d, "supervisor", null));
        assertTrue(readingIngestService.getFlaggedReadings(10).isEmpty());
    }

    @Test
    void unflaggedReadingCannotBeCorrected() {
        forklift("FL-009");
        ReadingResult ok = readingIngestService.recordReading("FL-009", 100d, HourMeterReading.Source.MANUAL, "tech");
        assertThrows(IllegalStateException.class,
                () -> readingIngestService.correctReading(ok.getReading().getId(), 90d, "supervisor", null));
        assertThrows(ResourceNotFoundException.class,
                () -> readingIngestService.correctReading(987654L, 90d, "supervisor", null));
    }

    @Test
    void validationAcceptsFlaggedReading() {
        forklift("FL-010");
        readingIngestService.recordReading("FL-010", 500d, HourMeterReading.Source.MANUAL, "tech");
        ReadingResult flagged = readingIngestService.recordReading("FL-010", 650d, HourMeterReading.Source.MANUAL, "tech");
        assertEquals(1, readingIngestService.getFlaggedReadings(10).size());

        HourMeterReading validated = readingIngestService.validateReading(flagged.getReading().getId(), "supervisor", null);

        assertTrue(validated.isValidated());
        assertFalse(validated.isCorrected());
        assertEquals("Validated as correct", validated.getCorrectionNotes());
        assertEquals(650d, currentHours("FL-010"), 1e-9);
        assertTrue(alertRepository.findById(flagged.getAlertId()).orElseThrow().isResolved());
        assertTrue(readingIngestService.getFlaggedReadings(10).isEmpty());
        assertThrows(IllegalStateException.class,
                () -> readingIngestService.validateReading(flagged.getReading().getId(), "supervisor", null));
    }

    @Test
    void bulkImportContinuesPastBadItems() {
        forklift("FL-011");
        forklift("FL-012");
        readingIngestService.recordReading("FL-012", 100d, HourMeterReading.Source.MANUAL, "tech");

        BulkImportResult result = readingIngestService.bulkImport(List.of(
                new ReadingImportItem("FL-011", 250d),
                new ReadingImportItem("GHOST", 10d),
                new ReadingImportItem("FL-011", -5d),
                new ReadingImportItem("FL-012", 900d)
        ), null, "importer");

        assertEquals(2, result.getSuccessful());
        assertEquals(2, result.getFailed());
        assertEquals(1, result.getFlagged());
        assertEquals(2, result.getErrors().size());
        assertEquals("GHOST", result.getErrors().get(0).getForkliftId());
        assertEquals(250d, currentHours("FL-011"), 1e-9);
        assertEquals(100d, currentHours("FL-012"), 1e-9);
    }

    @Test
    void bulkImportRecordsMissingForkliftIdAsFailure() {
        forklift("FL-014");

        BulkImportResult result = readingIngestService.bulkImport(Arrays.asList(
                new ReadingImportItem(null, 40d),
                new ReadingImportItem("FL-014", 120d),
                null,
                new ReadingImportItem("FL-014", 90d)
        ), HourMeterReading.Source.IMPORT, "importer");

        assertEquals(2, result.getSuccessful());
        assertEquals(2, result.getFailed());
        assertEquals(1, result.getFlagged());
        assertEquals("Forklift id is required", result.getErrors().get(0).getError());
        assertNull(result.getErrors().get(0).getForkliftId());
        assertEquals(120d, currentHours("FL-014"), 1e-9);
        assertEquals(1, alertRepository.count());
    }

    @Test
    void trendsNeedTwoReadings() {
        forklift("FL-013");
        LocalDateTime now = LocalDateTime.now();
        readingRepository.save(HourMeterReading.builder().forkliftId("FL-013").reading(1000d)
                .recordedAt(now.minusDays(20)).build());
        assertTrue(readingIngestService.getTrends("FL-013", 30).isEmpty());

        readingRepository.save(HourMeterReading.builder().forkliftId("FL-013").reading(1150d).readingDelta(150d)
                .recordedAt(now.minusDays(10)).flagged(true).build());
        readingRepository.save(HourMeterReading.builder().forkliftId("FL-013").reading(1240d).readingDelta(90d)
                .recordedAt(now.minusDays(1)).build());

        Optional<ReadingTrend> trend = readingIngestService.getTrends("FL-013", 30);

        assertTrue(trend.isPresent());
        ReadingTrend t = trend.get();
        assertEquals(3, t.getReadingsCount());
        assertEquals(240d, t.getTotalHoursAdded(), 1e-9);
        assertEquals(8d, t.getAverageDailyHours(), 1e-9);
        assertEquals(56d, t.getAverageWeeklyHours(), 1e-9);
        assertEquals(2920d, t.getProjectedAnnualHours(), 1e-9);
        assertEquals(1, t.getFlaggedReadings());
        assertEquals(3, t.getReadings().size());

        List<HourMeterReading> history = readingIngestService.getHistory("FL-013", 2);
        assertEquals(2, history.size());
        assertEquals(1240d, history.get(0).getReading(), 1e-9);
        assertEquals(1150d, history.get(1).getReading(), 1e-9);
    }
}
