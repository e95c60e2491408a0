package com.sandy.fleet.health.service.impl;

import com.sandy.fleet.health.config.ReadingProperties;
import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.entity.AlertSeverity;
import com.sandy.fleet.health.entity.AlertType;
import com.sandy.fleet.health.entity.Forklift;
import com.sandy.fleet.health.entity.HourMeterReading;
import com.sandy.fleet.health.exception.ResourceNotFoundException;
import com.sandy.fleet.health.repository.AlertRepository;
import com.sandy.fleet.health.repository.ForkliftRepository;
import com.sandy.fleet.health.repository.HourMeterReadingRepository;
import com.sandy.fleet.health.service.AlertService;
import com.sandy.fleet.health.service.ReadingIngestService;
import com.sandy.fleet.health.service.SettingsService;
import com.sandy.fleet.health.vo.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ReadingIngestServiceImpl implements ReadingIngestService {

    private static final int HISTORY_WINDOW = 10;

    private final ForkliftRepository forkliftRepository;
    private final HourMeterReadingRepository readingRepository;
    private final AlertRepository alertRepository;
    private final AlertService alertService;
    private final SettingsService settingsService;
    private final ReadingProperties readingProperties;
    private final Clock clock;
    private final TransactionTemplate tx;

    public ReadingIngestServiceImpl(ForkliftRepository forkliftRepository,
                                    HourMeterReadingRepository readingRepository,
                                    AlertRepository alertRepository,
                                    AlertService alertService,
                                    SettingsService settingsService,
                                    ReadingProperties readingProperties,
                                    Clock clock,
                                    PlatformTransactionManager transactionManager) {
        this.forkliftRepository = forkliftRepository;
        this.readingRepository = readingRepository;
        this.alertRepository = alertRepository;
        this.alertService = alertService;
        this.settingsService = settingsService;
        this.readingProperties = readingProperties;
        this.clock = clock;
        this.tx = new TransactionTemplate(transactionManager);
    }

    @Override
    public ReadingResult recordReading(String forkliftId, Double reading, HourMeterReading.Source source, String recordedBy) {
        if (reading == null || reading.isNaN() || reading.isInfinite() || reading < 0) {
            throw new IllegalArgumentException("Invalid reading: must be a non-negative number, got " + reading);
        }
        if (forkliftId == null || forkliftId.isBlank()) {
            throw new IllegalArgumentException("Forklift id is required");
        }
        ReadingResult result = tx.execute(status -> doRecord(forkliftId, reading, source, recordedBy));
        if (result.getReading().isFlagged()) {
            // after commit: the alert must reference a stored reading
            result.setAlertId(raiseAnomalyAlert(result.getForklift(), result.getReading(), result.getAnomalies()).getId());
        }
        return result;
    }

    private ReadingResult doRecord(String forkliftId, double value, HourMeterReading.Source source, String recordedBy) {
        Forklift forklift = requireForklift(forkliftId);
        LocalDateTime now = LocalDateTime.now(clock);
        List<HourMeterReading> recent = readingRepository.findByForkliftIdOrderByRecordedAtDescIdDesc(
                forkliftId, PageRequest.of(0, HISTORY_WINDOW));
        HourMeterReading previous = recent.isEmpty() ? null : recent.get(0);
        double previousValue = previous == null ? 0d : previous.getReading();
        double delta = value - previousValue;
        double jumpThreshold = jumpThreshold();

        HourMeterReading entity = HourMeterReading.builder()
                .forkliftId(forkliftId)
                .reading(value)
                .previousReading(previousValue)
                .readingDelta(delta)
                .source(source == null ? HourMeterReading.Source.MANUAL : source)
                .recordedBy(recordedBy)
                .recordedAt(now)
                .build();
        if (delta < 0) {
            entity.setFlagged(true);
            entity.setFlagSeverity(HourMeterReading.FlagSeverity.ERROR);
            entity.setFlagReason(String.format(Locale.ROOT, "Hour meter went backwards by %.1f hours", Math.abs(delta)));
        } else if (previous != null && delta > jumpThreshold) {
            entity.setFlagged(true);
            entity.setFlagSeverity(HourMeterReading.FlagSeverity.WARNING);
            entity.setFlagReason(String.format(Locale.ROOT, "Unusually large increase of %.1f hours", delta));
        }
        HourMeterReading saved = readingRepository.save(entity);
        List<ReadingAnomaly> anomalies = detectAnomalies(value, previous, recent, now, jumpThreshold);

        if (saved.isFlagged()) {
            log.info("Reading flagged forkliftId={} readingId={} severity={} reason={}",
                    forkliftId, saved.getId(), saved.getFlagSeverity(), saved.getFlagReason());
        } else {
            forklift.setCurrentHours(value);
            forklift.setLastHourReading(value);
            forklift.setLastHourReadingDate(now);
            forklift = forkliftRepository.save(forklift);
            log.debug("Reading applied forkliftId={} readingId={} hours={} advisories={}",
                    forkliftId, saved.getId(), value, anomalies.size());
        }
        return ReadingResult.builder()
                .reading(saved)
                .anomalies(anomalies)
                .forklift(forklift)
                .build();
    }

    /**
     * Full anomaly list for a reading. Backward and jump entries mirror the flag decision;
     * the others are advisory and never flag on their own.
     */
    List<ReadingAnomaly> detectAnomalies(double value, HourMeterReading previous, List<HourMeterReading> history,
                                         LocalDateTime now, double jumpThreshold) {
        List<ReadingAnomaly> anomalies = new ArrayList<>();
        if (previous == null) return anomalies;

        double prev = previous.getReading();
        double delta = value - prev;
        if (delta < 0) {
            anomalies.add(anomaly(ReadingAnomaly.Type.BACKWARD_READING, HourMeterReading.FlagSeverity.ERROR,
                    String.format(Locale.ROOT, "Hour meter went backwards by %.1f hours", Math.abs(delta)), prev, value, delta));
        }
        if (delta > jumpThreshold) {
            anomalies.add(anomaly(ReadingAnomaly.Type.LARGE_JUMP, HourMeterReading.FlagSeverity.WARNING,
                    String.format(Locale.ROOT, "Unusually large increase of %.1f hours", delta), prev, value, delta));
        }

        if (previous.getRecordedAt() != null) {
            double elapsedHours = Duration.between(previous.getRecordedAt(), now).toMillis() / 3_600_000d;
            if (elapsedHours > 0 && delta > elapsedHours * readingProperties.getMaxHoursPerElapsedHour()) {
                anomalies.add(anomaly(ReadingAnomaly.Type.EXCEEDS_POSSIBLE, HourMeterReading.FlagSeverity.WARNING,
                        String.format(Locale.ROOT, "%.1f hours recorded in %.1f hours elapsed time", delta, elapsedHours),
                        prev, value, delta));
            }
        }

        if (history.size() >= readingProperties.getPatternLookback()
                && isRound(value) && history.stream().allMatch(r -> isRound(r.getReading()))) {
            anomalies.add(anomaly(ReadingAnomaly.Type.SUSPICIOUS_PATTERN, HourMeterReading.FlagSeverity.WARNING,
                    "All recent readings are round numbers - possible estimation", prev, value, null));
        }

        int stagnant = readingProperties.getStagnantLookback();
        if (history.size() >= stagnant
                && history.subList(0, stagnant).stream().allMatch(r -> r.getReading() == value)) {
            anomalies.add(anomaly(ReadingAnomaly.Type.STAGNANT_READING, HourMeterReading.FlagSeverity.WARNING,
                    "Hour meter has not changed in multiple readings", prev, value, 0d));
        }
        return anomalies;
    }

    private static boolean isRound(double v) {
        return v % 10 == 0;
    }

    private static ReadingAnomaly anomaly(ReadingAnomaly.Type type, HourMeterReading.FlagSeverity severity, String description,
                                          Double previous, Double value, Double delta) {
        return ReadingAnomaly.builder()
                .type(type).severity(severity).description(description)
                .previousValue(previous).newValue(value).delta(delta)
                .build();
    }

    private Alert raiseAnomalyAlert(Forklift forklift, HourMeterReading reading, List<ReadingAnomaly> anomalies) {
        boolean error = reading.getFlagSeverity() == HourMeterReading.FlagSeverity.ERROR;
        String message = anomalies.isEmpty()
                ? reading.getFlagReason()
                : anomalies.stream().map(ReadingAnomaly::getDescription).collect(Collectors.joining("; "));
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("reading_id", reading.getId());
        context.put("anomalies", anomalies.stream().map(a -> a.getType().code()).collect(Collectors.toList()));
        context.put("previous_reading", reading.getPreviousReading());
        context.put("new_reading", reading.getReading());
        return alertService.createAlert(AlertCreateRequest.builder()
                .forkliftId(forklift.getId())
                .type(AlertType.HOUR_ANOMALY)
                .severity(error ? AlertSeverity.HIGH : AlertSeverity.MEDIUM)
                .title("Hour Meter Anomaly: " + forklift.getId())
                .message(message)
                .contextData(context)
                .actualValue(reading.getReading())
                .thresholdValue(reading.getPreviousReading())
                .recurrenceKey(anomalyKey(forklift.getId(), reading.getId()))
                .build());
    }

    static String anomalyKey(String forkliftId, Long readingId) {
        return "hour_anomaly_" + forkliftId + "_" + readingId;
    }

    @Override
    public HourMeterReading correctReading(Long readingId, Double correctedValue, String correctedBy, String notes) {
        if (correctedValue == null || correctedValue.isNaN() || correctedValue.isInfinite() || correctedValue < 0) {
            throw new IllegalArgumentException("Invalid corrected value: " + correctedValue);
        }
        HourMeterReading result = tx.execute(status -> {
            HourMeterReading reading = requireReading(readingId);
            if (!reading.isFlagged()) {
                throw new IllegalStateException("Only flagged readings can be corrected");
            }
            if (reading.isCorrected()) {
                throw new IllegalStateException("Reading " + readingId + " has already been corrected");
            }
            LocalDateTime now = LocalDateTime.now(clock);
            reading.setCorrected(true);
            reading.setCorrectedValue(correctedValue);
            reading.setCorrectedBy(correctedBy);
            reading.setCorrectedAt(now);
            reading.setCorrectionNotes(notes);
            reading.setValidated(true);
            reading.setValidatedBy(correctedBy);
            reading.setValidatedAt(now);
            applyHours(reading.getForkliftId(), correctedValue, now);
            log.info("Reading corrected readingId={} forkliftId={} from={} to={} by={}",
                    readingId, reading.getForkliftId(), reading.getReading(), correctedValue, correctedBy);
            return readingRepository.save(reading);
        });
        resolveAnomalyAlert(result, correctedBy, String.format(Locale.ROOT, "Corrected to %s hours", correctedValue));
        return result;
    }

    @Override
    public HourMeterReading validateReading(Long readingId, String validatedBy, String notes) {
        HourMeterReading result = tx.execute(status -> {
            HourMeterReading reading = requireReading(readingId);
            if (!reading.isFlagged()) {
                throw new IllegalStateException("Only flagged readings need validation");
            }
            if (reading.isCorrected() || reading.isValidated()) {
                throw new IllegalStateException("Reading " + readingId + " has already been reviewed");
            }
            LocalDateTime now = LocalDateTime.now(clock);
            reading.setValidated(true);
            reading.setValidatedBy(validatedBy);
            reading.setValidatedAt(now);
            reading.setCorrectionNotes(notes == null ? "Validated as correct" : notes);
            applyHours(reading.getForkliftId(), reading.getReading(), now);
            log.info("Reading validated readingId={} forkliftId={} hours={} by={}",
                    readingId, reading.getForkliftId(), reading.getReading(), validatedBy);
            return readingRepository.save(reading);
        });
        resolveAnomalyAlert(result, validatedBy, notes == null ? "Reading validated as correct" : notes);
        return result;
    }

    private void applyHours(String forkliftId, double hours, LocalDateTime now) {
        Forklift forklift = requireForklift(forkliftId);
        forklift.setCurrentHours(hours);
        forklift.setLastHourReading(hours);
        forklift.setLastHourReadingDate(now);
        forkliftRepository.save(forklift);
    }

    private void resolveAnomalyAlert(HourMeterReading reading, String userId, String notes) {
        alertRepository.findByOpenRecurrenceKey(anomalyKey(reading.getForkliftId(), reading.getId()))
                .ifPresent(alert -> alertService.resolve(alert.getId(), userId, notes));
    }

    @Override
    public List<HourMeterReading> getFlaggedReadings(int limit) {
        return readingRepository.findByFlaggedTrueAndCorrectedFalseAndValidatedFalseOrderByRecordedAtDesc(
                PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public List<HourMeterReading> getHistory(String forkliftId, int limit) {
        requireForklift(forkliftId);
        return readingRepository.findByForkliftIdOrderByRecordedAtDescIdDesc(forkliftId, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public Optional<ReadingTrend> getTrends(String forkliftId, int days) {
        requireForklift(forkliftId);
        LocalDateTime from = LocalDateTime.now(clock).minusDays(days);
        List<HourMeterReading> readings = readingRepository
                .findByForkliftIdAndRecordedAtGreaterThanEqualOrderByRecordedAtAscIdAsc(forkliftId, from);
        if (readings.size() < 2) return Optional.empty();

        HourMeterReading first = readings.get(0);
        HourMeterReading last = readings.get(readings.size() - 1);
        double added = last.getReading() - first.getReading();
        double daily = days > 0 ? added / days : 0;

        return Optional.of(ReadingTrend.builder()
                .forkliftId(forkliftId)
                .periodDays(days)
                .readingsCount(readings.size())
                .firstReading(first.getReading())
                .lastReading(last.getReading())
                .totalHoursAdded(added)
                .averageDailyHours(daily)
                .averageWeeklyHours(daily * 7)
                .projectedAnnualHours(daily * 365)
                .flaggedReadings((int) readings.stream().filter(HourMeterReading::isFlagged).count())
                .readings(readings.stream()
                        .map(r -> new ReadingTrend.Point(r.getRecordedAt(), r.getReading(), r.getReadingDelta(), r.isFlagged()))
                        .collect(Collectors.toList()))
                .build());
    }

    @Override
    public BulkImportResult bulkImport(List<ReadingImportItem> items, HourMeterReading.Source source, String importedBy) {
        BulkImportResult result = new BulkImportResult();
        HourMeterReading.Source effective = source == null ? HourMeterReading.Source.IMPORT : source;
        for (ReadingImportItem item : items) {
            String forkliftId = item == null ? null : item.getForkliftId();
            Double reading = item == null ? null : item.getReading();
            try {
                ReadingResult r = recordReading(forkliftId, reading, effective, importedBy);
                result.setSuccessful(result.getSuccessful() + 1);
                if (r.getReading().isFlagged()) {
                    result.setFlagged(result.getFlagged() + 1);
                }
            } catch (RuntimeException e) {
                result.setFailed(result.getFailed() + 1);
                result.getErrors().add(new BulkImportResult.ItemError(forkliftId, reading, e.getMessage()));
                log.warn("Bulk import item failed forkliftId={} reading={} error={}", forkliftId, reading, e.getMessage());
            }
        }
        log.info("Bulk import done successful={} failed={} flagged={}", result.getSuccessful(), result.getFailed(), result.getFlagged());
        return result;
    }

    @Override
    public double updateJumpThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold <= 0) {
            throw new IllegalArgumentException("Jump threshold must be positive: " + threshold);
        }
        settingsService.set(SettingsService.HOUR_ANOMALY_JUMP_THRESHOLD, Double.toString(threshold));
        return threshold;
    }

    private double jumpThreshold() {
        return settingsService.getDouble(SettingsService.HOUR_ANOMALY_JUMP_THRESHOLD, readingProperties.getJumpThreshold());
    }

    private Forklift requireForklift(String forkliftId) {
        return forkliftRepository.findById(forkliftId).orElseThrow(() -> ResourceNotFoundException.of("Forklift", forkliftId));
    }

    private HourMeterReading requireReading(Long readingId) {
        return readingRepository.findById(readingId).orElseThrow(() -> ResourceNotFoundException.of("Reading", readingId));
    }
}
