package com.sandy.fleet.health.service.impl;

import com.sandy.fleet.health.entity.MaintenanceRecord;
import com.sandy.fleet.health.exception.ResourceNotFoundException;
import com.sandy.fleet.health.repository.ForkliftRepository;
import com.sandy.fleet.health.repository.MaintenanceRecordRepository;
import com.sandy.fleet.health.service.FailurePatternCatalog;
import com.sandy.fleet.health.service.FailurePatternMatcher;
import com.sandy.fleet.health.vo.FailurePatternDefinition;
import com.sandy.fleet.health.vo.FailurePatternMatch;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads the completed maintenance window and scores each catalog pattern.
 * Subclasses decide which indicators of a pattern count as matched.
 */
@Slf4j
abstract class AbstractFailurePatternMatcher implements FailurePatternMatcher {

    static final int MIN_RECORDS = 2;

    private final ForkliftRepository forkliftRepository;
    private final MaintenanceRecordRepository maintenanceRepository;
    private final FailurePatternCatalog catalog;
    private final Clock clock;
    private final int defaultLookbackDays;

    protected AbstractFailurePatternMatcher(ForkliftRepository forkliftRepository,
                                            MaintenanceRecordRepository maintenanceRepository,
                                            FailurePatternCatalog catalog,
                                            Clock clock,
                                            int defaultLookbackDays) {
        this.forkliftRepository = forkliftRepository;
        this.maintenanceRepository = maintenanceRepository;
        this.catalog = catalog;
        this.clock = clock;
        this.defaultLookbackDays = defaultLookbackDays;
    }

    @Override
    public List<FailurePatternMatch> detect(String forkliftId) {
        return detect(forkliftId, defaultLookbackDays);
    }

    @Override
    public List<FailurePatternMatch> detect(String forkliftId, int lookbackDays) {
        if (!forkliftRepository.existsById(forkliftId)) {
            throw ResourceNotFoundException.of("Forklift", forkliftId);
        }
        LocalDate from = LocalDate.now(clock).minusDays(lookbackDays);
        List<MaintenanceRecord> records = maintenanceRepository
                .findByForkliftIdAndStatusAndServiceDateGreaterThanEqualOrderByServiceDateAscIdAsc(
                        forkliftId, MaintenanceRecord.Status.COMPLETED, from);
        if (records.size() < MIN_RECORDS) {
            return List.of();
        }
        List<String> texts = records.stream().map(AbstractFailurePatternMatcher::recordText).collect(Collectors.toList());

        List<FailurePatternMatch> matches = new ArrayList<>();
        for (FailurePatternDefinition pattern : catalog.patterns()) {
            List<String> matched = matchedIndicators(pattern.getKeywords(), texts);
            int total = pattern.getKeywords().size();
            if (total == 0 || matched.size() < FailurePatternCatalog.requiredMatches(total)) continue;

            int confidence = (int) Math.round(pattern.getBaseConfidence() * matched.size() / total * 100);
            matches.add(FailurePatternMatch.builder()
                    .patternName(pattern.getName())
                    .prediction(pattern.getPrediction())
                    .confidence(confidence)
                    .urgency(pattern.getUrgency())
                    .matchedIndicators(matched)
                    .totalIndicators(total)
                    .recommendedAction("Schedule inspection within " + pattern.getLookaheadDays() + " days")
                    .estimatedDaysToFailure(pattern.getLookaheadDays())
                    .build());
        }
        if (!matches.isEmpty()) {
            log.info("Failure patterns detected forkliftId={} records={} patterns={}", forkliftId, records.size(),
                    matches.stream().map(FailurePatternMatch::getPatternName).collect(Collectors.toList()));
        }
        return matches;
    }

    /**
     * @param keywords pattern indicators in their catalog order
     * @param recordTexts lowercase text per record, oldest first
     * @return the indicators that count as present
     */
    protected abstract List<String> matchedIndicators(List<String> keywords, List<String> recordTexts);

    static String recordText(MaintenanceRecord r) {
        return Stream.of(r.getDescription(), r.getWorkPerformed(), r.getCategory())
                .map(s -> s == null ? "" : s)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);
    }
}
