package com.sandy.fleet.health.service.impl;

import com.sandy.fleet.health.repository.ForkliftRepository;
import com.sandy.fleet.health.repository.MaintenanceRecordRepository;
import com.sandy.fleet.health.service.FailurePatternCatalog;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Default matcher: an indicator counts when its phrase appears within a single
 * maintenance record of the window. Order of occurrence is ignored.
 */
@Service
@ConditionalOnProperty(prefix = "fleet.prediction", name = "pattern-matcher", havingValue = "keyword", matchIfMissing = true)
public class KeywordPresenceFailurePatternMatcher extends AbstractFailurePatternMatcher {

    public KeywordPresenceFailurePatternMatcher(ForkliftRepository forkliftRepository,
                                                MaintenanceRecordRepository maintenanceRepository,
                                                FailurePatternCatalog catalog,
                                                Clock clock,
                                                @Value("${fleet.prediction.pattern-lookback-days:180}") int lookbackDays) {
        super(forkliftRepository, maintenanceRepository, catalog, clock, lookbackDays);
    }

    @Override
    protected List<String> matchedIndicators(List<String> keywords, List<String> recordTexts) {
        return keywords.stream()
                .filter(k -> recordTexts.stream().anyMatch(t -> t.contains(FailurePatternCatalog.phrase(k))))
                .collect(Collectors.toList());
    }
}
