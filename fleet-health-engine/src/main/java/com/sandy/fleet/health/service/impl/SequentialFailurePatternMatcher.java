package com.sandy.fleet.health.service.impl;

import com.sandy.fleet.health.repository.ForkliftRepository;
import com.sandy.fleet.health.repository.MaintenanceRecordRepository;
import com.sandy.fleet.health.service.FailurePatternCatalog;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Time-ordered matcher. Indicators are walked in catalog order and each one must
 * show up in the same record as the previous match or a later one. An indicator
 * that is missing is skipped without moving the cursor.
 */
@Service
@ConditionalOnProperty(prefix = "fleet.prediction", name = "pattern-matcher", havingValue = "sequential")
public class SequentialFailurePatternMatcher extends AbstractFailurePatternMatcher {

    public SequentialFailurePatternMatcher(ForkliftRepository forkliftRepository,
                                           MaintenanceRecordRepository maintenanceRepository,
                                           FailurePatternCatalog catalog,
                                           Clock clock,
                                           @Value("${fleet.prediction.pattern-lookback-days:180}") int lookbackDays) {
        super(forkliftRepository, maintenanceRepository, catalog, clock, lookbackDays);
    }

    @Override
    protected List<String> matchedIndicators(List<String> keywords, List<String> recordTexts) {
        List<String> matched = new ArrayList<>();
        int cursor = 0;
        for (String keyword : keywords) {
            String phrase = FailurePatternCatalog.phrase(keyword);
            for (int i = cursor; i < recordTexts.size(); i++) {
                if (recordTexts.get(i).contains(phrase)) {
                    matched.add(keyword);
                    cursor = i;
                    break;
                }
            }
        }
        return matched;
    }
}
