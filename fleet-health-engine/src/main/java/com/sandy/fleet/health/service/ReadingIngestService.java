package com.sandy.fleet.health.service;

import com.sandy.fleet.health.entity.HourMeterReading;
import com.sandy.fleet.health.vo.BulkImportResult;
import com.sandy.fleet.health.vo.ReadingImportItem;
import com.sandy.fleet.health.vo.ReadingResult;
import com.sandy.fleet.health.vo.ReadingTrend;

import java.util.List;
import java.util.Optional;

public interface ReadingIngestService {

    /**
     * Records a reading and classifies it. Only an unflagged reading advances the forklift's hours.
     */
    ReadingResult recordReading(String forkliftId, Double reading, HourMeterReading.Source source, String recordedBy);

    HourMeterReading correctReading(Long readingId, Double correctedValue, String correctedBy, String notes);

    HourMeterReading validateReading(Long readingId, String validatedBy, String notes);

    List<HourMeterReading> getFlaggedReadings(int limit);

    List<HourMeterReading> getHistory(String forkliftId, int limit);

    Optional<ReadingTrend> getTrends(String forkliftId, int days);

    BulkImportResult bulkImport(List<ReadingImportItem> items, HourMeterReading.Source source, String importedBy);

    /** Persists a new default jump threshold in the settings store. */
    double updateJumpThreshold(double threshold);
}
