package com.sandy.fleet.health.repository;

import com.sandy.fleet.health.entity.HourMeterReading;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface HourMeterReadingRepository extends JpaRepository<HourMeterReading, Long> {
    Optional<HourMeterReading> findTopByForkliftIdOrderByRecordedAtDescIdDesc(String forkliftId);
    List<HourMeterReading> findByForkliftIdOrderByRecordedAtDescIdDesc(String forkliftId, Pageable pageable);
    List<HourMeterReading> findByForkliftIdAndFlaggedFalseAndRecordedAtAfterOrderByRecordedAtAscIdAsc(String forkliftId, LocalDateTime after);
    List<HourMeterReading> findByForkliftIdAndRecordedAtGreaterThanEqualOrderByRecordedAtAscIdAsc(String forkliftId, LocalDateTime from);
    List<HourMeterReading> findByFlaggedTrueAndCorrectedFalseAndValidatedFalseOrderByRecordedAtDesc(Pageable pageable);
}
