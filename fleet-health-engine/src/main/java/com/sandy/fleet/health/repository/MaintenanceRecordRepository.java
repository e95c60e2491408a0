package com.sandy.fleet.health.repository;

import com.sandy.fleet.health.entity.MaintenanceRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface MaintenanceRecordRepository extends JpaRepository<MaintenanceRecord, Long> {
    List<MaintenanceRecord> findByForkliftIdAndServiceDateGreaterThanEqualOrderByServiceDateAsc(String forkliftId, LocalDate from);
    List<MaintenanceRecord> findByForkliftIdAndStatusAndServiceDateGreaterThanEqualOrderByServiceDateAscIdAsc(
            String forkliftId, MaintenanceRecord.Status status, LocalDate from);
    Optional<MaintenanceRecord> findTopByForkliftIdAndCategoryAndStatusOrderByServiceDateDescIdDesc(
            String forkliftId, String category, MaintenanceRecord.Status status);
}
