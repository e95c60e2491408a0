package com.sandy.fleet.health.repository;

import com.sandy.fleet.health.entity.DowntimeEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface DowntimeEventRepository extends JpaRepository<DowntimeEvent, Long> {
    List<DowntimeEvent> findByForkliftIdAndStartTimeGreaterThanEqual(String forkliftId, LocalDateTime from);
}
