package com.sandy.fleet.health.repository;

import com.sandy.fleet.health.entity.AlertAcknowledgment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlertAcknowledgmentRepository extends JpaRepository<AlertAcknowledgment, Long> {
    List<AlertAcknowledgment> findByAlertIdOrderByCreatedAtAscIdAsc(Long alertId);
}
