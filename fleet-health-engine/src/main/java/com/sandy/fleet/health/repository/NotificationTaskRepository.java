package com.sandy.fleet.health.repository;

import com.sandy.fleet.health.entity.NotificationTask;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface NotificationTaskRepository extends JpaRepository<NotificationTask, Long> {
    List<NotificationTask> findByStatusAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(
            NotificationTask.Status status, LocalDateTime now, Pageable pageable);
    List<NotificationTask> findByAlertId(Long alertId);
}
