package com.sandy.fleet.health.repository;

import com.sandy.fleet.health.entity.Alert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface AlertRepository extends JpaRepository<Alert, Long> {
    Optional<Alert> findByOpenRecurrenceKey(String openRecurrenceKey);
    List<Alert> findByActiveTrueAndResolvedFalseAndDismissedFalse();
    List<Alert> findByResolvedFalseAndDismissedFalse();
    List<Alert> findByForkliftId(String forkliftId);
    List<Alert> findByActiveFalseAndResolvedFalseAndDismissedFalseAndSnoozeUntilLessThanEqual(LocalDateTime now);
    List<Alert> findByCreatedAtGreaterThanEqualOrderByCreatedAtAsc(LocalDateTime from);

    // delivery flags are set in place so a concurrent lifecycle change is not overwritten
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Alert a set a.emailSent = true, a.emailSentAt = :at where a.id = :id")
    int markEmailSent(@Param("id") Long id, @Param("at") LocalDateTime at);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Alert a set a.smsSent = true, a.smsSentAt = :at where a.id = :id")
    int markSmsSent(@Param("id") Long id, @Param("at") LocalDateTime at);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Alert a set a.webhookSent = true, a.webhookSentAt = :at where a.id = :id")
    int markWebhookSent(@Param("id") Long id, @Param("at") LocalDateTime at);
}
