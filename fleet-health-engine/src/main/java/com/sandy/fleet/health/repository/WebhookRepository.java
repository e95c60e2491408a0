package com.sandy.fleet.health.repository;

import com.sandy.fleet.health.entity.Webhook;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface WebhookRepository extends JpaRepository<Webhook, Long> {
    List<Webhook> findByActiveTrue();
    List<Webhook> findAllByOrderByNameAsc();

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Webhook w set w.lastTriggeredAt = :at, w.lastStatusCode = :status, w.consecutiveFailures = 0 where w.id = :id")
    int recordSuccess(@Param("id") Long id, @Param("status") Integer status, @Param("at") LocalDateTime at);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Webhook w set w.lastTriggeredAt = :at, w.lastStatusCode = :status, "
            + "w.consecutiveFailures = w.consecutiveFailures + 1 where w.id = :id")
    int recordFailure(@Param("id") Long id, @Param("status") Integer status, @Param("at") LocalDateTime at);
}
