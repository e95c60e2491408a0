package com.sandy.fleet.health.service;

import com.sandy.fleet.health.config.AlertProperties;
import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.entity.NotificationTask;
import com.sandy.fleet.health.exception.NotificationDeliveryException;
import com.sandy.fleet.health.repository.AlertRepository;
import com.sandy.fleet.health.repository.NotificationTaskRepository;
import com.sandy.fleet.health.service.notification.NotificationChannel;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Drains pending notification tasks. Failures are retried with exponential backoff
 * until {@code fleet.alert.delivery.max-attempts}, then the task is marked failed.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    private final NotificationTaskRepository taskRepository;
    private final AlertRepository alertRepository;
    private final AlertProperties alertProperties;
    private final Clock clock;
    private final Map<NotificationTask.Channel, NotificationChannel> channels = new EnumMap<>(NotificationTask.Channel.class);

    public NotificationDispatcher(NotificationTaskRepository taskRepository,
                                  AlertRepository alertRepository,
                                  AlertProperties alertProperties,
                                  Clock clock,
                                  List<NotificationChannel> channelBeans) {
        this.taskRepository = taskRepository;
        this.alertRepository = alertRepository;
        this.alertProperties = alertProperties;
        this.clock = clock;
        channelBeans.forEach(c -> channels.put(c.channel(), c));
    }

    @PostConstruct
    public void init() {
        AlertProperties.Delivery d = alertProperties.getDelivery();
        log.info("Notification dispatcher initialized: enabled={} channels={} maxAttempts={} initialBackoffMs={}",
                d.isEnabled(), channels.keySet(), d.getMaxAttempts(), d.getInitialBackoffMs());
    }

    @Scheduled(fixedDelayString = "${fleet.alert.dispatch-interval-ms:15000}",
            initialDelayString = "${fleet.alert.dispatch-initial-delay-ms:15000}")
    public void scheduledDispatch() {
        if (!alertProperties.getDelivery().isEnabled()) return;
        try {
            dispatchDue();
        } catch (Exception e) {
            log.error("Scheduled notification dispatch failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Public entry point for tests / manual trigger.
     * @return number of tasks delivered in this pass
     */
    public int dispatchDue() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<NotificationTask> due = taskRepository.findByStatusAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(
                NotificationTask.Status.PENDING, now, PageRequest.of(0, Math.max(1, alertProperties.getDispatchBatchSize())));
        int sent = 0;
        for (NotificationTask task : due) {
            if (dispatch(task)) sent++;
        }
        if (!due.isEmpty()) {
            log.debug("Notification dispatch pass done due={} sent={}", due.size(), sent);
        }
        return sent;
    }

    boolean dispatch(NotificationTask task) {
        LocalDateTime now = LocalDateTime.now(clock);
        Alert alert = alertRepository.findById(task.getAlertId()).orElse(null);
        NotificationChannel channel = channels.get(task.getChannel());
        task.setAttempts(task.getAttempts() + 1);
        try {
            if (alert == null) {
                throw new NotificationDeliveryException("Alert " + task.getAlertId() + " no longer exists", false);
            }
            if (channel == null) {
                throw new NotificationDeliveryException("No channel registered for " + task.getChannel(), false);
            }
            channel.deliver(alert, task);
            markAlertSent(task, now);
            task.setStatus(NotificationTask.Status.SENT);
            task.setCompletedAt(now);
            task.setLastError(null);
            taskRepository.save(task);
            return true;
        } catch (NotificationDeliveryException e) {
            onFailure(task, e.getMessage(), e.isRetryable(), now);
        } catch (RuntimeException e) {
            onFailure(task, e.getClass().getSimpleName() + ": " + e.getMessage(), true, now);
        }
        return false;
    }

    private void markAlertSent(NotificationTask task, LocalDateTime now) {
        switch (task.getChannel()) {
            case EMAIL -> alertRepository.markEmailSent(task.getAlertId(), now);
            case SMS -> alertRepository.markSmsSent(task.getAlertId(), now);
            case WEBHOOK -> alertRepository.markWebhookSent(task.getAlertId(), now);
        }
    }

    private void onFailure(NotificationTask task, String error, boolean retryable, LocalDateTime now) {
        int max = Math.max(1, alertProperties.getDelivery().getMaxAttempts());
        task.setLastError(truncate(error));
        if (!retryable || task.getAttempts() >= max) {
            task.setStatus(NotificationTask.Status.FAILED);
            task.setCompletedAt(now);
            log.warn("Notification task id={} alertId={} channel={} failed permanently after {} attempt(s): {}",
                    task.getId(), task.getAlertId(), task.getChannel(), task.getAttempts(), error);
        } else {
            long delay = backoffMs(task.getAttempts());
            task.setNextAttemptAt(now.plusNanos(delay * 1_000_000L));
            log.warn("Notification task id={} alertId={} channel={} attempt {} failed, retry in {}ms: {}",
                    task.getId(), task.getAlertId(), task.getChannel(), task.getAttempts(), delay, error);
        }
        taskRepository.save(task);
    }

    /** initial * 2^(attempts-1), capped. */
    long backoffMs(int attempts) {
        AlertProperties.Delivery d = alertProperties.getDelivery();
        long delay = d.getInitialBackoffMs();
        for (int i = 1; i < attempts && delay < d.getMaxBackoffMs(); i++) {
            delay *= 2;
        }
        return Math.min(delay, d.getMaxBackoffMs());
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > 500 ? s.substring(0, 500) : s;
    }
}
