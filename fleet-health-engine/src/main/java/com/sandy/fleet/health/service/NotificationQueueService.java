package com.sandy.fleet.health.service;

import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.entity.NotificationTask;
import com.sandy.fleet.health.entity.Webhook;
import com.sandy.fleet.health.repository.NotificationTaskRepository;
import com.sandy.fleet.health.repository.WebhookRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a freshly created alert into outbound {@link NotificationTask}s.
 * Critical / high alerts go to email and sms when the matching flag is on;
 * every active webhook subscribed to the alert type gets a task.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationQueueService {

    private final NotificationTaskRepository taskRepository;
    private final WebhookRepository webhookRepository;
    private final SettingsService settingsService;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<NotificationTask> enqueue(Alert alert) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<NotificationTask> tasks = new ArrayList<>();
        if (alert.getSeverity().isUrgent()) {
            if (settingsService.getBoolean(SettingsService.ALERT_EMAIL_ENABLED, false)) {
                tasks.add(task(alert, NotificationTask.Channel.EMAIL, null, now));
            }
            if (settingsService.getBoolean(SettingsService.ALERT_SMS_ENABLED, false)) {
                tasks.add(task(alert, NotificationTask.Channel.SMS, null, now));
            }
        }
        for (Webhook webhook : webhookRepository.findByActiveTrue()) {
            if (webhook.subscribesTo(alert.getType())) {
                tasks.add(task(alert, NotificationTask.Channel.WEBHOOK, webhook.getId(), now));
            }
        }
        if (tasks.isEmpty()) {
            log.debug("No notifications queued for alert id={}", alert.getId());
            return tasks;
        }
        List<NotificationTask> saved = taskRepository.saveAll(tasks);
        log.info("Queued {} notification(s) for alert id={} severity={}", saved.size(), alert.getId(), alert.getSeverity().code());
        return saved;
    }

    private static NotificationTask task(Alert alert, NotificationTask.Channel channel, Long webhookId, LocalDateTime now) {
        return NotificationTask.builder()
                .alertId(alert.getId())
                .channel(channel)
                .webhookId(webhookId)
                .status(NotificationTask.Status.PENDING)
                .attempts(0)
                .nextAttemptAt(now)
                .createdAt(now)
                .build();
    }
}
