package com.sandy.fleet.health.service.notification;

import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.entity.NotificationTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Log-only email channel. No mail transport is configured for the engine.
 */
@Slf4j
@Component
public class EmailNotificationChannel implements NotificationChannel {

    @Override
    public NotificationTask.Channel channel() {
        return NotificationTask.Channel.EMAIL;
    }

    @Override
    public void deliver(Alert alert, NotificationTask task) {
        log.info("[EMAIL] Alert {} ({}): {}", alert.getId(), alert.getSeverity().code(), alert.getTitle());
    }
}
