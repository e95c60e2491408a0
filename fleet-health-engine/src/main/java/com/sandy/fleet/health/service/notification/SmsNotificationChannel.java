package com.sandy.fleet.health.service.notification;

import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.entity.NotificationTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Log-only SMS channel.
 */
@Slf4j
@Component
public class SmsNotificationChannel implements NotificationChannel {

    @Override
    public NotificationTask.Channel channel() {
        return NotificationTask.Channel.SMS;
    }

    @Override
    public void deliver(Alert alert, NotificationTask task) {
        log.info("[SMS] Alert {} ({}): {}", alert.getId(), alert.getSeverity().code(), alert.getTitle());
    }
}
