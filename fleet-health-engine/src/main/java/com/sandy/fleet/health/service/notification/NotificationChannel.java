package com.sandy.fleet.health.service.notification;

import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.entity.NotificationTask;
import com.sandy.fleet.health.exception.NotificationDeliveryException;

public interface NotificationChannel {

    NotificationTask.Channel channel();

    /**
     * Deliver one queued notification. Called only by the dispatcher, outside of any
     * alert-creation path.
     */
    void deliver(Alert alert, NotificationTask task) throws NotificationDeliveryException;
}
