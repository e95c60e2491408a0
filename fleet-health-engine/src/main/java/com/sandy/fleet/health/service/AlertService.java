package com.sandy.fleet.health.service;

import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.entity.AlertAcknowledgment;
import com.sandy.fleet.health.entity.Webhook;
import com.sandy.fleet.health.vo.AlertCreateRequest;
import com.sandy.fleet.health.vo.AlertDashboard;
import com.sandy.fleet.health.vo.AlertStats;
import com.sandy.fleet.health.vo.BatchActionResult;
import com.sandy.fleet.health.vo.WebhookRequest;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Alert creation (deduplicated), lifecycle transitions and listings.
 */
public interface AlertService {

    /**
     * Creates an alert, or returns the open alert that already holds the same dedup key.
     * Notification delivery is queued and never fails this call.
     */
    Alert createAlert(AlertCreateRequest request);

    Alert createCustomAlert(AlertCreateRequest request);

    Alert getAlert(Long id);

    Alert acknowledge(Long id, String userId);

    Alert resolve(Long id, String userId, String notes);

    Alert snooze(Long id, String userId, LocalDateTime until);

    Alert dismiss(Long id, String userId);

    /** @return number of snoozed alerts put back to active */
    int reactivateSnoozedAlerts();

    BatchActionResult bulkAcknowledge(List<Long> ids, String userId);

    BatchActionResult bulkResolve(List<Long> ids, String userId, String notes);

    List<Alert> getActiveAlerts(int limit);

    List<Alert> getForkliftAlerts(String forkliftId, int limit);

    List<AlertAcknowledgment> getAlertHistory(Long alertId);

    AlertStats getAlertStats();

    AlertDashboard getDashboardSummary();

    Webhook createWebhook(WebhookRequest request);

    List<Webhook> getWebhooks();

    Webhook updateWebhook(Long id, WebhookRequest request);

    boolean deleteWebhook(Long id);
}
