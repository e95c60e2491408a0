package com.sandy.fleet.health.service;

import com.sandy.fleet.health.entity.*;
import com.sandy.fleet.health.repository.*;
import com.sandy.fleet.health.service.notification.WebhookNotificationChannel;
import com.sandy.fleet.health.vo.AlertCreateRequest;
import com.sandy.fleet.health.vo.WebhookRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpMethod;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@SpringBootTest
@ActiveProfiles("test")
class NotificationDispatcherTest {

    private static final String HOOK_URL = "https://hooks.example.com/fleet";

    @Autowired NotificationDispatcher notificationDispatcher;
    @Autowired AlertService alertService;
    @Autowired SettingsService settingsService;
    @Autowired RestTemplate webhookRestTemplate;
    @Autowired AlertRepository alertRepository;
    @Autowired AlertAcknowledgmentRepository acknowledgmentRepository;
    @Autowired NotificationTaskRepository taskRepository;
    @Autowired WebhookRepository webhookRepository;
    @Autowired SystemSettingRepository settingRepository;

    MockRestServiceServer server;

    @BeforeEach
    void init() {
        taskRepository.deleteAll();
        acknowledgmentRepository.deleteAll();
        alertRepository.deleteAll();
        webhookRepository.deleteAll();
        settingRepository.deleteAll();
        server = MockRestServiceServer.bindTo(webhookRestTemplate).build();
    }

    private Webhook hook(String... events) {
        return alertService.createWebhook(WebhookRequest.builder()
                .name("ops")
                .url(HOOK_URL)
                .secret("s3cr3t")
                .events(Set.of(events))
                .build());
    }

    private Alert alert(String forkliftId, AlertSeverity severity) {
        return alertService.createAlert(AlertCreateRequest.builder()
                .forkliftId(forkliftId)
                .type(AlertType.HIGH_RISK)
                .severity(severity)
                .title("High Risk Unit: " + forkliftId)
                .build());
    }

    private NotificationTask onlyTask() {
        List<NotificationTask> tasks = taskRepository.findAll();
        assertEquals(1, tasks.size());
        return tasks.get(0);
    }

    @Test
    void webhookDeliverySignsPayloadAndMarksAlert() {
        Webhook webhook = hook("high_risk");
        Alert alert = alert("ND-1", AlertSeverity.HIGH);
        server.expect(requestTo(HOOK_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(WebhookNotificationChannel.EVENT_HEADER, "high_risk"))
                .andExpect(header(WebhookNotificationChannel.SIGNATURE_HEADER, startsWith("sha256=")))
                .andExpect(jsonPath("$.alert.forkliftId").value("ND-1"))
                .andRespond(withSuccess());

        assertEquals(1, notificationDispatcher.dispatchDue());

        server.verify();
        assertEquals(NotificationTask.Status.SENT, onlyTask().getStatus());
        Alert sent = alertRepository.findById(alert.getId()).orElseThrow();
        assertTrue(sent.isWebhookSent());
        assertNotNull(sent.getWebhookSentAt());
        Webhook after = webhookRepository.findById(webhook.getId()).orElseThrow();
        assertEquals(200, after.getLastStatusCode());
        assertEquals(0, after.getConsecutiveFailures());
        assertEquals(0, notificationDispatcher.dispatchDue());
    }

    @Test
    void serverErrorSchedulesRetry() {
        Webhook webhook = hook("all");
        alert("ND-2", AlertSeverity.MEDIUM);
        server.expect(requestTo(HOOK_URL)).andRespond(withServerError());

        assertEquals(0, notificationDispatcher.dispatchDue());

        NotificationTask task = onlyTask();
        assertEquals(NotificationTask.Status.PENDING, task.getStatus());
        assertEquals(1, task.getAttempts());
        assertTrue(task.getNextAttemptAt().isAfter(LocalDateTime.now().plusSeconds(20)));
        assertTrue(task.getLastError().contains("responded 500"));
        Webhook after = webhookRepository.findById(webhook.getId()).orElseThrow();
        assertEquals(500, after.getLastStatusCode());
        assertEquals(1, after.getConsecutiveFailures());
        assertFalse(alertRepository.findAll().get(0).isWebhookSent());
    }

    @Test
    void lastAttemptFailsPermanently() {
        hook("high_risk");
        alert("ND-3", AlertSeverity.LOW);
        NotificationTask task = onlyTask();
        task.setAttempts(4);
        taskRepository.save(task);
        server.expect(requestTo(HOOK_URL)).andRespond(withServerError());

        notificationDispatcher.dispatchDue();

        NotificationTask failed = onlyTask();
        assertEquals(NotificationTask.Status.FAILED, failed.getStatus());
        assertEquals(5, failed.getAttempts());
        assertNotNull(failed.getCompletedAt());
    }

    @Test
    void removedWebhookIsNotRetried() {
        Webhook webhook = hook("high_risk");
        alert("ND-4", AlertSeverity.HIGH);
        alertService.deleteWebhook(webhook.getId());

        assertEquals(0, notificationDispatcher.dispatchDue());

        NotificationTask task = onlyTask();
        assertEquals(NotificationTask.Status.FAILED, task.getStatus());
        assertEquals(1, task.getAttempts());
        assertTrue(task.getLastError().contains("missing or inactive"));
        server.verify();
    }

    @Test
    void unsubscribedTypesQueueNothing() {
        hook("downtime");
        alert("ND-5", AlertSeverity.CRITICAL);
        assertEquals(0, taskRepository.count());
    }

    @Test
    void urgentAlertsGoToEnabledEmailAndSms() {
        settingsService.set(SettingsService.ALERT_EMAIL_ENABLED, "true");
        settingsService.set(SettingsService.ALERT_SMS_ENABLED, "TRUE");

        alert("ND-6", AlertSeverity.MEDIUM);
        assertEquals(0, taskRepository.count());

        Alert urgent = alert("ND-7", AlertSeverity.CRITICAL);
        assertEquals(2, taskRepository.count());
        assertEquals(2, notificationDispatcher.dispatchDue());

        Alert sent = alertRepository.findById(urgent.getId()).orElseThrow();
        assertTrue(sent.isEmailSent());
        assertTrue(sent.isSmsSent());
        assertFalse(sent.isWebhookSent());
    }

    @Test
    void backoffDoublesUpToCap() {
        assertEquals(30_000, notificationDispatcher.backoffMs(1));
        assertEquals(60_000, notificationDispatcher.backoffMs(2));
        assertEquals(120_000, notificationDispatcher.backoffMs(3));
        assertEquals(3_600_000, notificationDispatcher.backoffMs(20));
    }
}
