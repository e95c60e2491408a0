package com.sandy.fleet.health.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.entity.NotificationTask;
import com.sandy.fleet.health.entity.Webhook;
import com.sandy.fleet.health.exception.NotificationDeliveryException;
import com.sandy.fleet.health.repository.WebhookRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POSTs the alert as JSON to the subscribed webhook. When the webhook has a secret the
 * body is signed with HMAC-SHA256 in {@value #SIGNATURE_HEADER}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookNotificationChannel implements NotificationChannel {

    public static final String SIGNATURE_HEADER = "X-Fleet-Signature";
    public static final String EVENT_HEADER = "X-Fleet-Event";

    private final WebhookRepository webhookRepository;
    private final RestTemplate webhookRestTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public NotificationTask.Channel channel() {
        return NotificationTask.Channel.WEBHOOK;
    }

    @Override
    public void deliver(Alert alert, NotificationTask task) throws NotificationDeliveryException {
        Webhook webhook = task.getWebhookId() == null ? null : webhookRepository.findById(task.getWebhookId()).orElse(null);
        if (webhook == null || !webhook.isActive()) {
            throw new NotificationDeliveryException("Webhook " + task.getWebhookId() + " missing or inactive", false);
        }

        String body = toPayload(alert);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(EVENT_HEADER, alert.getType().code());
        if (webhook.getSecret() != null && !webhook.getSecret().isBlank()) {
            headers.set(SIGNATURE_HEADER, "sha256=" + sign(webhook.getSecret(), body));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        try {
            ResponseEntity<String> resp = webhookRestTemplate.exchange(webhook.getUrl(), HttpMethod.POST,
                    new HttpEntity<>(body, headers), String.class);
            webhookRepository.recordSuccess(webhook.getId(), resp.getStatusCode().value(), now);
            log.info("[WEBHOOK] {} delivered alert {} status={}", webhook.getName(), alert.getId(), resp.getStatusCode().value());
        } catch (RestClientResponseException e) {
            webhookRepository.recordFailure(webhook.getId(), e.getStatusCode().value(), now);
            throw new NotificationDeliveryException("Webhook " + webhook.getName() + " responded " + e.getStatusCode().value(),
                    e.getStatusCode().value(), true, e);
        } catch (ResourceAccessException e) {
            webhookRepository.recordFailure(webhook.getId(), null, now);
            throw new NotificationDeliveryException("Webhook " + webhook.getName() + " unreachable: " + e.getMessage(), null, true, e);
        } catch (RestClientException e) {
            webhookRepository.recordFailure(webhook.getId(), null, now);
            throw new NotificationDeliveryException("Webhook " + webhook.getName() + " failed: " + e.getMessage(), null, true, e);
        }
    }

    String toPayload(Alert alert) throws NotificationDeliveryException {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("id", alert.getId());
        a.put("forkliftId", alert.getForkliftId());
        a.put("type", alert.getType().code());
        a.put("severity", alert.getSeverity().code());
        a.put("title", alert.getTitle());
        a.put("message", alert.getMessage());
        a.put("contextData", alert.getContextData());
        a.put("createdAt", alert.getCreatedAt() == null ? null : alert.getCreatedAt().toString());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", alert.getType().code());
        payload.put("alert", a);
        payload.put("timestamp", LocalDateTime.now(clock).toString());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new NotificationDeliveryException("Cannot serialize alert " + alert.getId(), null, false, e);
        }
    }

    static String sign(String secret, String body) throws NotificationDeliveryException {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new NotificationDeliveryException("Cannot sign webhook payload", null, false, e);
        }
    }
}
