package com.sandy.fleet.health.service.impl;

import com.sandy.fleet.health.config.AlertProperties;
import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.entity.AlertAcknowledgment;
import com.sandy.fleet.health.entity.AlertSeverity;
import com.sandy.fleet.health.entity.AlertType;
import com.sandy.fleet.health.entity.Webhook;
import com.sandy.fleet.health.exception.ResourceNotFoundException;
import com.sandy.fleet.health.repository.AlertAcknowledgmentRepository;
import com.sandy.fleet.health.repository.AlertRepository;
import com.sandy.fleet.health.repository.WebhookRepository;
import com.sandy.fleet.health.service.AlertService;
import com.sandy.fleet.health.service.NotificationQueueService;
import com.sandy.fleet.health.vo.AlertCreateRequest;
import com.sandy.fleet.health.vo.AlertDashboard;
import com.sandy.fleet.health.vo.AlertStats;
import com.sandy.fleet.health.vo.BatchActionResult;
import com.sandy.fleet.health.vo.WebhookRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class AlertServiceImpl implements AlertService {

    /** Listing order: severity (critical first), then newest first. */
    static final Comparator<Alert> LISTING_ORDER = Comparator
            .comparingInt((Alert a) -> a.getSeverity().rank())
            .thenComparing(Alert::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final AlertRepository alertRepository;
    private final AlertAcknowledgmentRepository acknowledgmentRepository;
    private final WebhookRepository webhookRepository;
    private final NotificationQueueService notificationQueueService;
    private final AlertProperties alertProperties;
    private final Clock clock;
    private final TransactionTemplate tx;
    /** Inserts run in their own transaction so a unique-key race never poisons the caller's. */
    private final TransactionTemplate insertTx;

    public AlertServiceImpl(AlertRepository alertRepository,
                            AlertAcknowledgmentRepository acknowledgmentRepository,
                            WebhookRepository webhookRepository,
                            NotificationQueueService notificationQueueService,
                            AlertProperties alertProperties,
                            Clock clock,
                            PlatformTransactionManager transactionManager) {
        this.alertRepository = alertRepository;
        this.acknowledgmentRepository = acknowledgmentRepository;
        this.webhookRepository = webhookRepository;
        this.notificationQueueService = notificationQueueService;
        this.alertProperties = alertProperties;
        this.clock = clock;
        this.tx = new TransactionTemplate(transactionManager);
        this.insertTx = new TransactionTemplate(transactionManager);
        this.insertTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public Alert createAlert(AlertCreateRequest request) {
        validate(request);
        String key = request.dedupKey();
        if (key != null) {
            Optional<Alert> open = alertRepository.findByOpenRecurrenceKey(key);
            if (open.isPresent()) {
                log.info("Duplicate alert suppressed key={} existingId={}", key, open.get().getId());
                return open.get();
            }
        }

        Alert created;
        try {
            created = insertTx.execute(status -> alertRepository.saveAndFlush(toEntity(request, key)));
        } catch (DataIntegrityViolationException e) {
            // lost the race: another caller inserted the open alert for this key first
            Alert winner = key == null ? null : alertRepository.findByOpenRecurrenceKey(key).orElse(null);
            if (winner == null) throw e;
            log.info("Concurrent duplicate alert resolved to existing key={} existingId={}", key, winner.getId());
            return winner;
        }
        log.info("Created alert id={} type={} severity={} forkliftId={} key={}",
                created.getId(), created.getType().code(), created.getSeverity().code(), created.getForkliftId(), key);

        try {
            notificationQueueService.enqueue(created);
        } catch (RuntimeException e) {
            log.warn("Failed to queue notifications for alert id={}: {}", created.getId(), e.getMessage(), e);
        }
        return created;
    }

    @Override
    public Alert createCustomAlert(AlertCreateRequest request) {
        request.setType(AlertType.CUSTOM);
        return createAlert(request);
    }

    private void validate(AlertCreateRequest request) {
        if (request == null || request.getType() == null) {
            throw new IllegalArgumentException("Alert type is required");
        }
        if (request.getTitle() == null || request.getTitle().isBlank()) {
            throw new IllegalArgumentException("Alert title is required");
        }
    }

    private Alert toEntity(AlertCreateRequest r, String key) {
        return Alert.builder()
                .forkliftId(r.getForkliftId())
                .type(r.getType())
                .severity(r.getSeverity() == null ? AlertSeverity.MEDIUM : r.getSeverity())
                .title(r.getTitle())
                .message(r.getMessage())
                .contextData(r.getContextData())
                .thresholdValue(r.getThresholdValue())
                .actualValue(r.getActualValue())
                .recurrenceKey(key)
                .openRecurrenceKey(key)
                .createdAt(LocalDateTime.now(clock))
                .active(true)
                .build();
    }

    @Override
    public Alert getAlert(Long id) {
        if (id == null) {
            throw new IllegalArgumentException("Alert id is required");
        }
        return alertRepository.findById(id).orElseThrow(() -> ResourceNotFoundException.of("Alert", id));
    }

    @Override
    public Alert acknowledge(Long id, String userId) {
        return tx.execute(status -> {
            Alert alert = requireOpen(id, "acknowledge");
            if (alert.isAcknowledged() && alert.isActive()) {
                log.debug("Alert id={} already acknowledged", id);
                return alert;
            }
            LocalDateTime now = LocalDateTime.now(clock);
            alert.setAcknowledged(true);
            alert.setAcknowledgedBy(userId);
            alert.setAcknowledgedAt(now);
            alert.setActive(true);
            alert.setSnoozeUntil(null);
            record(alert, userId, AlertAcknowledgment.Action.ACKNOWLEDGED, null, null);
            log.info("Alert acknowledged id={} by={}", id, userId);
            return alertRepository.save(alert);
        });
    }

    @Override
    public Alert resolve(Long id, String userId, String notes) {
        return tx.execute(status -> {
            Alert alert = requireOpen(id, "resolve");
            alert.setResolved(true);
            alert.setResolvedBy(userId);
            alert.setResolvedAt(LocalDateTime.now(clock));
            alert.setResolutionNotes(notes);
            alert.setActive(false);
            alert.setSnoozeUntil(null);
            alert.setOpenRecurrenceKey(null);
            record(alert, userId, AlertAcknowledgment.Action.RESOLVED, notes, null);
            log.info("Alert resolved id={} by={} key={}", id, userId, alert.getRecurrenceKey());
            return alertRepository.save(alert);
        });
    }

    @Override
    public Alert snooze(Long id, String userId, LocalDateTime until) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (until == null || !until.isAfter(now)) {
            throw new IllegalArgumentException("Snooze time must be in the future: " + until);
        }
        return tx.execute(status -> {
            Alert alert = requireOpen(id, "snooze");
            alert.setActive(false);
            alert.setSnoozeUntil(until);
            record(alert, userId, AlertAcknowledgment.Action.SNOOZED, null, until);
            log.info("Alert snoozed id={} by={} until={}", id, userId, until);
            return alertRepository.save(alert);
        });
    }

    @Override
    public Alert dismiss(Long id, String userId) {
        return tx.execute(status -> {
            Alert alert = requireOpen(id, "dismiss");
            alert.setDismissed(true);
            alert.setDismissedAt(LocalDateTime.now(clock));
            alert.setActive(false);
            alert.setSnoozeUntil(null);
            alert.setOpenRecurrenceKey(null);
            record(alert, userId, AlertAcknowledgment.Action.DISMISSED, null, null);
            log.info("Alert dismissed id={} by={}", id, userId);
            return alertRepository.save(alert);
        });
    }

    @Scheduled(fixedDelayString = "${fleet.alert.snooze-check-interval-ms:60000}",
            initialDelayString = "${fleet.alert.snooze-check-initial-delay-ms:30000}")
    public void scheduledReactivation() {
        try {
            reactivateSnoozedAlerts();
        } catch (Exception e) {
            log.error("Scheduled snooze reactivation failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public int reactivateSnoozedAlerts() {
        Integer count = tx.execute(status -> {
            LocalDateTime now = LocalDateTime.now(clock);
            List<Alert> due = alertRepository.findByActiveFalseAndResolvedFalseAndDismissedFalseAndSnoozeUntilLessThanEqual(now);
            for (Alert alert : due) {
                alert.setActive(true);
                alert.setSnoozeUntil(null);
                record(alert, null, AlertAcknowledgment.Action.REACTIVATED, null, null);
            }
            alertRepository.saveAll(due);
            return due.size();
        });
        int n = count == null ? 0 : count;
        if (n > 0) log.info("Reactivated {} snoozed alerts", n);
        return n;
    }

    private Alert requireOpen(Long id, String action) {
        Alert alert = getAlert(id);
        if (alert.isTerminal()) {
            throw new IllegalStateException("Cannot " + action + " alert " + id + " in state " + alert.getStatus());
        }
        return alert;
    }

    private void record(Alert alert, String userId, AlertAcknowledgment.Action action, String notes, LocalDateTime snoozeUntil) {
        acknowledgmentRepository.save(AlertAcknowledgment.builder()
                .alertId(alert.getId())
                .userId(userId)
                .action(action)
                .notes(notes)
                .snoozeUntil(snoozeUntil)
                .createdAt(LocalDateTime.now(clock))
                .build());
    }

    @Override
    public BatchActionResult bulkAcknowledge(List<Long> ids, String userId) {
        return bulk(ids, id -> acknowledge(id, userId));
    }

    @Override
    public BatchActionResult bulkResolve(List<Long> ids, String userId, String notes) {
        return bulk(ids, id -> resolve(id, userId, notes));
    }

    private BatchActionResult bulk(List<Long> ids, Function<Long, Alert> action) {
        BatchActionResult result = new BatchActionResult();
        if (ids == null) return result;
        for (Long id : ids) {
            try {
                action.apply(id);
                result.addSuccess(id);
            } catch (RuntimeException e) {
                log.warn("Bulk alert action failed id={} error={}", id, e.getMessage());
                result.addFailure(id, e.getMessage());
            }
        }
        log.info("Bulk alert action done success={} failed={}", result.getSuccessCount(), result.getFailedCount());
        return result;
    }

    @Override
    public List<Alert> getActiveAlerts(int limit) {
        return alertRepository.findByActiveTrueAndResolvedFalseAndDismissedFalse().stream()
                .sorted(LISTING_ORDER)
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    @Override
    public List<Alert> getForkliftAlerts(String forkliftId, int limit) {
        return alertRepository.findByForkliftId(forkliftId).stream()
                .sorted(LISTING_ORDER)
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    @Override
    public List<AlertAcknowledgment> getAlertHistory(Long alertId) {
        getAlert(alertId);
        return acknowledgmentRepository.findByAlertIdOrderByCreatedAtAscIdAsc(alertId);
    }

    @Override
    public AlertStats getAlertStats() {
        List<Alert> open = alertRepository.findByResolvedFalseAndDismissedFalse();
        return AlertStats.builder()
                .totalAlerts(alertRepository.count())
                .activeAlerts(open.stream().filter(Alert::isActive).count())
                .snoozedAlerts(open.stream().filter(a -> !a.isActive()).count())
                .acknowledgedAlerts(open.stream().filter(Alert::isAcknowledged).count())
                .bySeverity(countBySeverity(open))
                .byType(countByType(open))
                .build();
    }

    @Override
    public AlertDashboard getDashboardSummary() {
        List<Alert> active = alertRepository.findByActiveTrueAndResolvedFalseAndDismissedFalse();
        LocalDateTime now = LocalDateTime.now(clock);
        int days = Math.max(1, alertProperties.getTrendDays());
        LocalDateTime currentFrom = now.minusDays(days);
        LocalDateTime previousFrom = now.minusDays(2L * days);

        List<Alert> recent = alertRepository.findByCreatedAtGreaterThanEqualOrderByCreatedAtAsc(previousFrom);
        long currentWeek = recent.stream().filter(a -> !a.getCreatedAt().isBefore(currentFrom)).count();
        long previousWeek = recent.size() - currentWeek;
        long change = previousWeek > 0 ? Math.round((currentWeek - previousWeek) * 100.0 / previousWeek) : 0;

        Map<LocalDate, Long> perDay = new TreeMap<>();
        for (int i = days - 1; i >= 0; i--) {
            perDay.put(now.toLocalDate().minusDays(i), 0L);
        }
        for (Alert a : recent) {
            perDay.computeIfPresent(a.getCreatedAt().toLocalDate(), (d, c) -> c + 1);
        }

        return AlertDashboard.builder()
                .totalActive(active.size())
                .bySeverity(countBySeverity(active))
                .byType(countByType(active))
                .recentAlerts(active.stream().sorted(LISTING_ORDER).limit(10).collect(Collectors.toList()))
                .trend(new AlertDashboard.Trend(currentWeek, previousWeek, change))
                .daily(perDay.entrySet().stream()
                        .map(e -> new AlertDashboard.DailyCount(e.getKey(), e.getValue()))
                        .collect(Collectors.toList()))
                .build();
    }

    private static Map<String, Long> countBySeverity(List<Alert> alerts) {
        Map<String, Long> out = new LinkedHashMap<>();
        for (AlertSeverity s : AlertSeverity.values()) out.put(s.code(), 0L);
        alerts.forEach(a -> out.merge(a.getSeverity().code(), 1L, Long::sum));
        return out;
    }

    private static Map<String, Long> countByType(List<Alert> alerts) {
        Map<String, Long> out = new TreeMap<>();
        alerts.forEach(a -> out.merge(a.getType().code(), 1L, Long::sum));
        return out;
    }

    // ---- webhooks ----

    @Override
    public Webhook createWebhook(WebhookRequest request) {
        if (request == null || request.getName() == null || request.getName().isBlank()) {
            throw new IllegalArgumentException("Webhook name is required");
        }
        validateUrl(request.getUrl());
        LocalDateTime now = LocalDateTime.now(clock);
        Webhook webhook = Webhook.builder()
                .name(request.getName())
                .url(request.getUrl())
                .secret(request.getSecret())
                .events(normalizeEvents(request.getEvents()))
                .active(request.getActive() == null || request.getActive())
                .createdAt(now)
                .updatedAt(now)
                .build();
        Webhook saved = webhookRepository.save(webhook);
        log.info("Webhook created id={} name={} events={}", saved.getId(), saved.getName(), saved.getEvents());
        return saved;
    }

    @Override
    public List<Webhook> getWebhooks() {
        return webhookRepository.findAllByOrderByNameAsc();
    }

    @Override
    public Webhook updateWebhook(Long id, WebhookRequest request) {
        Webhook webhook = webhookRepository.findById(id).orElseThrow(() -> ResourceNotFoundException.of("Webhook", id));
        if (request.getName() != null) {
            if (request.getName().isBlank()) throw new IllegalArgumentException("Webhook name is required");
            webhook.setName(request.getName());
        }
        if (request.getUrl() != null) {
            validateUrl(request.getUrl());
            webhook.setUrl(request.getUrl());
        }
        if (request.getSecret() != null) webhook.setSecret(request.getSecret().isBlank() ? null : request.getSecret());
        if (request.getEvents() != null) webhook.setEvents(normalizeEvents(request.getEvents()));
        if (request.getActive() != null) webhook.setActive(request.getActive());
        webhook.setUpdatedAt(LocalDateTime.now(clock));
        log.info("Webhook updated id={}", id);
        return webhookRepository.save(webhook);
    }

    @Override
    public boolean deleteWebhook(Long id) {
        if (!webhookRepository.existsById(id)) return false;
        webhookRepository.deleteById(id);
        log.info("Webhook deleted id={}", id);
        return true;
    }

    private static void validateUrl(String url) {
        if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
            throw new IllegalArgumentException("Webhook url must be an http(s) URL: " + url);
        }
    }

    private static Set<String> normalizeEvents(Set<String> events) {
        Set<String> out = new LinkedHashSet<>();
        if (events == null || events.isEmpty()) {
            out.add(Webhook.ALL_EVENTS);
            return out;
        }
        for (String e : events) {
            String code = e == null ? "" : e.trim().toLowerCase(Locale.ROOT);
            if (!Webhook.ALL_EVENTS.equals(code)) {
                AlertType.fromCode(code);
            }
            out.add(code);
        }
        return out;
    }
}
