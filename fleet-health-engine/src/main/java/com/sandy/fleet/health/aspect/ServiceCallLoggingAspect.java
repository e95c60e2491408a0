package com.sandy.fleet.health.aspect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.entity.Forklift;
import com.sandy.fleet.health.entity.HourMeterReading;
import com.sandy.fleet.health.entity.RiskAssessment;
import com.sandy.fleet.health.exception.ResourceNotFoundException;
import com.sandy.fleet.health.vo.AlertCreateRequest;
import com.sandy.fleet.health.vo.BatchActionResult;
import com.sandy.fleet.health.vo.BulkImportResult;
import com.sandy.fleet.health.vo.ReadingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Logs every call into the engine's service implementations keyed by the unit or alert it
 * concerns. Only identifying arguments are written; outcomes are reduced to ids and counts.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ServiceCallLoggingAspect {

    /** Parameter names that identify what a call is about. */
    static final Set<String> SUBJECT_PARAMS = Set.of(
            "forkliftId", "forkliftIds", "id", "ids", "alertId", "readingId", "items", "fiscalYear");

    /** Id lists longer than this are logged as a count. */
    static final int MAX_LISTED_IDS = 20;

    private final ObjectMapper objectMapper;

    @Around("within(com.sandy.fleet.health.service.impl..*)")
    public Object logServiceCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        MethodSignature sig = (MethodSignature) pjp.getSignature();
        String operation = operationName(sig.getDeclaringType(), sig.getName());
        String subject = toJson(subject(sig.getParameterNames(), pjp.getArgs()));
        log.info("Engine call: op={} subject={}", operation, subject);

        try {
            Object result = pjp.proceed();
            log.info("Engine result: op={} subject={} durationMs={} outcome={}",
                    operation, subject, System.currentTimeMillis() - start, summarize(result));
            return result;
        } catch (ResourceNotFoundException | IllegalArgumentException | IllegalStateException e) {
            log.warn("Engine rejected: op={} subject={} durationMs={} errorType={} message={}",
                    operation, subject, System.currentTimeMillis() - start, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        } catch (Throwable t) {
            log.error("Engine error: op={} subject={} durationMs={} errorType={} message={}",
                    operation, subject, System.currentTimeMillis() - start, t.getClass().getSimpleName(), t.getMessage());
            throw t;
        }
    }

    /** "AlertServiceImpl" + "acknowledge" to "AlertService.acknowledge". */
    static String operationName(Class<?> type, String method) {
        String name = type == null ? "?" : type.getSimpleName();
        if (name.endsWith("Impl")) {
            name = name.substring(0, name.length() - 4);
        }
        return name + "." + method;
    }

    /** Identifying arguments only; readings, notes and user names stay out of the log. */
    static Map<String, Object> subject(String[] paramNames, Object[] args) {
        Map<String, Object> subject = new LinkedHashMap<>();
        if (paramNames == null || args == null) return subject;
        for (int i = 0; i < args.length && i < paramNames.length; i++) {
            String name = paramNames[i];
            Object arg = args[i];
            if (arg instanceof AlertCreateRequest) {
                AlertCreateRequest request = (AlertCreateRequest) arg;
                subject.put("forkliftId", request.getForkliftId());
                subject.put("type", request.getType() == null ? null : request.getType().code());
            } else if (SUBJECT_PARAMS.contains(name)) {
                subject.put(name, idValue(name, arg));
            }
        }
        return subject;
    }

    private static Object idValue(String name, Object arg) {
        if (!(arg instanceof Collection)) return arg;
        Collection<?> values = (Collection<?>) arg;
        if ("items".equals(name) || values.size() > MAX_LISTED_IDS) {
            return values.size() + " entries";
        }
        return values;
    }

    static String summarize(Object result) {
        if (result == null) return "none";
        if (result instanceof Optional) {
            Optional<?> optional = (Optional<?>) result;
            return optional.map(v -> "present " + summarize(v)).orElse("empty");
        }
        if (result instanceof Collection) return "size=" + ((Collection<?>) result).size();
        if (result instanceof Alert) {
            Alert alert = (Alert) result;
            return "alertId=" + alert.getId() + " forkliftId=" + alert.getForkliftId();
        }
        if (result instanceof Forklift) return "forkliftId=" + ((Forklift) result).getId();
        if (result instanceof RiskAssessment) {
            RiskAssessment assessment = (RiskAssessment) result;
            return "assessmentId=" + assessment.getId() + " forkliftId=" + assessment.getForkliftId();
        }
        if (result instanceof HourMeterReading) {
            HourMeterReading reading = (HourMeterReading) result;
            return "readingId=" + reading.getId() + " flagged=" + reading.isFlagged();
        }
        if (result instanceof ReadingResult) {
            ReadingResult r = (ReadingResult) result;
            return "readingId=" + (r.getReading() == null ? null : r.getReading().getId())
                    + " anomalies=" + (r.getAnomalies() == null ? 0 : r.getAnomalies().size())
                    + " alertId=" + r.getAlertId();
        }
        if (result instanceof BatchActionResult) {
            BatchActionResult r = (BatchActionResult) result;
            return "success=" + r.getSuccessCount() + " failed=" + r.getFailedCount();
        }
        if (result instanceof BulkImportResult) {
            BulkImportResult r = (BulkImportResult) result;
            return "successful=" + r.getSuccessful() + " failed=" + r.getFailed() + " flagged=" + r.getFlagged();
        }
        if (result instanceof Number || result instanceof Boolean || result instanceof CharSequence) {
            return String.valueOf(result);
        }
        return result.getClass().getSimpleName();
    }

    private String toJson(Map<String, Object> subject) {
        try {
            return objectMapper.writeValueAsString(subject);
        } catch (JsonProcessingException e) {
            return subject.toString();
        }
    }
}
