package com.sandy.fleet.health.aspect;

import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.entity.AlertType;
import com.sandy.fleet.health.service.impl.AlertServiceImpl;
import com.sandy.fleet.health.vo.AlertCreateRequest;
import com.sandy.fleet.health.vo.BatchActionResult;
import com.sandy.fleet.health.vo.ReadingImportItem;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class ServiceCallLoggingAspectTest {

    @Test
    void operationDropsImplSuffix() {
        assertEquals("AlertService.acknowledge", ServiceCallLoggingAspect.operationName(AlertServiceImpl.class, "acknowledge"));
    }

    @Test
    void subjectKeepsIdentifiersOnly() {
        Map<String, Object> subject = ServiceCallLoggingAspect.subject(
                new String[]{"forkliftId", "reading", "source", "recordedBy"},
                new Object[]{"FL-1", 480d, null, "tech"});

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("forkliftId", "FL-1");
        assertEquals(expected, subject);
    }

    @Test
    void subjectSummarizesLargeBatches() {
        List<Long> few = List.of(3L, 4L);
        List<Long> many = LongStream.rangeClosed(1, 25).boxed().collect(Collectors.toList());

        assertEquals(few, ServiceCallLoggingAspect.subject(new String[]{"ids", "userId"}, new Object[]{few, "sup"}).get("ids"));
        assertEquals("25 entries", ServiceCallLoggingAspect.subject(new String[]{"ids"}, new Object[]{many}).get("ids"));
        assertEquals("1 entries", ServiceCallLoggingAspect.subject(
                new String[]{"items"}, new Object[]{List.of(new ReadingImportItem("FL-1", 10d))}).get("items"));
    }

    @Test
    void subjectUnpacksAlertRequest() {
        AlertCreateRequest request = AlertCreateRequest.builder()
                .forkliftId("FL-2").type(AlertType.HIGH_RISK).title("High Risk Unit: FL-2").build();

        Map<String, Object> subject = ServiceCallLoggingAspect.subject(new String[]{"request"}, new Object[]{request});

        assertEquals("FL-2", subject.get("forkliftId"));
        assertEquals("high_risk", subject.get("type"));
    }

    @Test
    void outcomeIsReducedToIdsAndCounts() {
        Alert alert = Alert.builder().id(42L).forkliftId("FL-3").build();
        BatchActionResult batch = new BatchActionResult();
        batch.addSuccess(1L);
        batch.addFailure(2L, "Alert 2 is already resolved");

        assertEquals("alertId=42 forkliftId=FL-3", ServiceCallLoggingAspect.summarize(alert));
        assertEquals("size=3", ServiceCallLoggingAspect.summarize(List.of(1, 2, 3)));
        assertEquals("empty", ServiceCallLoggingAspect.summarize(Optional.empty()));
        assertEquals("present alertId=42 forkliftId=FL-3", ServiceCallLoggingAspect.summarize(Optional.of(alert)));
        assertEquals("success=1 failed=1", ServiceCallLoggingAspect.summarize(batch));
        assertEquals("none", ServiceCallLoggingAspect.summarize(null));
        assertEquals("7", ServiceCallLoggingAspect.summarize(7));
    }
}
