package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** Per-id outcome of a bulk acknowledge / resolve. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchActionResult {
    private int successCount;
    private int failedCount;
    @Builder.Default
    private List<Long> failedIds = new ArrayList<>();
    @Builder.Default
    private List<Outcome> outcomes = new ArrayList<>();

    public void addSuccess(Long id) {
        outcomes.add(new Outcome(id, true, null));
        successCount++;
    }

    public void addFailure(Long id, String error) {
        outcomes.add(new Outcome(id, false, error));
        failedIds.add(id);
        failedCount++;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Outcome {
        private Long id;
        private boolean success;
        private String error;
    }
}
