package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkImportResult {
    private int successful;
    private int failed;
    private int flagged;
    @Builder.Default
    private List<ItemError> errors = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemError {
        private String forkliftId;
        private Double reading;
        private String error;
    }
}
