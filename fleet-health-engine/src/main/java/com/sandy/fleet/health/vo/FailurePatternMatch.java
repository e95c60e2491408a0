package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailurePatternMatch {
    private String patternName;
    private String prediction;
    /** Percent, 0-100. */
    private int confidence;
    private Urgency urgency;
    private List<String> matchedIndicators;
    private int totalIndicators;
    private String recommendedAction;
    private int estimatedDaysToFailure;
}
