package com.sandy.fleet.health.vo;

import lombok.Value;

import java.util.List;

@Value
public class FailurePatternDefinition {
    String name;
    /** Ordered indicator keywords, underscores standing for spaces. */
    List<String> keywords;
    String prediction;
    double baseConfidence;
    Urgency urgency;
    int lookaheadDays;
}
