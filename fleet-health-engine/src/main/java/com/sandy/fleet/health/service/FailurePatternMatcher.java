package com.sandy.fleet.health.service;

import com.sandy.fleet.health.vo.FailurePatternMatch;

import java.util.List;

/**
 * Detects known failure precursors in a unit's recent maintenance history.
 * Implementations differ in whether indicator order matters.
 */
public interface FailurePatternMatcher {

    List<FailurePatternMatch> detect(String forkliftId);

    List<FailurePatternMatch> detect(String forkliftId, int lookbackDays);
}
