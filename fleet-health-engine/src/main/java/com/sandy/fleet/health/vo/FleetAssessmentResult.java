package com.sandy.fleet.health.vo;

import com.sandy.fleet.health.entity.RiskAssessment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One entry of a fleet batch run: either an assessment or the error that stopped it. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FleetAssessmentResult {
    private String forkliftId;
    private boolean success;
    private RiskAssessment assessment;
    private String error;

    public static FleetAssessmentResult ok(String forkliftId, RiskAssessment assessment) {
        return FleetAssessmentResult.builder().forkliftId(forkliftId).success(true).assessment(assessment).build();
    }

    public static FleetAssessmentResult failed(String forkliftId, String error) {
        return FleetAssessmentResult.builder().forkliftId(forkliftId).success(false).error(error).build();
    }
}
