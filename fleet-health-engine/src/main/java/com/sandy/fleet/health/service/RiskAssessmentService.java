package com.sandy.fleet.health.service;

import com.sandy.fleet.health.entity.Forklift;
import com.sandy.fleet.health.entity.RiskAssessment;
import com.sandy.fleet.health.vo.FleetAssessmentResult;
import com.sandy.fleet.health.vo.FleetRiskSummary;
import com.sandy.fleet.health.vo.ReplacementBudget;
import com.sandy.fleet.health.vo.RiskInputs;

import java.util.List;
import java.util.Optional;

public interface RiskAssessmentService {

    /**
     * Scores one unit, appends an assessment and refreshes the unit's cached risk fields.
     * A score at or above the alert threshold raises a deduplicated high risk alert.
     */
    RiskAssessment assessForklift(String forkliftId);

    /** Every unit that is not retired, one after another. Failures are reported per unit. */
    List<FleetAssessmentResult> assessFleet();

    List<FleetAssessmentResult> assessUnits(List<String> forkliftIds);

    RiskInputs gatherInputs(Forklift forklift);

    Optional<RiskAssessment> getLatestAssessment(String forkliftId);

    List<RiskAssessment> getAssessmentHistory(String forkliftId);

    FleetRiskSummary getFleetRiskSummary();

    ReplacementBudget getReplacementBudget(int fiscalYear);

    Forklift rebuildRiskProjection(String forkliftId);
}
