package com.sandy.fleet.health.service;

import com.sandy.fleet.health.entity.Forklift;
import com.sandy.fleet.health.entity.RiskAssessment;
import com.sandy.fleet.health.repository.ForkliftRepository;
import com.sandy.fleet.health.tools.JsonAttributeConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Derives the cached risk columns on {@link Forklift} from a {@link RiskAssessment}.
 * The only writer of those columns; rebuilding from the latest assessment is always safe.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForkliftRiskProjection {

    private final ForkliftRepository forkliftRepository;

    public Forklift apply(Forklift forklift, RiskAssessment assessment) {
        if (assessment == null) {
            forklift.setRiskScore(1);
            forklift.setRiskLevel("low");
            forklift.setRiskFactors(null);
            forklift.setLastRiskAssessment(null);
            forklift.setRecommendedAction(null);
        } else {
            forklift.setRiskScore(assessment.getOverallScore());
            forklift.setRiskLevel(riskLevel(assessment.getOverallScore()));
            forklift.setRiskFactors(JsonAttributeConverter.toJson(assessment.getRiskFactors()));
            forklift.setLastRiskAssessment(assessment.getAssessmentDate());
            forklift.setRecommendedAction(recommendedAction(assessment.getRepairVsReplace()));
        }
        log.debug("Risk projection forkliftId={} score={} level={} action={}",
                forklift.getId(), forklift.getRiskScore(), forklift.getRiskLevel(), forklift.getRecommendedAction());
        return forkliftRepository.save(forklift);
    }

    public static String riskLevel(int overallScore) {
        if (overallScore >= 9) return "critical";
        if (overallScore >= 7) return "high";
        if (overallScore >= 4) return "medium";
        return "low";
    }

    public static String recommendedAction(RiskAssessment.Decision decision) {
        if (decision == RiskAssessment.Decision.REPLACE) return "plan_replacement";
        if (decision == RiskAssessment.Decision.MONITOR) return "monitor";
        return "continue";
    }
}
