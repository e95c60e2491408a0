package com.sandy.fleet.health.vo;

import com.sandy.fleet.health.entity.RiskAssessment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Output of a pure risk evaluation, before it is persisted as an assessment. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskEvaluation {
    private RiskScores scores;
    private List<RiskFactor> riskFactors;
    private List<Recommendation> recommendations;
    private FinancialProjection financials;
    private RiskAssessment.Decision decision;
    private RiskAssessment.Urgency urgency;
}
