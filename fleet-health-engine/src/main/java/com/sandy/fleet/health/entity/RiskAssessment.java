package com.sandy.fleet.health.entity;

import com.sandy.fleet.health.tools.JsonConverters;
import com.sandy.fleet.health.vo.Recommendation;
import com.sandy.fleet.health.vo.RiskFactor;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Append-only, point-in-time risk snapshot. Rows are never updated after insert.
 */
@Entity
@Immutable
@Table(name = "risk_assessments", indexes = {
        @Index(name = "idx_assessment_forklift_date", columnList = "forkliftId, assessmentDate")
})
@Getter
@ToString
@Builder
@NoArgsConstructor(access = lombok.AccessLevel.PROTECTED)
@AllArgsConstructor
public class RiskAssessment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String forkliftId;

    @Column(nullable = false)
    private int overallScore;
    private int ageScore;
    private int hoursScore;
    private int maintenanceCostScore;
    private int repairFrequencyScore;
    private int downtimeScore;

    @Column(length = 4000)
    @Convert(converter = JsonConverters.RiskFactorList.class)
    private List<RiskFactor> riskFactors;

    @Column(length = 4000)
    @Convert(converter = JsonConverters.RecommendationList.class)
    private List<Recommendation> recommendations;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private Decision repairVsReplace;
    @Enumerated(EnumType.STRING)
    @Column(length = 24)
    private Urgency replacementUrgency;

    private long estimatedRemainingLifeMonths;
    private long estimatedRemainingValue;
    private long projectedAnnualMaintenanceCost;
    private long projectedDowntimeCost;
    private long replacementCostEstimate;
    private long repairCostEstimate;
    private long costSavingsIfReplaced;
    private long roiIfReplaced;

    private LocalDateTime assessmentDate;
    @Column(length = 32)
    private String assessmentMethod;

    public enum Decision { REPAIR, REPLACE, MONITOR }

    public enum Urgency { IMMEDIATE, WITHIN_6_MONTHS, WITHIN_1_YEAR, WITHIN_2_YEARS, NOT_NEEDED }
}
