package com.sandy.fleet.health.service.impl;

import com.sandy.fleet.health.config.RiskScoringPolicy;
import com.sandy.fleet.health.entity.*;
import com.sandy.fleet.health.exception.ResourceNotFoundException;
import com.sandy.fleet.health.repository.DowntimeEventRepository;
import com.sandy.fleet.health.repository.ForkliftRepository;
import com.sandy.fleet.health.repository.MaintenanceRecordRepository;
import com.sandy.fleet.health.repository.RiskAssessmentRepository;
import com.sandy.fleet.health.service.AlertService;
import com.sandy.fleet.health.service.ForkliftRiskProjection;
import com.sandy.fleet.health.service.RiskAssessmentService;
import com.sandy.fleet.health.service.RiskScoreCalculator;
import com.sandy.fleet.health.vo.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Collectors;

@Slf4j
@Service
public class RiskAssessmentServiceImpl implements RiskAssessmentService {

    static final String ASSESSMENT_METHOD = "automated";
    private static final Set<String> REPLACEMENT_ACTIONS = Set.of("plan_replacement", "replace_immediately");
    private static final Set<String> ELEVATED_LEVELS = Set.of("high", "critical");

    private final ForkliftRepository forkliftRepository;
    private final MaintenanceRecordRepository maintenanceRepository;
    private final DowntimeEventRepository downtimeRepository;
    private final RiskAssessmentRepository assessmentRepository;
    private final RiskScoreCalculator calculator;
    private final ForkliftRiskProjection projection;
    private final RiskScoringPolicy policy;
    private final AlertService alertService;
    private final Clock clock;
    private final TransactionTemplate tx;

    public RiskAssessmentServiceImpl(ForkliftRepository forkliftRepository,
                                     MaintenanceRecordRepository maintenanceRepository,
                                     DowntimeEventRepository downtimeRepository,
                                     RiskAssessmentRepository assessmentRepository,
                                     RiskScoreCalculator calculator,
                                     ForkliftRiskProjection projection,
                                     RiskScoringPolicy policy,
                                     AlertService alertService,
                                     Clock clock,
                                     PlatformTransactionManager transactionManager) {
        this.forkliftRepository = forkliftRepository;
        this.maintenanceRepository = maintenanceRepository;
        this.downtimeRepository = downtimeRepository;
        this.assessmentRepository = assessmentRepository;
        this.calculator = calculator;
        this.projection = projection;
        this.policy = policy;
        this.alertService = alertService;
        this.clock = clock;
        this.tx = new TransactionTemplate(transactionManager);
    }

    @Override
    public RiskAssessment assessForklift(String forkliftId) {
        RiskAssessment assessment = tx.execute(status -> {
            Forklift forklift = requireForklift(forkliftId);
            RiskInputs inputs = gatherInputs(forklift);
            RiskEvaluation evaluation = calculator.evaluate(inputs);
            RiskAssessment saved = assessmentRepository.save(toAssessment(forkliftId, evaluation));
            projection.apply(forklift, saved);
            return saved;
        });
        log.info("Risk assessed forkliftId={} score={} decision={} urgency={}", forkliftId,
                assessment.getOverallScore(), assessment.getRepairVsReplace(), assessment.getReplacementUrgency());

        if (assessment.getOverallScore() >= policy.getAlertThreshold()) {
            raiseHighRiskAlert(assessment);
        }
        return assessment;
    }

    private RiskAssessment toAssessment(String forkliftId, RiskEvaluation e) {
        RiskScores s = e.getScores();
        FinancialProjection f = e.getFinancials();
        return RiskAssessment.builder()
                .forkliftId(forkliftId)
                .overallScore(s.getOverall())
                .ageScore(s.getAge())
                .hoursScore(s.getHours())
                .maintenanceCostScore(s.getMaintenanceCost())
                .repairFrequencyScore(s.getRepairFrequency())
                .downtimeScore(s.getDowntime())
                .riskFactors(e.getRiskFactors())
                .recommendations(e.getRecommendations())
                .repairVsReplace(e.getDecision())
                .replacementUrgency(e.getUrgency())
                .estimatedRemainingLifeMonths(f.getRemainingLifeMonths())
                .estimatedRemainingValue(f.getCurrentValue())
                .projectedAnnualMaintenanceCost(f.getProjectedAnnualMaintenance())
                .projectedDowntimeCost(f.getProjectedDowntimeCost())
                .replacementCostEstimate(f.getReplacementCost())
                .repairCostEstimate(f.getProjectedRepairCost())
                .costSavingsIfReplaced(f.getSavingsIfReplaced())
                .roiIfReplaced(f.getRoiIfReplaced())
                .assessmentDate(LocalDateTime.now(clock))
                .assessmentMethod(ASSESSMENT_METHOD)
                .build();
    }

    private void raiseHighRiskAlert(RiskAssessment assessment) {
        int score = assessment.getOverallScore();
        String forkliftId = assessment.getForkliftId();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("risk_score", score);
        context.put("repair_vs_replace", assessment.getRepairVsReplace().name().toLowerCase(Locale.ROOT));
        context.put("replacement_urgency", assessment.getReplacementUrgency().name().toLowerCase(Locale.ROOT));

        String message = assessment.getRepairVsReplace() == RiskAssessment.Decision.REPLACE
                ? "Risk score " + score + "/10. Replacement recommended."
                : "Risk score " + score + "/10. Close monitoring required.";
        alertService.createAlert(AlertCreateRequest.builder()
                .forkliftId(forkliftId)
                .type(AlertType.HIGH_RISK)
                .severity(score >= 9 ? AlertSeverity.CRITICAL : AlertSeverity.HIGH)
                .title("High Risk Unit: " + forkliftId)
                .message(message)
                .contextData(context)
                .thresholdValue((double) policy.getAlertThreshold())
                .actualValue((double) score)
                .recurrenceKey("high_risk_" + forkliftId)
                .build());
    }

    @Override
    public RiskInputs gatherInputs(Forklift forklift) {
        LocalDate today = LocalDate.now(clock);
        LocalDate from = today.minusYears(1);

        double cost = 0;
        int repairs = 0;
        int emergencies = 0;
        for (MaintenanceRecord r : maintenanceRepository
                .findByForkliftIdAndServiceDateGreaterThanEqualOrderByServiceDateAsc(forklift.getId(), from)) {
            if (r.getStatus() == MaintenanceRecord.Status.CANCELLED) continue;
            cost += r.getTotalCost() == null ? 0 : r.getTotalCost();
            if (r.isRepair()) repairs++;
            if (r.getType() == MaintenanceRecord.Type.EMERGENCY) emergencies++;
        }

        double downtimeHours = 0;
        double downtimeCost = 0;
        for (DowntimeEvent e : downtimeRepository.findByForkliftIdAndStartTimeGreaterThanEqual(
                forklift.getId(), LocalDateTime.now(clock).minusYears(1))) {
            double hours = e.effectiveDurationHours();
            downtimeHours += hours;
            downtimeCost += hours * e.effectiveCostPerHour();
        }

        return RiskInputs.builder()
                .ageYears(ageYears(forklift, today))
                .currentHours(forklift.getCurrentHours() == null ? 0 : forklift.getCurrentHours())
                .purchasePrice(forklift.getPurchasePrice() == null || forklift.getPurchasePrice() <= 0
                        ? policy.getDefaultPurchasePrice() : forklift.getPurchasePrice())
                .depreciationRate(forklift.getDepreciationRate() == null
                        ? policy.getDefaultDepreciationRate() : forklift.getDepreciationRate())
                .expectedLifespanYears(forklift.getExpectedLifespanYears() == null
                        ? policy.getDefaultLifespanYears() : forklift.getExpectedLifespanYears())
                .maintenanceCost12Months(cost)
                .repairCount12Months(repairs)
                .emergencyCount12Months(emergencies)
                .downtimeHours12Months(downtimeHours)
                .downtimeCost12Months(downtimeCost)
                .maintenanceOverdue(forklift.getNextServiceDate() != null && forklift.getNextServiceDate().isBefore(today))
                .build();
    }

    private double ageYears(Forklift forklift, LocalDate today) {
        if (forklift.getPurchaseDate() != null) {
            return Math.max(0, ChronoUnit.DAYS.between(forklift.getPurchaseDate(), today) / 365d);
        }
        if (forklift.getYear() != null) {
            return Math.max(0, today.getYear() - forklift.getYear());
        }
        return policy.getDefaultAgeYears();
    }

    @Override
    public List<FleetAssessmentResult> assessFleet() {
        List<String> ids = forkliftRepository.findByStatusNotOrderByIdAsc(Forklift.Status.RETIRED).stream()
                .map(Forklift::getId)
                .collect(Collectors.toList());
        return assessUnits(ids);
    }

    @Override
    public List<FleetAssessmentResult> assessUnits(List<String> forkliftIds) {
        List<FleetAssessmentResult> results = new ArrayList<>(forkliftIds.size());
        for (String id : forkliftIds) {
            try {
                results.add(FleetAssessmentResult.ok(id, assessForklift(id)));
            } catch (RuntimeException e) {
                log.warn("Risk assessment failed forkliftId={} error={}", id, e.getMessage());
                results.add(FleetAssessmentResult.failed(id, e.getMessage()));
            }
        }
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("Fleet risk assessment done units={} failed={}", results.size(), failed);
        return results;
    }

    @Override
    public Optional<RiskAssessment> getLatestAssessment(String forkliftId) {
        requireForklift(forkliftId);
        return assessmentRepository.findTopByForkliftIdOrderByAssessmentDateDescIdDesc(forkliftId);
    }

    @Override
    public List<RiskAssessment> getAssessmentHistory(String forkliftId) {
        requireForklift(forkliftId);
        return assessmentRepository.findByForkliftIdOrderByAssessmentDateDescIdDesc(forkliftId);
    }

    @Override
    public FleetRiskSummary getFleetRiskSummary() {
        List<Forklift> units = forkliftRepository.findByStatusNotOrderByIdAsc(Forklift.Status.RETIRED);
        FleetRiskSummary summary = new FleetRiskSummary();
        summary.setTotalUnits(units.size());
        int scoreSum = 0;
        for (Forklift f : units) {
            int score = f.getRiskScore() == null ? 1 : f.getRiskScore();
            scoreSum += score;
            String level = f.getRiskLevel() == null ? ForkliftRiskProjection.riskLevel(score) : f.getRiskLevel();
            switch (level) {
                case "critical" -> summary.setCriticalRisk(summary.getCriticalRisk() + 1);
                case "high" -> summary.setHighRisk(summary.getHighRisk() + 1);
                case "medium" -> summary.setMediumRisk(summary.getMediumRisk() + 1);
                default -> summary.setLowRisk(summary.getLowRisk() + 1);
            }
            if (ELEVATED_LEVELS.contains(level) && f.getRecommendedAction() != null
                    && REPLACEMENT_ACTIONS.contains(f.getRecommendedAction())) {
                summary.setUnitsNeedingReplacement(summary.getUnitsNeedingReplacement() + 1);
            }
        }
        summary.setAverageRiskScore(units.isEmpty() ? 0 : Math.round(scoreSum * 10d / units.size()) / 10d);
        return summary;
    }

    @Override
    public ReplacementBudget getReplacementBudget(int fiscalYear) {
        List<ReplacementBudget.Item> items = new ArrayList<>();
        for (Forklift f : forkliftRepository.findByStatusNotOrderByIdAsc(Forklift.Status.RETIRED)) {
            if (f.getRiskLevel() == null || !ELEVATED_LEVELS.contains(f.getRiskLevel())) continue;
            Optional<RiskAssessment> latest = assessmentRepository.findTopByForkliftIdOrderByAssessmentDateDescIdDesc(f.getId());
            if (latest.isEmpty()) continue;
            RiskAssessment a = latest.get();
            long net = a.getReplacementCostEstimate() - a.getEstimatedRemainingValue();
            double savings = a.getCostSavingsIfReplaced();
            items.add(ReplacementBudget.Item.builder()
                    .forkliftId(f.getId())
                    .model(f.getModel())
                    .location(f.getLocationName())
                    .riskScore(a.getOverallScore())
                    .currentHours(f.getCurrentHours() == null ? 0 : f.getCurrentHours())
                    .projectedAnnualMaintenanceCost(a.getProjectedAnnualMaintenanceCost())
                    .replacementCost(a.getReplacementCostEstimate())
                    .tradeInValue(a.getEstimatedRemainingValue())
                    .netCost(net)
                    .annualSavings(savings / 3)
                    .paybackMonths(savings > 0 ? Math.round(net / (savings / 36)) : null)
                    .urgency(a.getReplacementUrgency())
                    .build());
        }
        items.sort(Comparator.comparingInt(ReplacementBudget.Item::getRiskScore).reversed());

        long total = items.stream().mapToLong(ReplacementBudget.Item::getNetCost).sum();
        double annual = items.stream().mapToDouble(ReplacementBudget.Item::getAnnualSavings).sum();
        return ReplacementBudget.builder()
                .fiscalYear(fiscalYear)
                .recommendations(items)
                .totalUnitsRecommended(items.size())
                .totalBudgetNeeded(total)
                .projectedAnnualSavings(annual)
                .fleetPaybackMonths(annual > 0 ? Math.round(total / (annual / 12)) : null)
                .build();
    }

    @Override
    public Forklift rebuildRiskProjection(String forkliftId) {
        return tx.execute(status -> {
            Forklift forklift = requireForklift(forkliftId);
            RiskAssessment latest = assessmentRepository.findTopByForkliftIdOrderByAssessmentDateDescIdDesc(forkliftId)
                    .orElse(null);
            return projection.apply(forklift, latest);
        });
    }

    private Forklift requireForklift(String forkliftId) {
        return forkliftRepository.findById(forkliftId).orElseThrow(() -> ResourceNotFoundException.of("Forklift", forkliftId));
    }
}
