package com.sandy.fleet.health.service.impl;

import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.entity.AlertSeverity;
import com.sandy.fleet.health.entity.AlertType;
import com.sandy.fleet.health.entity.Forklift;
import com.sandy.fleet.health.exception.ResourceNotFoundException;
import com.sandy.fleet.health.repository.ForkliftRepository;
import com.sandy.fleet.health.service.*;
import com.sandy.fleet.health.vo.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class PredictiveMaintenanceServiceImpl implements PredictiveMaintenanceService {

    static final int TOP_CRITICAL_COMPONENTS = 3;
    static final int TOP_WARNING_COMPONENTS = 2;
    static final int TOP_FLEET_PREDICTIONS = 10;
    static final int MAX_URGENCY_SCORE = 100;

    private final ForkliftRepository forkliftRepository;
    private final UsageRateEstimator usageRateEstimator;
    private final ComponentLifecycleModel componentLifecycleModel;
    private final FailurePatternMatcher failurePatternMatcher;
    private final AlertService alertService;
    private final Clock clock;

    @Override
    public Optional<ServicePrediction> predictNextService(String forkliftId) {
        return predictNextService(requireForklift(forkliftId));
    }

    private Optional<ServicePrediction> predictNextService(Forklift forklift) {
        LocalDate today = LocalDate.now(clock);
        double currentHours = forklift.getCurrentHours() == null ? 0 : forklift.getCurrentHours();
        UsageRate rate = usageRateEstimator.estimate(forklift).orElse(null);

        List<ServicePrediction.Candidate> candidates = new ArrayList<>();
        Double nextHours = forklift.getNextServiceHours();
        if (nextHours != null && nextHours > currentHours && rate != null && rate.getHoursPerDay() > 0) {
            double remaining = nextHours - currentHours;
            long days = Math.round(remaining / rate.getHoursPerDay());
            candidates.add(ServicePrediction.Candidate.builder()
                    .type(ServicePrediction.Basis.HOURS_BASED)
                    .predictedDate(today.plusDays(days))
                    .daysUntil(days)
                    .hoursRemaining(Math.round(remaining))
                    .confidence(hoursConfidence(rate.getReliability()))
                    .basis(String.format(Locale.ROOT, "Based on %.1f hrs/day usage rate", rate.getHoursPerDay()))
                    .build());
        }
        if (forklift.getNextServiceDate() != null) {
            candidates.add(ServicePrediction.Candidate.builder()
                    .type(ServicePrediction.Basis.DATE_BASED)
                    .predictedDate(forklift.getNextServiceDate())
                    .daysUntil(ChronoUnit.DAYS.between(today, forklift.getNextServiceDate()))
                    .confidence(0.95)
                    .basis("Scheduled service interval")
                    .build());
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        candidates.sort(Comparator.comparingLong(ServicePrediction.Candidate::getDaysUntil));

        return Optional.of(ServicePrediction.builder()
                .forkliftId(forklift.getId())
                .currentHours(currentHours)
                .usageRate(rate)
                .candidates(candidates)
                .recommendedAction(serviceAction(candidates.get(0).getDaysUntil()))
                .build());
    }

    static double hoursConfidence(UsageRate.Reliability reliability) {
        if (reliability == UsageRate.Reliability.HIGH) return 0.90;
        if (reliability == UsageRate.Reliability.MEDIUM) return 0.75;
        return 0.60;
    }

    static String serviceAction(long daysUntil) {
        if (daysUntil <= 7) return "Schedule now";
        if (daysUntil <= 14) return "Plan service";
        if (daysUntil <= 30) return "Monitor";
        return "OK";
    }

    @Override
    public List<FailurePatternMatch> detectFailurePatterns(String forkliftId) {
        return failurePatternMatcher.detect(forkliftId);
    }

    @Override
    public ComponentHealthReport getComponentHealth(String forkliftId) {
        return componentLifecycleModel.assess(forkliftId);
    }

    @Override
    public MaintenancePrediction generateForkliftPredictions(String forkliftId) {
        Forklift forklift = requireForklift(forkliftId);
        List<PredictionFinding> findings = new ArrayList<>();
        int score = 0;

        ServicePrediction service = predictNextService(forklift).orElse(null);
        if (service != null) {
            ServicePrediction.Candidate next = service.soonest();
            long days = next.getDaysUntil();
            findings.add(PredictionFinding.builder()
                    .type(PredictionFinding.FindingType.SCHEDULED_SERVICE)
                    .title("Preventive Maintenance Due")
                    .description("Service predicted in " + days + " days (" + next.getPredictedDate() + ")")
                    .confidence((int) Math.round(next.getConfidence() * 100))
                    .urgency(days <= 7 ? Urgency.CRITICAL : days <= 14 ? Urgency.HIGH : Urgency.MEDIUM)
                    .daysUntil(days)
                    .predictedDate(next.getPredictedDate())
                    .build());
            if (days <= 7) score += 30;
            else if (days <= 14) score += 20;
            else if (days <= 30) score += 10;
        }

        List<FailurePatternMatch> patterns = failurePatternMatcher.detect(forkliftId);
        LocalDate today = LocalDate.now(clock);
        for (FailurePatternMatch p : patterns) {
            findings.add(PredictionFinding.builder()
                    .type(PredictionFinding.FindingType.FAILURE_PATTERN)
                    .title(p.getPrediction())
                    .description("Detected " + p.getMatchedIndicators().size() + "/" + p.getTotalIndicators() + " warning signs")
                    .confidence(p.getConfidence())
                    .urgency(p.getUrgency())
                    .daysUntil((long) p.getEstimatedDaysToFailure())
                    .predictedDate(today.plusDays(p.getEstimatedDaysToFailure()))
                    .patternName(p.getPatternName())
                    .matchedIndicators(p.getMatchedIndicators())
                    .build());
            if (p.getUrgency() == Urgency.CRITICAL) score += 40;
            else if (p.getUrgency() == Urgency.HIGH) score += 25;
            else score += 15;
        }

        ComponentHealthReport health = componentLifecycleModel.assess(forkliftId);
        List<ComponentHealth> critical = health.getComponents().stream()
                .filter(c -> c.getUrgency() == Urgency.CRITICAL)
                .limit(TOP_CRITICAL_COMPONENTS)
                .collect(Collectors.toList());
        for (ComponentHealth c : critical) {
            findings.add(PredictionFinding.builder()
                    .type(PredictionFinding.FindingType.COMPONENT_LIFECYCLE)
                    .title(c.getComponent() + " Replacement Overdue")
                    .description(String.format(Locale.ROOT, "%.0f%% of expected life used (%.0f hrs)",
                            c.getLifeUsedPercent(), c.getHoursSinceService()))
                    .confidence(85)
                    .urgency(Urgency.CRITICAL)
                    .component(c.getComponentKey())
                    .category(c.getCategory())
                    .build());
            score += 35;
        }
        List<ComponentHealth> warning = health.getComponents().stream()
                .filter(c -> c.getUrgency() == Urgency.HIGH)
                .limit(TOP_WARNING_COMPONENTS)
                .collect(Collectors.toList());
        for (ComponentHealth c : warning) {
            findings.add(PredictionFinding.builder()
                    .type(PredictionFinding.FindingType.COMPONENT_LIFECYCLE)
                    .title(c.getComponent() + " Approaching End of Life")
                    .description(String.format(Locale.ROOT, "%d hours remaining (%.0f%% used)",
                            c.getRemainingHours(), c.getLifeUsedPercent()))
                    .confidence(75)
                    .urgency(Urgency.HIGH)
                    .component(c.getComponentKey())
                    .category(c.getCategory())
                    .build());
            score += 15;
        }

        // List.sort is stable, so equal urgencies keep insertion order
        findings.sort(Comparator.comparingInt(f -> f.getUrgency().rank()));
        int urgencyScore = Math.min(MAX_URGENCY_SCORE, score);

        return MaintenancePrediction.builder()
                .forkliftId(forkliftId)
                .forkliftModel(forklift.getModel())
                .location(forklift.getLocationName())
                .currentHours(forklift.getCurrentHours() == null ? 0 : forklift.getCurrentHours())
                .riskScore(forklift.getRiskScore())
                .urgencyScore(urgencyScore)
                .overallStatus(MaintenancePrediction.Status.forUrgencyScore(urgencyScore))
                .findings(findings)
                .servicePrediction(service)
                .componentHealth(health)
                .failurePatterns(patterns)
                .generatedAt(LocalDateTime.now(clock))
                .build();
    }

    @Override
    public FleetPrediction generateFleetPredictions() {
        List<Forklift> units = forkliftRepository.findByStatusNotOrderByIdAsc(Forklift.Status.RETIRED);
        List<MaintenancePrediction> analyzed = analyze(units);

        List<MaintenancePrediction> withFindings = analyzed.stream()
                .filter(p -> !p.getFindings().isEmpty())
                .sorted(Comparator.comparingInt(MaintenancePrediction::getUrgencyScore).reversed())
                .collect(Collectors.toList());

        List<FleetPrediction.TopPrediction> top = withFindings.stream()
                .limit(TOP_FLEET_PREDICTIONS)
                .map(p -> FleetPrediction.TopPrediction.builder()
                        .forkliftId(p.getForkliftId())
                        .model(p.getForkliftModel())
                        .location(p.getLocation())
                        .urgencyScore(p.getUrgencyScore())
                        .status(p.getOverallStatus())
                        .topFinding(p.getFindings().get(0))
                        .build())
                .collect(Collectors.toList());

        FleetPrediction.Summary summary = FleetPrediction.Summary.builder()
                .totalUnits(units.size())
                .unitsWithPredictions(withFindings.size())
                .criticalCount(countStatus(analyzed, MaintenancePrediction.Status.CRITICAL))
                .warningCount(countStatus(analyzed, MaintenancePrediction.Status.WARNING))
                .okCount(countStatus(analyzed, MaintenancePrediction.Status.OK))
                .topPredictions(top)
                .build();
        log.info("Fleet predictions generated units={} withFindings={} critical={} warning={}",
                units.size(), withFindings.size(), summary.getCriticalCount(), summary.getWarningCount());

        return FleetPrediction.builder()
                .summary(summary)
                .predictions(withFindings)
                .generatedAt(LocalDateTime.now(clock))
                .build();
    }

    private static int countStatus(List<MaintenancePrediction> predictions, MaintenancePrediction.Status status) {
        return (int) predictions.stream().filter(p -> p.getOverallStatus() == status).count();
    }

    private List<MaintenancePrediction> analyze(List<Forklift> units) {
        List<MaintenancePrediction> out = new ArrayList<>(units.size());
        for (Forklift unit : units) {
            try {
                out.add(generateForkliftPredictions(unit.getId()));
            } catch (RuntimeException e) {
                log.warn("Prediction failed forkliftId={} error={}", unit.getId(), e.getMessage());
            }
        }
        return out;
    }

    @Override
    public MaintenanceSchedule getOptimizedSchedule(int daysAhead) {
        LocalDate today = LocalDate.now(clock);
        List<MaintenanceSchedule.Item> items = new ArrayList<>();
        for (Forklift unit : forkliftRepository.findByStatusNotOrderByIdAsc(Forklift.Status.RETIRED)) {
            try {
                predictNextService(unit).map(ServicePrediction::soonest)
                        .filter(c -> c.getDaysUntil() <= daysAhead)
                        .ifPresent(c -> items.add(MaintenanceSchedule.Item.builder()
                                .forkliftId(unit.getId())
                                .model(unit.getModel())
                                .location(unit.getLocationName())
                                .serviceType("Preventive Maintenance")
                                .predictedDate(c.getPredictedDate())
                                .daysUntil(c.getDaysUntil())
                                .confidence((int) Math.round(c.getConfidence() * 100))
                                .priority(c.getDaysUntil() <= 7 ? Urgency.CRITICAL
                                        : c.getDaysUntil() <= 14 ? Urgency.HIGH : Urgency.MEDIUM)
                                .build()));

                for (ComponentHealth c : componentLifecycleModel.assess(unit.getId()).getComponents()) {
                    if (c.getUrgency() != Urgency.CRITICAL) continue;
                    items.add(MaintenanceSchedule.Item.builder()
                            .forkliftId(unit.getId())
                            .model(unit.getModel())
                            .location(unit.getLocationName())
                            .serviceType(c.getComponent() + " Replacement")
                            .predictedDate(today)
                            .daysUntil(0)
                            .confidence(85)
                            .priority(Urgency.CRITICAL)
                            .component(c.getComponentKey())
                            .build());
                }
            } catch (RuntimeException e) {
                log.warn("Schedule planning failed forkliftId={} error={}", unit.getId(), e.getMessage());
            }
        }
        items.sort(Comparator.comparingInt((MaintenanceSchedule.Item i) -> i.getPriority().rank())
                .thenComparingLong(MaintenanceSchedule.Item::getDaysUntil));

        return MaintenanceSchedule.builder()
                .schedule(items)
                .totalItems(items.size())
                .criticalItems((int) items.stream().filter(i -> i.getPriority() == Urgency.CRITICAL).count())
                .daysAhead(daysAhead)
                .generatedAt(LocalDateTime.now(clock))
                .build();
    }

    @Override
    public List<Alert> createPredictionAlerts() {
        List<Alert> alerts = new ArrayList<>();
        for (MaintenancePrediction prediction : generateFleetPredictions().getPredictions()) {
            if (prediction.getOverallStatus() == MaintenancePrediction.Status.OK) continue;
            for (PredictionFinding finding : prediction.getFindings()) {
                if (finding.getUrgency() != Urgency.CRITICAL && finding.getUrgency() != Urgency.HIGH) continue;
                alerts.add(alertService.createAlert(toAlertRequest(prediction.getForkliftId(), finding)));
            }
        }
        log.info("Prediction alerts processed count={}", alerts.size());
        return alerts;
    }

    private static AlertCreateRequest toAlertRequest(String forkliftId, PredictionFinding finding) {
        String title = finding.getTitle();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("prediction_type", finding.getType().code());
        context.put("confidence", finding.getConfidence());
        context.put("predicted_date", finding.getPredictedDate() == null ? null : finding.getPredictedDate().toString());
        context.put("component", finding.getComponent());
        context.put("pattern_name", finding.getPatternName());
        return AlertCreateRequest.builder()
                .forkliftId(forkliftId)
                .type(AlertType.LIFECYCLE_ALERT)
                .severity(finding.getUrgency() == Urgency.CRITICAL ? AlertSeverity.CRITICAL : AlertSeverity.HIGH)
                .title("Predicted: " + title)
                .message(finding.getDescription())
                .contextData(context)
                .recurrenceKey("prediction_" + forkliftId + "_" + finding.getType().code() + "_"
                        + title.substring(0, Math.min(30, title.length())))
                .build();
    }

    private Forklift requireForklift(String forkliftId) {
        return forkliftRepository.findById(forkliftId).orElseThrow(() -> ResourceNotFoundException.of("Forklift", forkliftId));
    }
}
