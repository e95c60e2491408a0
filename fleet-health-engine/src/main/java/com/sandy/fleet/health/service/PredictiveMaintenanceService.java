package com.sandy.fleet.health.service;

import com.sandy.fleet.health.entity.Alert;
import com.sandy.fleet.health.vo.*;

import java.util.List;
import java.util.Optional;

public interface PredictiveMaintenanceService {

    /** Empty when neither an hours nor a date based service target can be projected. */
    Optional<ServicePrediction> predictNextService(String forkliftId);

    List<FailurePatternMatch> detectFailurePatterns(String forkliftId);

    ComponentHealthReport getComponentHealth(String forkliftId);

    MaintenancePrediction generateForkliftPredictions(String forkliftId);

    FleetPrediction generateFleetPredictions();

    MaintenanceSchedule getOptimizedSchedule(int daysAhead);

    /** Raises lifecycle alerts for the critical and high findings of every unit that is not ok. */
    List<Alert> createPredictionAlerts();
}
