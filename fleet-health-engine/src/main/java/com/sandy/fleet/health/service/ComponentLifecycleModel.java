package com.sandy.fleet.health.service;

import com.sandy.fleet.health.entity.Forklift;
import com.sandy.fleet.health.entity.MaintenanceRecord;
import com.sandy.fleet.health.exception.ResourceNotFoundException;
import com.sandy.fleet.health.repository.ForkliftRepository;
import com.sandy.fleet.health.repository.MaintenanceRecordRepository;
import com.sandy.fleet.health.vo.ComponentHealth;
import com.sandy.fleet.health.vo.ComponentHealthReport;
import com.sandy.fleet.health.vo.ComponentLifecycleDefinition;
import com.sandy.fleet.health.vo.ComponentLifecycleDefinition.Applicability;
import com.sandy.fleet.health.vo.Urgency;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Wear model per subsystem: hours since the last completed service in the
 * component's category against its expected service life.
 */
@Component
@RequiredArgsConstructor
public class ComponentLifecycleModel {

    static final double MONITOR_PERCENT = 70;

    private static final Map<String, ComponentLifecycleDefinition> CATALOG = catalog();

    private final ForkliftRepository forkliftRepository;
    private final MaintenanceRecordRepository maintenanceRepository;

    private static Map<String, ComponentLifecycleDefinition> catalog() {
        Map<String, ComponentLifecycleDefinition> m = new LinkedHashMap<>();
        put(m, "drive_motor", 15000, 0.85, "electrical", Applicability.ALL);
        put(m, "drive_controller", 12000, 0.80, "electrical", Applicability.ALL);
        put(m, "transmission", 10000, 0.85, "transmission", Applicability.ALL);
        put(m, "hydraulic_pump", 8000, 0.80, "hydraulic", Applicability.ALL);
        put(m, "hydraulic_cylinder", 10000, 0.85, "hydraulic", Applicability.ALL);
        put(m, "hydraulic_hoses", 5000, 0.75, "hydraulic", Applicability.ALL);
        put(m, "hydraulic_filter", 1000, 0.90, "hydraulic", Applicability.ALL);
        put(m, "mast_chain", 6000, 0.80, "mast", Applicability.ALL);
        put(m, "mast_rollers", 5000, 0.85, "mast", Applicability.ALL);
        put(m, "fork_carriage", 12000, 0.90, "mast", Applicability.ALL);
        put(m, "brake_pads", 2000, 0.75, "brakes", Applicability.ALL);
        put(m, "brake_master_cylinder", 8000, 0.85, "brakes", Applicability.ALL);
        put(m, "parking_brake", 5000, 0.80, "brakes", Applicability.ALL);
        put(m, "load_wheels", 3000, 0.80, "tires", Applicability.ALL);
        put(m, "drive_tires", 4000, 0.80, "tires", Applicability.ALL);
        put(m, "steer_tires", 4500, 0.80, "tires", Applicability.ALL);
        put(m, "battery", 6000, 0.85, "battery", Applicability.ELECTRIC_ONLY);
        put(m, "charger", 10000, 0.90, "battery", Applicability.ELECTRIC_ONLY);
        put(m, "contactor", 8000, 0.85, "electrical", Applicability.ELECTRIC_ONLY);
        put(m, "spark_plugs", 1000, 0.90, "engine", Applicability.COMBUSTION_ONLY);
        put(m, "fuel_filter", 500, 0.85, "fuel_system", Applicability.COMBUSTION_ONLY);
        put(m, "air_filter", 500, 0.85, "engine", Applicability.COMBUSTION_ONLY);
        put(m, "lpg_regulator", 4000, 0.80, "fuel_system", Applicability.COMBUSTION_ONLY);
        return Collections.unmodifiableMap(m);
    }

    private static void put(Map<String, ComponentLifecycleDefinition> m, String key, double hours, double threshold,
                            String category, Applicability applicability) {
        m.put(key, new ComponentLifecycleDefinition(key, hours, threshold, category, applicability));
    }

    public Collection<ComponentLifecycleDefinition> definitions() {
        return CATALOG.values();
    }

    public List<ComponentLifecycleDefinition> definitionsFor(Forklift forklift) {
        boolean electric = forklift.isElectric();
        return CATALOG.values().stream().filter(d -> d.appliesTo(electric)).collect(Collectors.toList());
    }

    public ComponentHealthReport assess(String forkliftId) {
        Forklift forklift = requireForklift(forkliftId);
        double currentHours = hours(forklift);
        Map<String, Optional<MaintenanceRecord>> lastByCategory = new HashMap<>();

        List<ComponentHealth> components = new ArrayList<>();
        for (ComponentLifecycleDefinition def : definitionsFor(forklift)) {
            Optional<MaintenanceRecord> last = lastByCategory.computeIfAbsent(def.getCategory(),
                    c -> lastCompletedService(forkliftId, c));
            components.add(evaluate(def, currentHours, last.orElse(null)));
        }
        components.sort(Comparator.comparingInt((ComponentHealth c) -> c.getUrgency().rank())
                .thenComparing(ComponentHealth::getLifeUsedPercent, Comparator.reverseOrder()));

        return ComponentHealthReport.builder()
                .forkliftId(forkliftId)
                .currentHours(currentHours)
                .fuelType(forklift.getFuelType())
                .components(components)
                .criticalCount((int) components.stream().filter(c -> c.getUrgency() == Urgency.CRITICAL).count())
                .warningCount((int) components.stream().filter(c -> c.getUrgency() == Urgency.HIGH).count())
                .build();
    }

    /** Empty for a key that is unknown or does not apply to the unit's fuel type. */
    public Optional<ComponentHealth> assessComponent(String forkliftId, String componentKey) {
        Forklift forklift = requireForklift(forkliftId);
        ComponentLifecycleDefinition def = CATALOG.get(componentKey);
        if (def == null || !def.appliesTo(forklift.isElectric())) {
            return Optional.empty();
        }
        MaintenanceRecord last = lastCompletedService(forkliftId, def.getCategory()).orElse(null);
        return Optional.of(evaluate(def, hours(forklift), last));
    }

    static ComponentHealth evaluate(ComponentLifecycleDefinition def, double currentHours, MaintenanceRecord lastService) {
        double hoursAtService = lastService == null || lastService.getHoursAtService() == null
                ? 0 : lastService.getHoursAtService();
        double since = Math.max(0, currentHours - hoursAtService);
        double expected = def.getExpectedHours();
        double lifeUsed = Math.min(100, Math.max(0, since / Math.max(1, expected) * 100));

        ComponentHealth.Status status;
        Urgency urgency;
        if (lifeUsed >= 100) {
            status = ComponentHealth.Status.OVERDUE;
            urgency = Urgency.CRITICAL;
        } else if (lifeUsed >= def.getWarningThreshold() * 100) {
            status = ComponentHealth.Status.DUE_SOON;
            urgency = Urgency.HIGH;
        } else if (lifeUsed >= MONITOR_PERCENT) {
            status = ComponentHealth.Status.MONITOR;
            urgency = Urgency.MEDIUM;
        } else {
            status = ComponentHealth.Status.GOOD;
            urgency = Urgency.NONE;
        }

        return ComponentHealth.builder()
                .componentKey(def.getKey())
                .component(def.displayName())
                .category(def.getCategory())
                .expectedLifeHours(expected)
                .hoursSinceService(since)
                .remainingHours(Math.round(Math.max(0, expected - since)))
                .lifeUsedPercent(lifeUsed)
                .status(status)
                .urgency(urgency)
                .lastServiceDate(lastService == null ? null : lastService.getServiceDate())
                .build();
    }

    private Optional<MaintenanceRecord> lastCompletedService(String forkliftId, String category) {
        return maintenanceRepository.findTopByForkliftIdAndCategoryAndStatusOrderByServiceDateDescIdDesc(
                forkliftId, category, MaintenanceRecord.Status.COMPLETED);
    }

    private static double hours(Forklift forklift) {
        return forklift.getCurrentHours() == null ? 0 : forklift.getCurrentHours();
    }

    private Forklift requireForklift(String forkliftId) {
        return forkliftRepository.findById(forkliftId).orElseThrow(() -> ResourceNotFoundException.of("Forklift", forkliftId));
    }
}
