package com.sandy.fleet.health.service;

import com.sandy.fleet.health.entity.MaintenanceRecord;
import com.sandy.fleet.health.vo.ComponentHealth;
import com.sandy.fleet.health.vo.ComponentLifecycleDefinition;
import com.sandy.fleet.health.vo.ComponentLifecycleDefinition.Applicability;
import com.sandy.fleet.health.vo.Urgency;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ComponentLifecycleModelTest {

    private final ComponentLifecycleDefinition brakePads =
            new ComponentLifecycleDefinition("brake_pads", 2000, 0.75, "brakes", Applicability.ALL);
    private final ComponentLifecycleDefinition hydraulicFilter =
            new ComponentLifecycleDefinition("hydraulic_filter", 1000, 0.90, "hydraulic", Applicability.ALL);

    @Test
    void lifeUsedIsClampedAndOverdueAtHundredPercent() {
        ComponentHealth h = ComponentLifecycleModel.evaluate(brakePads, 2500, null);

        assertEquals(100d, h.getLifeUsedPercent(), 1e-9);
        assertEquals(ComponentHealth.Status.OVERDUE, h.getStatus());
        assertEquals(Urgency.CRITICAL, h.getUrgency());
        assertEquals(0, h.getRemainingHours());
        assertEquals("Brake Pads", h.getComponent());
    }

    @Test
    void statusFollowsWarningThresholdThenMonitorBand() {
        assertEquals(ComponentHealth.Status.DUE_SOON, ComponentLifecycleModel.evaluate(brakePads, 1600, null).getStatus());
        assertEquals(ComponentHealth.Status.DUE_SOON, ComponentLifecycleModel.evaluate(brakePads, 1500, null).getStatus());
        assertEquals(ComponentHealth.Status.MONITOR, ComponentLifecycleModel.evaluate(brakePads, 1420, null).getStatus());
        assertEquals(ComponentHealth.Status.GOOD, ComponentLifecycleModel.evaluate(brakePads, 1000, null).getStatus());

        // a 90% threshold leaves 85% in the monitor band
        ComponentHealth filter = ComponentLifecycleModel.evaluate(hydraulicFilter, 850, null);
        assertEquals(ComponentHealth.Status.MONITOR, filter.getStatus());
        assertEquals(Urgency.MEDIUM, filter.getUrgency());
        assertEquals(150, filter.getRemainingHours());
    }

    @Test
    void lastServiceResetsTheClock() {
        MaintenanceRecord service = MaintenanceRecord.builder()
                .category("brakes").hoursAtService(2000d).serviceDate(LocalDate.of(2024, 3, 1)).build();

        ComponentHealth h = ComponentLifecycleModel.evaluate(brakePads, 2100, service);

        assertEquals(100d, h.getHoursSinceService(), 1e-9);
        assertEquals(5d, h.getLifeUsedPercent(), 1e-9);
        assertEquals(ComponentHealth.Status.GOOD, h.getStatus());
        assertEquals(Urgency.NONE, h.getUrgency());
        assertEquals(LocalDate.of(2024, 3, 1), h.getLastServiceDate());
    }

    @Test
    void meterBehindLastServiceNeverGoesNegative() {
        MaintenanceRecord service = MaintenanceRecord.builder().category("brakes").hoursAtService(3000d).build();

        ComponentHealth h = ComponentLifecycleModel.evaluate(brakePads, 2500, service);

        assertEquals(0d, h.getHoursSinceService(), 1e-9);
        assertEquals(0d, h.getLifeUsedPercent(), 1e-9);
        assertEquals(2000, h.getRemainingHours());
    }
}
