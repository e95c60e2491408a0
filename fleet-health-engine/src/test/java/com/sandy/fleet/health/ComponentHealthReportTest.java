package com.sandy.fleet.health;

import com.sandy.fleet.health.entity.Forklift;
import com.sandy.fleet.health.entity.MaintenanceRecord;
import com.sandy.fleet.health.repository.ForkliftRepository;
import com.sandy.fleet.health.repository.MaintenanceRecordRepository;
import com.sandy.fleet.health.service.ComponentLifecycleModel;
import com.sandy.fleet.health.vo.ComponentHealth;
import com.sandy.fleet.health.vo.ComponentHealthReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class ComponentHealthReportTest {

    @Autowired ComponentLifecycleModel componentLifecycleModel;
    @Autowired ForkliftRepository forkliftRepository;
    @Autowired MaintenanceRecordRepository maintenanceRepository;

    @BeforeEach
    void init() {
        maintenanceRepository.deleteAll();
        forkliftRepository.deleteAll();
        forkliftRepository.save(Forklift.builder().id("E-1").fuelType(Forklift.FuelType.ELECTRIC).currentHours(1600d).build());
        forkliftRepository.save(Forklift.builder().id("P-1").fuelType(Forklift.FuelType.PROPANE).currentHours(1600d).build());
    }

    @Test
    void catalogIsFilteredByFuelType() {
        assertEquals(23, componentLifecycleModel.definitions().size());

        List<String> electric = keys(componentLifecycleModel.assess("E-1"));
        List<String> propane = keys(componentLifecycleModel.assess("P-1"));

        assertEquals(19, electric.size());
        assertTrue(electric.contains("battery"));
        assertFalse(electric.contains("spark_plugs"));
        assertEquals(20, propane.size());
        assertTrue(propane.contains("lpg_regulator"));
        assertFalse(propane.contains("charger"));
    }

    @Test
    void reportIsSortedByUrgencyThenLifeUsed() {
        ComponentHealthReport report = componentLifecycleModel.assess("E-1");
        List<ComponentHealth> c = report.getComponents();

        // 1600 hours: hydraulic filter (1000) overdue, brake pads (2000) at 80% due soon
        assertEquals("hydraulic_filter", c.get(0).getComponentKey());
        assertEquals("brake_pads", c.get(1).getComponentKey());
        assertEquals(1, report.getCriticalCount());
        assertEquals(1, report.getWarningCount());
        for (int i = 1; i < c.size(); i++) {
            ComponentHealth prev = c.get(i - 1);
            ComponentHealth cur = c.get(i);
            assertTrue(prev.getUrgency().rank() <= cur.getUrgency().rank());
            if (prev.getUrgency() == cur.getUrgency()) {
                assertTrue(prev.getLifeUsedPercent() >= cur.getLifeUsedPercent());
            }
        }
    }

    @Test
    void onlyCompletedServiceInCategoryCounts() {
        maintenanceRepository.save(MaintenanceRecord.builder().forkliftId("E-1").type(MaintenanceRecord.Type.PREVENTIVE)
                .category("hydraulic").hoursAtService(1500d).serviceDate(LocalDate.now().minusDays(10)).build());
        maintenanceRepository.save(MaintenanceRecord.builder().forkliftId("E-1").type(MaintenanceRecord.Type.REPAIR)
                .category("brakes").status(MaintenanceRecord.Status.CANCELLED)
                .hoursAtService(1550d).serviceDate(LocalDate.now().minusDays(5)).build());

        ComponentHealth filter = componentLifecycleModel.assessComponent("E-1", "hydraulic_filter").orElseThrow();
        ComponentHealth pads = componentLifecycleModel.assessComponent("E-1", "brake_pads").orElseThrow();

        assertEquals(100d, filter.getHoursSinceService(), 1e-9);
        assertEquals(ComponentHealth.Status.GOOD, filter.getStatus());
        assertEquals(1600d, pads.getHoursSinceService(), 1e-9);
        assertEquals(ComponentHealth.Status.DUE_SOON, pads.getStatus());
    }

    @Test
    void unknownOrInapplicableComponentIsEmpty() {
        assertTrue(componentLifecycleModel.assessComponent("E-1", "flux_capacitor").isEmpty());
        assertTrue(componentLifecycleModel.assessComponent("E-1", "spark_plugs").isEmpty());
        assertTrue(componentLifecycleModel.assessComponent("P-1", "spark_plugs").isPresent());
    }

    private static List<String> keys(ComponentHealthReport report) {
        return report.getComponents().stream().map(ComponentHealth::getComponentKey).toList();
    }
}
