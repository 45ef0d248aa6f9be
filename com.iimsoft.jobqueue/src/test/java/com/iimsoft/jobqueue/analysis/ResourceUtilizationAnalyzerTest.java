package com.iimsoft.jobqueue.analysis;

import com.iimsoft.jobqueue.TestData;
import com.iimsoft.jobqueue.calendar.WorkCalendar;
import com.iimsoft.jobqueue.config.OptimizerSettings;
import com.iimsoft.jobqueue.domain.Machine;
import com.iimsoft.jobqueue.domain.PriorityTier;
import com.iimsoft.jobqueue.domain.ResourceConstraints;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import com.iimsoft.jobqueue.result.PerformanceMetrics;
import com.iimsoft.jobqueue.result.ResourceUtilization;
import com.iimsoft.jobqueue.scheduling.MachineMatcher;
import com.iimsoft.jobqueue.scheduling.PriorityScorer;
import com.iimsoft.jobqueue.scheduling.ScheduleBuilder;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;

import static com.iimsoft.jobqueue.TestData.NOW;
import static org.junit.jupiter.api.Assertions.*;

class ResourceUtilizationAnalyzerTest {

    private final ResourceUtilizationAnalyzer analyzer = new ResourceUtilizationAnalyzer(85);

    private ResourceUtilization analyze(ResourceConstraints resources) {
        List<Machine> machines = List.of(TestData.machine("M1"));
        List<ScheduledJob> schedule = new ScheduleBuilder(new PriorityScorer(), new MachineMatcher(), OptimizerSettings.defaults())
                .build(List.of(TestData.job("A", PriorityTier.NORMAL, 60, 10)), machines, TestData.balancedGoals(), NOW);
        PerformanceMetrics metrics = new PerformanceAnalyzer()
                .analyze(schedule, machines, WorkCalendar.alwaysWorking(ZoneOffset.UTC), NOW);
        return analyzer.analyze(schedule, machines, resources, metrics, NOW);
    }

    @Test
    void operatorUtilizationSpreadsBusyTimeOverAllOperators() {
        ResourceUtilization usage = analyze(new ResourceConstraints(3));

        assertEquals(100 / 3d, usage.getOperatorUtilization(), 1e-6);
    }

    @Test
    void fullyBookedMachineIsBottleneck() {
        ResourceUtilization usage = analyze(new ResourceConstraints(3));

        ResourceUtilization.MachineEfficiency m1 = usage.getMachineEfficiency().get(0);
        assertEquals("M1", m1.getMachineId());
        assertEquals(100, m1.getUtilization(), 1e-6);
        assertTrue(m1.isBottleneck());
    }

    @Test
    void materialShortageWhenStockBelowRequiredParts() {
        ResourceConstraints resources = new ResourceConstraints(3);
        resources.getMaterialAvailability().add(new ResourceConstraints.MaterialStock("Steel", 5, 2));
        resources.getMaterialAvailability().add(new ResourceConstraints.MaterialStock("aluminum", 50, 2));

        List<ResourceUtilization.MaterialUsage> materials = analyze(resources).getMaterialUsage();

        assertEquals(10, materials.get(0).getRequiredParts());
        assertEquals(100, materials.get(0).getUtilization(), 1e-9);
        assertTrue(materials.get(0).isShortage());
        assertEquals(0, materials.get(1).getRequiredParts());
        assertFalse(materials.get(1).isShortage());
    }

    @Test
    void thinShiftNeedsOvertimeAndMissingToolingIsIdle() {
        ResourceConstraints resources = new ResourceConstraints(3);
        resources.getOperatorShifts().add(new ResourceConstraints.OperatorShift("night", LocalTime.of(22, 0), LocalTime.of(6, 0), 1));
        resources.getOperatorShifts().add(new ResourceConstraints.OperatorShift("day", LocalTime.of(6, 0), LocalTime.of(14, 0), 3));
        resources.getToolingAvailability().add(new ResourceConstraints.ToolingStock("nozzle-2mm", false, 10));

        ResourceUtilization usage = analyze(resources);

        assertEquals(40, usage.getShiftCoverage().get(0).getCoverage(), 1e-9);
        assertTrue(usage.getShiftCoverage().get(0).isOvertime());
        assertEquals(100, usage.getShiftCoverage().get(1).getCoverage(), 1e-9);
        assertFalse(usage.getShiftCoverage().get(1).isOvertime());
        assertEquals(0, usage.getToolingUtilization().get(0).getUtilization(), 1e-9);
        assertFalse(usage.getToolingUtilization().get(0).isAvailability());
    }
}
