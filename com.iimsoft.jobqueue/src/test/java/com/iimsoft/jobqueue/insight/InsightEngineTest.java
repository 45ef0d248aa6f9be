package com.iimsoft.jobqueue.insight;

import com.iimsoft.jobqueue.TestData;
import com.iimsoft.jobqueue.config.OptimizerSettings;
import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.JobQueueProblem;
import com.iimsoft.jobqueue.domain.PriorityTier;
import com.iimsoft.jobqueue.domain.QualityRequirements;
import com.iimsoft.jobqueue.engine.JobQueueOptimizer;
import com.iimsoft.jobqueue.result.OptimizationResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InsightEngineTest {

    private final JobQueueOptimizer optimizer = new JobQueueOptimizer(OptimizerSettings.defaults());

    @Test
    void onTimeScheduleGetsSummaryWithoutBufferAdvice() {
        JobQueueProblem problem = TestData.problem(
                List.of(TestData.job("A", PriorityTier.NORMAL, 60, 0)), List.of(TestData.machine("M1")));

        OptimizationResult result = optimizer.optimize(problem);

        assertEquals(List.of("Optimized schedule for 1 jobs", "Total makespan: 1.0 hours", "On-time delivery rate: 100.0%"),
                result.getRecommendations());
        assertTrue(result.getAlertsAndRecommendations().getUrgentActions().isEmpty());
    }

    @Test
    void lateJobsTriggerUrgentActionsAndBufferAdvice() {
        Job late = TestData.dueIn(TestData.job("LATE", PriorityTier.URGENT, 180, 0), Duration.ofHours(1));
        JobQueueProblem problem = TestData.problem(List.of(late), List.of(TestData.machine("M1")));

        OptimizationResult result = optimizer.optimize(problem);

        List<String> urgent = result.getAlertsAndRecommendations().getUrgentActions();
        assertTrue(urgent.contains("On-time delivery rate below target - review schedule"));
        assertTrue(urgent.contains("1 job(s) projected to miss their due date"));
        assertTrue(result.getRecommendations().contains("Consider adding buffer time to improve delivery performance"));
    }

    @Test
    void unassignableJobAsksForCapability() {
        Job aluminum = TestData.job("AL", PriorityTier.NORMAL, 60, 0);
        aluminum.setMaterialType("aluminum");
        JobQueueProblem problem = TestData.problem(
                List.of(aluminum, TestData.job("ST", PriorityTier.NORMAL, 60, 0)), List.of(TestData.machine("M1")));

        OptimizationResult result = optimizer.optimize(problem);

        assertTrue(result.getOptimizationInsights().getCapacityRecommendations()
                .contains("Add capability for 1 unassignable job(s)"));
        assertTrue(result.getAlertsAndRecommendations().getUrgentActions()
                .contains("Resolve jobs without a compatible machine"));
    }

    @Test
    void materialChangeoversSuggestGrouping() {
        Job steel = TestData.job("ST", PriorityTier.NORMAL, 60, 10);
        Job aluminum = TestData.job("AL", PriorityTier.NORMAL, 60, 10);
        aluminum.setMaterialType("aluminum");
        JobQueueProblem problem = TestData.problem(List.of(steel, aluminum),
                List.of(TestData.machine("M1", "steel", "aluminum")));

        OptimizationResult result = optimizer.optimize(problem);

        assertTrue(result.getOptimizationInsights().getSchedulingStrategies().contains("Group similar jobs to minimize setups"));
        assertTrue(result.getAlertsAndRecommendations().getEfficiencyImprovements().contains("Group similar jobs to reduce setup time"));
    }

    @Test
    void fullInspectionRaisesQualityAlert() {
        JobQueueProblem problem = TestData.problem(
                List.of(TestData.job("A", PriorityTier.NORMAL, 60, 0)), List.of(TestData.machine("M1")));
        problem.setQualityRequirements(new QualityRequirements(2, 0, "full", 8));

        OptimizationResult result = optimizer.optimize(problem);

        assertTrue(result.getAlertsAndRecommendations().getQualityAlerts().contains("Reserve inspection capacity for full inspection"));
    }

    @Test
    void singleBusyMachineIsReportedAsBottleneck() {
        JobQueueProblem problem = TestData.problem(
                List.of(TestData.job("A", PriorityTier.NORMAL, 60, 0)), List.of(TestData.machine("M1")));

        OptimizationResult result = optimizer.optimize(problem);

        assertTrue(result.getOptimizationInsights().getBottleneckIdentification()
                .contains("Machines at or above bottleneck utilization: M1"));
    }
}
