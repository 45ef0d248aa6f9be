package com.iimsoft.jobqueue.insight;

import com.iimsoft.jobqueue.TestData;
import com.iimsoft.jobqueue.config.OptimizerSettings;
import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.JobQueueProblem;
import com.iimsoft.jobqueue.domain.PriorityTier;
import com.iimsoft.jobqueue.engine.JobQueueOptimizer;
import com.iimsoft.jobqueue.result.OptimizationResult;
import com.iimsoft.jobqueue.result.SensitivityAnalysis;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SensitivityAnalyzerTest {

    private final JobQueueOptimizer optimizer = new JobQueueOptimizer(OptimizerSettings.defaults());

    @Test
    void capacityChangesScaleTheMakespan() {
        JobQueueProblem problem = TestData.problem(
                List.of(TestData.job("A", PriorityTier.NORMAL, 60, 0)), List.of(TestData.machine("M1")));

        SensitivityAnalysis sensitivity = optimizer.optimize(problem).getSensitivityAnalysis();

        SensitivityAnalysis.CapacityCase more = sensitivity.getMachineCapacity().get(0);
        SensitivityAnalysis.CapacityCase less = sensitivity.getMachineCapacity().get(1);
        assertEquals("+20% capacity", more.getScenario());
        assertEquals(50 / 60d, more.getMakespan(), 1e-6);
        assertEquals("Significant improvement in throughput", more.getImpact());
        assertEquals("-20% capacity", less.getScenario());
        assertEquals(1.25, less.getMakespan(), 1e-6);
        assertEquals(100, less.getUtilization(), 1e-6);
        assertEquals("High utilization with limited flexibility", less.getImpact());
    }

    @Test
    void balancedPrioritiesMirrorTheBaseline() {
        JobQueueProblem problem = TestData.problem(
                List.of(TestData.job("A", PriorityTier.NORMAL, 60, 0)), List.of(TestData.machine("M1")));

        OptimizationResult result = optimizer.optimize(problem);
        List<SensitivityAnalysis.PriorityCase> priority = result.getSensitivityAnalysis().getJobPriority();

        assertEquals("All jobs high priority", priority.get(0).getScenario());
        assertEquals("Tiers do not change delivery performance", priority.get(0).getImpact());
        assertEquals("Balanced priorities", priority.get(1).getScenario());
        assertEquals(result.getPerformanceMetrics().getElapsedMakespan(), priority.get(1).getMakespan(), 1e-9);
        assertEquals("Current optimal balance", priority.get(1).getImpact());
    }

    @Test
    void flattenedPrioritiesLetShortJobWithEarlierDueDateGoFirst() {
        Job shortLow = TestData.dueIn(TestData.job("SHORT", PriorityTier.LOW, 30, 0), Duration.ofMinutes(40));
        Job longCritical = TestData.dueIn(TestData.job("LONG", PriorityTier.CRITICAL, 60, 0), Duration.ofMinutes(100));
        JobQueueProblem problem = TestData.problem(List.of(shortLow, longCritical), List.of(TestData.machine("M1")));

        OptimizationResult result = optimizer.optimize(problem);
        SensitivityAnalysis.PriorityCase allHigh = result.getSensitivityAnalysis().getJobPriority().get(0);

        assertEquals(50, result.getPerformanceMetrics().getOnTimeDeliveryRate(), 1e-9);
        assertEquals(100, allHigh.getOnTimeRate(), 1e-9);
        assertEquals("Due dates alone deliver better (+50.0% on-time), review tier assignments", allHigh.getImpact());
    }

    @Test
    void rebuildsLeaveTheSubmittedJobsUntouched() {
        Job job = TestData.job("A", PriorityTier.LOW, 60, 10);
        JobQueueProblem problem = TestData.problem(List.of(job), List.of(TestData.machine("M1")));

        optimizer.optimize(problem);

        assertEquals(PriorityTier.LOW, job.getPriority());
        assertEquals(60, job.getEstimatedDuration(), 1e-9);
        assertEquals(10, job.getSetupTime(), 1e-9);
    }
}
