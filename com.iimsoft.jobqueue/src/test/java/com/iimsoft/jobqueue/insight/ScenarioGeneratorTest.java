package com.iimsoft.jobqueue.insight;

import com.iimsoft.jobqueue.TestData;
import com.iimsoft.jobqueue.config.OptimizerSettings;
import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.JobQueueProblem;
import com.iimsoft.jobqueue.domain.OptimizationGoals;
import com.iimsoft.jobqueue.domain.PriorityTier;
import com.iimsoft.jobqueue.engine.JobQueueOptimizer;
import com.iimsoft.jobqueue.result.OptimizationResult;
import com.iimsoft.jobqueue.result.Scenario;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioGeneratorTest {

    private final JobQueueOptimizer optimizer = new JobQueueOptimizer(OptimizerSettings.defaults());

    private static JobQueueProblem urgencyFirstProblem() {
        Job critical = TestData.dueIn(TestData.job("CRIT", PriorityTier.CRITICAL, 60, 0), Duration.ofHours(200));
        Job lucrative = TestData.dueIn(TestData.job("RICH", PriorityTier.LOW, 60, 0), Duration.ofHours(200));
        lucrative.setProfitMargin(100);
        JobQueueProblem problem = TestData.problem(List.of(critical, lucrative), List.of(TestData.machine("M1")));
        problem.setOptimizationGoals(new OptimizationGoals(0.1, 0.0, 0.0, 0.9));
        return problem;
    }

    @Test
    void threeNamedScenariosInFixedOrder() {
        List<Scenario> scenarios = optimizer.optimize(urgencyFirstProblem()).getAlternativeSchedules();

        assertEquals(List.of("Minimum Makespan", "Maximum Profit", "Balanced Approach"),
                scenarios.stream().map(Scenario::getScenarioName).collect(Collectors.toList()));
    }

    @Test
    void balancedScenarioIsTheBaseline() {
        OptimizationResult result = optimizer.optimize(urgencyFirstProblem());
        Scenario balanced = result.getAlternativeSchedules().get(2);

        assertEquals(result.getPerformanceMetrics().getElapsedMakespan(), balanced.getMakespan(), 1e-9);
        assertEquals(result.getScheduleScore(), balanced.getScore());
        assertEquals(List.of("CRIT", "RICH"), balanced.getJobSequence());
        assertEquals(List.of("Moderate performance across all metrics"), balanced.getTradeoffs());
    }

    @Test
    void profitScenarioReordersTowardsMargin() {
        Scenario profit = optimizer.optimize(urgencyFirstProblem()).getAlternativeSchedules().get(1);

        assertEquals(List.of("RICH", "CRIT"), profit.getJobSequence());
        assertTrue(profit.getTradeoffs().contains("Different job sequence, less flexibility for rush orders"));
    }

    @Test
    void minimumMakespanPlacesScarceCapabilityFirst() {
        Job aluminum = TestData.job("AL", PriorityTier.NORMAL, 120, 0);
        aluminum.setMaterialType("aluminum");
        JobQueueProblem problem = TestData.problem(List.of(
                        TestData.job("S1", PriorityTier.NORMAL, 60, 0),
                        TestData.job("S2", PriorityTier.NORMAL, 60, 0),
                        aluminum),
                List.of(TestData.machine("M1", "steel", "aluminum"), TestData.machine("M2", "steel")));

        OptimizationResult result = optimizer.optimize(problem);
        Scenario fastest = result.getAlternativeSchedules().get(0);

        assertEquals(3.1, result.getPerformanceMetrics().getElapsedMakespan(), 1e-9);
        assertEquals(2.1, fastest.getMakespan(), 1e-9);
        assertEquals(List.of("AL", "S1", "S2"), fastest.getJobSequence());
        assertTrue(fastest.getTradeoffs().contains("Shorter completion time (-1.0 h)"));
    }

    @Test
    void minimumMakespanNeverExceedsTheBaseline() {
        Job critical = TestData.job("A", PriorityTier.CRITICAL, 120, 0);
        critical.setMaterialType("aluminum");
        Job b = TestData.job("B", PriorityTier.LOW, 60, 0);
        b.setProfitMargin(100);
        Job c = TestData.job("C", PriorityTier.LOW, 60, 0);
        c.setProfitMargin(100);
        JobQueueProblem problem = TestData.problem(List.of(critical, b, c),
                List.of(TestData.machine("M1", "steel"), TestData.machine("M2", "steel", "aluminum")));
        problem.setOptimizationGoals(new OptimizationGoals(0.1, 0.0, 0.0, 0.9));

        OptimizationResult result = optimizer.optimize(problem);
        Scenario fastest = result.getAlternativeSchedules().get(0);

        assertTrue(fastest.getMakespan() <= result.getPerformanceMetrics().getElapsedMakespan() + 1e-9);
        assertFalse(fastest.getTradeoffs().stream().anyMatch(t -> t.startsWith("Longer completion time")));
    }
}
