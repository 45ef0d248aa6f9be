package com.iimsoft.jobqueue.scheduling;

import com.iimsoft.jobqueue.TestData;
import com.iimsoft.jobqueue.domain.CustomerImportance;
import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.OptimizationGoals;
import com.iimsoft.jobqueue.domain.PriorityTier;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.iimsoft.jobqueue.TestData.NOW;
import static org.junit.jupiter.api.Assertions.*;

class PriorityScorerTest {

    private final PriorityScorer scorer = new PriorityScorer();

    @Test
    void urgencyWeightFollowsHoursUntilDue() {
        assertEquals(10, scorer.urgencyWeight(NOW.plus(Duration.ofHours(12)), NOW));
        assertEquals(8, scorer.urgencyWeight(NOW.plus(Duration.ofHours(24)), NOW));
        assertEquals(8, scorer.urgencyWeight(NOW.plus(Duration.ofHours(30)), NOW));
        assertEquals(6, scorer.urgencyWeight(NOW.plus(Duration.ofHours(60)), NOW));
        assertEquals(4, scorer.urgencyWeight(NOW.plus(Duration.ofHours(100)), NOW));
        assertEquals(2, scorer.urgencyWeight(NOW.plus(Duration.ofHours(168)), NOW));
    }

    @Test
    void overdueJobsAreMostUrgentAndMissingDueDateLeast() {
        assertEquals(10, scorer.urgencyWeight(NOW.minus(Duration.ofHours(5)), NOW));
        assertEquals(2, scorer.urgencyWeight(null, NOW));
    }

    @Test
    void scoreCombinesTierCustomerDueDateAndProfit() {
        Job job = TestData.dueIn(TestData.job("J1", PriorityTier.CRITICAL, 60, 0), Duration.ofHours(12));
        job.setCustomerImportance(CustomerImportance.VIP);
        job.setProfitMargin(50);
        OptimizationGoals goals = new OptimizationGoals(0.4, 0.2, 0.1, 0.3);

        // 10*0.3 + 1.5*0.4 + 10*5 + 0.5*0.2*10
        assertEquals(54.6, scorer.score(job, goals, NOW), 1e-9);
    }

    @Test
    void unknownTierAndImportanceUseDefaults() {
        Job unknown = TestData.job("J1", null, 60, 0);
        Job normal = TestData.job("J2", PriorityTier.NORMAL, 60, 0);
        normal.setCustomerImportance(CustomerImportance.STANDARD);
        OptimizationGoals goals = TestData.balancedGoals();

        assertEquals(scorer.score(normal, goals, NOW), scorer.score(unknown, goals, NOW), 1e-9);
    }
}
