package com.iimsoft.jobqueue.analysis;

import com.iimsoft.jobqueue.TestData;
import com.iimsoft.jobqueue.domain.AssignmentStatus;
import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.JobQueueProblem;
import com.iimsoft.jobqueue.domain.PriorityTier;
import com.iimsoft.jobqueue.domain.ResourceConstraints;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import com.iimsoft.jobqueue.result.RiskAssessment;
import com.iimsoft.jobqueue.result.RiskLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.iimsoft.jobqueue.TestData.NOW;
import static org.junit.jupiter.api.Assertions.*;

class RiskAssessorTest {

    @Test
    void ladderThresholds() {
        assertEquals(RiskLevel.LOW, RiskAssessor.scheduleRisk(0, 1, 2));
        assertEquals(RiskLevel.LOW, RiskAssessor.scheduleRisk(2, 8, 2));
        assertEquals(RiskLevel.MEDIUM, RiskAssessor.scheduleRisk(3, 1, 2));
        assertEquals(RiskLevel.MEDIUM, RiskAssessor.scheduleRisk(0, 9, 2));
        assertEquals(RiskLevel.MEDIUM, RiskAssessor.scheduleRisk(3, 12, 2));
        assertEquals(RiskLevel.HIGH, RiskAssessor.scheduleRisk(4, 1, 2));
        assertEquals(RiskLevel.HIGH, RiskAssessor.scheduleRisk(0, 13, 2));
        assertEquals(RiskLevel.HIGH, RiskAssessor.scheduleRisk(0, 1, 1));
        assertEquals(RiskLevel.HIGH, RiskAssessor.scheduleRisk(5, 15, 2));
        assertEquals(RiskLevel.CRITICAL, RiskAssessor.scheduleRisk(6, 1, 2));
        assertEquals(RiskLevel.CRITICAL, RiskAssessor.scheduleRisk(0, 16, 2));
        assertEquals(RiskLevel.CRITICAL, RiskAssessor.scheduleRisk(0, 1, 0));
    }

    @Test
    void riskNeverDecreasesWithMoreUrgentJobsOrMoreJobs() {
        for (int machines = 0; machines <= 3; machines++) {
            for (int urgent = 0; urgent <= 8; urgent++) {
                for (int jobs = 1; jobs <= 20; jobs++) {
                    RiskLevel level = RiskAssessor.scheduleRisk(urgent, jobs, machines);
                    assertTrue(RiskAssessor.scheduleRisk(urgent + 1, jobs, machines).isAtLeast(level));
                    assertTrue(RiskAssessor.scheduleRisk(urgent, jobs + 1, machines).isAtLeast(level));
                }
            }
        }
    }

    @Test
    void bufferAdequacyHasASixtyPercentFloor() {
        assertEquals(100, RiskAssessor.bufferAdequacy(0), 1e-9);
        assertEquals(85, RiskAssessor.bufferAdequacy(5), 1e-9);
        assertEquals(60, RiskAssessor.bufferAdequacy(20), 1e-9);
    }

    @Test
    void riskFactorsReflectQueueAndResources() {
        List<Job> jobs = List.of(
                TestData.job("U1", PriorityTier.URGENT, 60, 0),
                TestData.job("U2", PriorityTier.CRITICAL, 60, 0),
                TestData.job("U3", PriorityTier.URGENT, 200, 0),
                TestData.job("N1", PriorityTier.NORMAL, 30, 0));
        JobQueueProblem problem = TestData.problem(jobs, List.of(TestData.machine("M1")));
        problem.setResourceConstraints(new ResourceConstraints(2));

        RiskAssessment risk = new RiskAssessor().assess(problem, assigned(jobs));

        assertEquals(RiskLevel.HIGH, risk.getScheduleRisk());
        assertTrue(risk.getRiskFactors().contains("High number of urgent jobs in queue"));
        assertTrue(risk.getRiskFactors().contains("Limited machine availability"));
        assertTrue(risk.getRiskFactors().contains("Insufficient operator coverage"));
        assertFalse(risk.getRiskFactors().contains("Large job queue may cause delays"));
        assertFalse(risk.getRiskFactors().contains("Jobs without a compatible machine"));
        assertTrue(risk.getContingencyPlans().contains("Schedule overtime shifts for critical jobs"));
        assertEquals(88, risk.getBufferAdequacy(), 1e-9);
    }

    @Test
    void deliveryRiskCoversTheFirstThreeJobs() {
        List<Job> jobs = List.of(
                TestData.job("C", PriorityTier.CRITICAL, 60, 0),
                TestData.job("U", PriorityTier.URGENT, 60, 0),
                TestData.job("N", PriorityTier.NORMAL, 60, 0),
                TestData.job("L", PriorityTier.LOW, 60, 0));
        JobQueueProblem problem = TestData.problem(jobs, List.of(TestData.machine("M1"), TestData.machine("M2")));

        RiskAssessment risk = new RiskAssessor().assess(problem, assigned(jobs));

        assertEquals(3, risk.getDeliveryRisk().size());
        assertEquals(RiskLevel.HIGH, risk.getDeliveryRisk().get(0).getRiskLevel());
        assertEquals(RiskLevel.MEDIUM, risk.getDeliveryRisk().get(1).getRiskLevel());
        assertEquals(RiskLevel.LOW, risk.getDeliveryRisk().get(2).getRiskLevel());
    }

    @Test
    void bufferRecommendationIsFifteenPercentWithFloor() {
        List<Job> jobs = List.of(
                TestData.job("LONG", PriorityTier.NORMAL, 200, 0),
                TestData.job("SHORT", PriorityTier.NORMAL, 60, 0));
        JobQueueProblem problem = TestData.problem(jobs, List.of(TestData.machine("M1"), TestData.machine("M2")));

        RiskAssessment risk = new RiskAssessor().assess(problem, assigned(jobs));

        assertEquals(30, risk.getBufferRecommendations().get(0).getRecommendedBuffer(), 1e-9);
        assertEquals(15, risk.getBufferRecommendations().get(1).getRecommendedBuffer(), 1e-9);
    }

    @Test
    void unassignedJobIsARiskFactor() {
        Job job = TestData.job("A", PriorityTier.NORMAL, 60, 0);
        JobQueueProblem problem = TestData.problem(List.of(job), List.of(TestData.machine("M1"), TestData.machine("M2")));
        List<ScheduledJob> schedule = List.of(new ScheduledJob(job, null, AssignmentStatus.UNASSIGNED, NOW, 0, 1, 6));

        RiskAssessment risk = new RiskAssessor().assess(problem, schedule);

        assertTrue(risk.getRiskFactors().contains("Jobs without a compatible machine"));
    }

    private static List<ScheduledJob> assigned(List<Job> jobs) {
        List<ScheduledJob> schedule = new ArrayList<>();
        for (int i = 0; i < jobs.size(); i++) {
            schedule.add(new ScheduledJob(jobs.get(i), "M1", AssignmentStatus.ASSIGNED, NOW, 0, i + 1, 6));
        }
        return schedule;
    }
}
