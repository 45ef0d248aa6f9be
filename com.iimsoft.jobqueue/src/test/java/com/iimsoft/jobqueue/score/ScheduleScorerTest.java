package com.iimsoft.jobqueue.score;

import com.iimsoft.jobqueue.TestData;
import com.iimsoft.jobqueue.domain.AssignmentStatus;
import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.Machine;
import com.iimsoft.jobqueue.domain.PriorityTier;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import org.junit.jupiter.api.Test;
import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;

import java.time.Duration;
import java.util.List;

import static com.iimsoft.jobqueue.TestData.NOW;
import static org.junit.jupiter.api.Assertions.*;

class ScheduleScorerTest {

    private final ScheduleScorer scorer = new ScheduleScorer();
    private final List<Machine> machines = List.of(TestData.machine("M1"), TestData.machine("M2"));

    @Test
    void feasibleScheduleHasNoHardPenalty() {
        Job job = TestData.job("A", PriorityTier.NORMAL, 60, 10);
        List<ScheduledJob> schedule = List.of(new ScheduledJob(job, "M1", AssignmentStatus.ASSIGNED, NOW, 10, 1, 6));

        HardSoftLongScore score = scorer.score(schedule, machines, NOW);

        assertEquals(0, score.getHardScore());
        // setup 10 + completion 70
        assertEquals(-80, score.getSoftScore());
        assertEquals("0hard/-80soft", score.toString());
    }

    @Test
    void tardinessIsWeightedByPriorityTier() {
        Job job = TestData.dueIn(TestData.job("A", PriorityTier.CRITICAL, 60, 0), Duration.ofMinutes(30));
        List<ScheduledJob> schedule = List.of(new ScheduledJob(job, "M1", AssignmentStatus.ASSIGNED, NOW, 0, 1, 6));

        // 30 late minutes * 10 + completion 60
        assertEquals(-360, scorer.score(schedule, machines, NOW).getSoftScore());
    }

    @Test
    void unassignedJobIsAHardPenalty() {
        Job job = TestData.job("A", PriorityTier.NORMAL, 60, 0);
        job.setMaterialType("aluminum");
        List<ScheduledJob> schedule = List.of(new ScheduledJob(job, null, AssignmentStatus.UNASSIGNED, NOW, 0, 1, 6));

        assertEquals(-1, scorer.score(schedule, machines, NOW).getHardScore());
    }

    @Test
    void fallbackOnIncompatibleMachineIsAHardPenalty() {
        Job job = TestData.job("A", PriorityTier.NORMAL, 60, 0);
        job.setMaterialType("aluminum");
        List<ScheduledJob> schedule = List.of(new ScheduledJob(job, "M1", AssignmentStatus.FALLBACK, NOW, 0, 1, 6));

        assertEquals(-1, scorer.score(schedule, machines, NOW).getHardScore());
    }

    @Test
    void overlappingJobsOnOneMachineAreAHardPenalty() {
        List<ScheduledJob> schedule = List.of(
                new ScheduledJob(TestData.job("A", PriorityTier.NORMAL, 60, 0), "M1", AssignmentStatus.ASSIGNED, NOW, 0, 1, 6),
                new ScheduledJob(TestData.job("B", PriorityTier.NORMAL, 60, 0), "M1", AssignmentStatus.ASSIGNED,
                        NOW.plus(Duration.ofMinutes(30)), 0, 2, 6),
                new ScheduledJob(TestData.job("C", PriorityTier.NORMAL, 60, 0), "M2", AssignmentStatus.ASSIGNED, NOW, 0, 3, 6));

        assertEquals(-1, scorer.score(schedule, machines, NOW).getHardScore());
    }
}
