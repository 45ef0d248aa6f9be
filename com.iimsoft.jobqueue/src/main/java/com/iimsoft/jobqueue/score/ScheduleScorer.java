package com.iimsoft.jobqueue.score;

import com.iimsoft.jobqueue.domain.Machine;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import org.optaplanner.core.api.score.ScoreManager;
import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;
import org.optaplanner.core.api.solver.SolverFactory;
import org.optaplanner.core.config.solver.SolverConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a built schedule with {@link JobQueueConstraintProvider}. No solving happens here;
 * the greedy builder produces the assignments and the score manager only scores them.
 */
public class ScheduleScorer {

    // immutable, shared by all runs
    private static final SolverFactory<JobQueueSchedule> SOLVER_FACTORY = SolverFactory.create(new SolverConfig()
            .withSolutionClass(JobQueueSchedule.class)
            .withEntityClasses(JobAssignment.class)
            .withConstraintProviderClass(JobQueueConstraintProvider.class));

    private final ScoreManager<JobQueueSchedule, HardSoftLongScore> scoreManager = ScoreManager.create(SOLVER_FACTORY);

    public HardSoftLongScore score(List<ScheduledJob> schedule, List<Machine> machines, Instant now) {
        return scoreManager.updateScore(toSolution(schedule, machines, now));
    }

    static JobQueueSchedule toSolution(List<ScheduledJob> schedule, List<Machine> machines, Instant now) {
        Map<String, Machine> byId = new HashMap<>();
        for (Machine machine : machines) {
            byId.putIfAbsent(machine.getId(), machine);
        }
        List<JobAssignment> assignments = new ArrayList<>(schedule.size());
        for (ScheduledJob job : schedule) {
            Machine machine = job.getAssignedMachineId() == null ? null : byId.get(job.getAssignedMachineId());
            Long due = job.getJob().getDueDate() == null ? null : minutesAfter(now, job.getJob().getDueDate());
            assignments.add(new JobAssignment((long) job.getSequenceNumber(), job.getJob(), machine,
                    minutesAfter(now, job.getScheduledStart()), minutesAfter(now, job.getScheduledEnd()),
                    Math.round(job.getEffectiveSetupTime()), due));
        }
        return new JobQueueSchedule(new ArrayList<>(machines), assignments);
    }

    private static long minutesAfter(Instant now, Instant instant) {
        return Math.round(Duration.between(now, instant).toMillis() / 60_000d);
    }
}
