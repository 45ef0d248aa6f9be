package com.iimsoft.jobqueue.score;

import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;
import org.optaplanner.core.api.score.stream.Constraint;
import org.optaplanner.core.api.score.stream.ConstraintFactory;
import org.optaplanner.core.api.score.stream.ConstraintProvider;
import org.optaplanner.core.api.score.stream.Joiners;

/**
 * Hard:
 *   1) every job has a machine
 *   2) the machine can process the job (material, thickness, status)
 *   3) jobs on one machine do not overlap
 * Soft:
 *   1) tardiness minutes weighted by priority tier
 *   2) setup minutes
 *   3) completion minutes after now
 */
public class JobQueueConstraintProvider implements ConstraintProvider {

    @Override
    public Constraint[] defineConstraints(ConstraintFactory factory) {
        return new Constraint[] {
                unassignedJob(factory),
                incompatibleMachine(factory),
                machineOverlap(factory),

                tardiness(factory),
                setupTime(factory),
                completionTime(factory)
        };
    }

    private Constraint unassignedJob(ConstraintFactory factory) {
        return factory.forEachIncludingNullVars(JobAssignment.class)
                .filter(a -> a.getMachine() == null)
                .penalize(HardSoftLongScore.ONE_HARD)
                .asConstraint("Unassigned job");
    }

    private Constraint incompatibleMachine(ConstraintFactory factory) {
        return factory.forEach(JobAssignment.class)
                .filter(a -> !a.getMachine().canProcess(a.getJob()))
                .penalize(HardSoftLongScore.ONE_HARD)
                .asConstraint("Incompatible machine");
    }

    private Constraint machineOverlap(ConstraintFactory factory) {
        return factory.forEach(JobAssignment.class)
                .join(JobAssignment.class,
                        Joiners.equal(JobAssignment::getMachine),
                        Joiners.lessThan(JobAssignment::getId))
                .filter(JobAssignment::overlaps)
                .penalize(HardSoftLongScore.ONE_HARD)
                .asConstraint("Machine overlap");
    }

    private Constraint tardiness(ConstraintFactory factory) {
        return factory.forEachIncludingNullVars(JobAssignment.class)
                .filter(a -> a.getTardinessMinutes() > 0)
                .penalizeLong(HardSoftLongScore.ONE_SOFT,
                        a -> a.getTardinessMinutes() * a.getJob().getPriorityWeight())
                .asConstraint("Tardiness");
    }

    private Constraint setupTime(ConstraintFactory factory) {
        return factory.forEachIncludingNullVars(JobAssignment.class)
                .filter(a -> a.getSetupMinutes() > 0)
                .penalizeLong(HardSoftLongScore.ONE_SOFT, JobAssignment::getSetupMinutes)
                .asConstraint("Setup time");
    }

    private Constraint completionTime(ConstraintFactory factory) {
        return factory.forEachIncludingNullVars(JobAssignment.class)
                .filter(a -> a.getEndMinute() > 0)
                .penalizeLong(HardSoftLongScore.ONE_SOFT, JobAssignment::getEndMinute)
                .asConstraint("Completion time");
    }
}
