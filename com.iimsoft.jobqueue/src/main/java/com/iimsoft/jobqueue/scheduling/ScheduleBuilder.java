package com.iimsoft.jobqueue.scheduling;

import com.iimsoft.jobqueue.config.OptimizerSettings;
import com.iimsoft.jobqueue.config.UnassignablePolicy;
import com.iimsoft.jobqueue.domain.AssignmentStatus;
import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.Machine;
import com.iimsoft.jobqueue.domain.OptimizationGoals;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Greedy list scheduler.
 *
 * - jobs are ranked by priority score, descending; equal scores keep queue order (stable sort)
 * - when the efficiency weight outweighs every other goal weight, jobs are ordered for makespan
 *   instead: fewest eligible machines first, then longest processing time, then priority score
 * - every machine owns a lane cursor starting at {@code now}; a job goes to the eligible machine
 *   on which it can start first, and only that lane advances
 * - a job becomes a candidate once all its in-queue dependencies are placed, and never starts
 *   before they end
 * - end = start + setup * machine multiplier + duration; the lane is released after a buffer of
 *   max(minimumBuffer, duration * bufferFraction)
 * - jobs without an eligible machine follow the configured {@link UnassignablePolicy}; flagged
 *   jobs are laid out on a separate holding lane so they still get a sequence number and times
 */
public class ScheduleBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleBuilder.class);

    private final PriorityScorer priorityScorer;
    private final MachineMatcher machineMatcher;
    private final OptimizerSettings settings;

    public ScheduleBuilder(PriorityScorer priorityScorer, MachineMatcher machineMatcher, OptimizerSettings settings) {
        this.priorityScorer = Objects.requireNonNull(priorityScorer);
        this.machineMatcher = Objects.requireNonNull(machineMatcher);
        this.settings = Objects.requireNonNull(settings);
    }

    public List<ScheduledJob> build(List<Job> jobs, List<Machine> machines, OptimizationGoals goals, Instant now) {
        Objects.requireNonNull(jobs, "jobs");
        Objects.requireNonNull(goals, "goals");
        Objects.requireNonNull(now, "now");
        MachineMatcher.requireMachines(machines);

        List<Job> pending = rank(jobs, machines, goals, now);
        Set<String> queuedIds = jobs.stream().map(Job::getId).collect(Collectors.toSet());
        warnUnknownDependencies(jobs, queuedIds);

        Map<String, Instant> laneCursor = new HashMap<>();
        for (Machine machine : machines) {
            laneCursor.putIfAbsent(machine.getId(), now);
        }
        Instant holdingCursor = now;
        Map<String, Instant> completedAt = new HashMap<>();

        List<ScheduledJob> schedule = new ArrayList<>(jobs.size());
        while (!pending.isEmpty()) {
            Job job = takeNextReady(pending, queuedIds, completedAt);
            if (job == null) {
                throw new IllegalStateException("Circular job dependencies: "
                        + pending.stream().map(Job::getId).collect(Collectors.joining(", ")));
            }
            Instant readyAt = dependenciesDoneAt(job, queuedIds, completedAt, now);

            Machine machine = earliestEligibleMachine(job, machines, laneCursor, readyAt);
            AssignmentStatus status = AssignmentStatus.ASSIGNED;
            if (machine == null) {
                if (settings.getUnassignablePolicy() == UnassignablePolicy.FALLBACK_TO_FIRST_MACHINE) {
                    machine = machines.get(0);
                    status = AssignmentStatus.FALLBACK;
                    LOGGER.warn("No compatible machine for job {}, falling back to {}", job.getId(), machine.getId());
                } else {
                    status = AssignmentStatus.UNASSIGNED;
                    LOGGER.warn("No compatible machine for job {} (material {}, thickness {})",
                            job.getId(), job.getMaterialType(), job.getThickness());
                }
            }

            double multiplier = machine == null ? 1.0 : machine.getSetupTimeMultiplier();
            double effectiveSetup = job.getSetupTime() * multiplier;
            double buffer = bufferTime(job);
            Instant laneFree = machine == null ? holdingCursor : laneCursor.get(machine.getId());
            Instant start = latest(laneFree, readyAt);

            ScheduledJob scheduled = new ScheduledJob(job, machine == null ? null : machine.getId(), status,
                    start, effectiveSetup, schedule.size() + 1, buffer);
            schedule.add(scheduled);

            if (machine == null) {
                holdingCursor = scheduled.getReleaseTime();
            } else {
                laneCursor.put(machine.getId(), scheduled.getReleaseTime());
            }
            completedAt.put(job.getId(), scheduled.getScheduledEnd());
            LOGGER.debug("Placed {}", scheduled);
        }
        return schedule;
    }

    /**
     * Jobs in placement order. List.sort is stable, so ties keep queue order.
     */
    public List<Job> rank(List<Job> jobs, List<Machine> machines, OptimizationGoals goals, Instant now) {
        Map<Job, Double> scores = new HashMap<>();
        for (Job job : jobs) {
            scores.put(job, priorityScorer.score(job, goals, now));
        }
        Comparator<Job> byScore = Comparator.comparingDouble((Job j) -> scores.get(j)).reversed();
        List<Job> ranked = new ArrayList<>(jobs);
        if (isEfficiencyLed(goals)) {
            Map<Job, Integer> eligible = new HashMap<>();
            for (Job job : jobs) {
                int count = machineMatcher.eligibleMachines(job, machines).size();
                eligible.put(job, count == 0 ? Integer.MAX_VALUE : count);
            }
            ranked.sort(Comparator.comparingInt((Job j) -> eligible.get(j))
                    .thenComparing(Comparator.comparingDouble((Job j) -> j.getSetupTime() + j.getEstimatedDuration()).reversed())
                    .thenComparing(byScore));
        } else {
            ranked.sort(byScore);
        }
        return ranked;
    }

    static boolean isEfficiencyLed(OptimizationGoals goals) {
        double efficiency = goals.getEfficiencyWeight();
        return efficiency > goals.getUrgencyWeight()
                && efficiency > goals.getCustomerSatisfactionWeight()
                && efficiency > goals.getProfitabilityWeight();
    }

    public double bufferTime(Job job) {
        return Math.max(settings.getMinimumBufferMinutes(), job.getEstimatedDuration() * settings.getBufferFraction());
    }

    private Machine earliestEligibleMachine(Job job, List<Machine> machines,
                                            Map<String, Instant> laneCursor, Instant readyAt) {
        Machine best = null;
        Instant bestStart = null;
        for (Machine machine : machineMatcher.eligibleMachines(job, machines)) {
            Instant start = latest(laneCursor.get(machine.getId()), readyAt);
            if (bestStart == null || start.isBefore(bestStart)) {
                best = machine;
                bestStart = start;
            }
        }
        return best;
    }

    private static Job takeNextReady(List<Job> pending, Set<String> queuedIds, Map<String, Instant> completedAt) {
        Iterator<Job> it = pending.iterator();
        while (it.hasNext()) {
            Job job = it.next();
            boolean ready = dependenciesOf(job, queuedIds).stream().allMatch(completedAt::containsKey);
            if (ready) {
                it.remove();
                return job;
            }
        }
        return null;
    }

    private static Instant dependenciesDoneAt(Job job, Set<String> queuedIds,
                                              Map<String, Instant> completedAt, Instant now) {
        Instant readyAt = now;
        for (String dependency : dependenciesOf(job, queuedIds)) {
            readyAt = latest(readyAt, completedAt.get(dependency));
        }
        return readyAt;
    }

    private static List<String> dependenciesOf(Job job, Set<String> queuedIds) {
        if (job.getDependencies() == null) {
            return List.of();
        }
        return job.getDependencies().stream().filter(queuedIds::contains).collect(Collectors.toList());
    }

    private static void warnUnknownDependencies(List<Job> jobs, Set<String> queuedIds) {
        Set<String> reported = new HashSet<>();
        for (Job job : jobs) {
            if (job.getDependencies() == null) continue;
            for (String dependency : job.getDependencies()) {
                if (!queuedIds.contains(dependency) && reported.add(job.getId() + "->" + dependency)) {
                    LOGGER.warn("Job {} depends on {} which is not in the queue; ignoring", job.getId(), dependency);
                }
            }
        }
    }

    private static Instant latest(Instant a, Instant b) {
        return b.isAfter(a) ? b : a;
    }
}
