package com.iimsoft.jobqueue.insight;

import com.iimsoft.jobqueue.analysis.PerformanceAnalyzer;
import com.iimsoft.jobqueue.calendar.WorkCalendar;
import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.JobQueueProblem;
import com.iimsoft.jobqueue.domain.PriorityTier;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import com.iimsoft.jobqueue.result.PerformanceMetrics;
import com.iimsoft.jobqueue.result.SensitivityAnalysis;
import com.iimsoft.jobqueue.result.SensitivityAnalysis.CapacityCase;
import com.iimsoft.jobqueue.result.SensitivityAnalysis.PriorityCase;
import com.iimsoft.jobqueue.scheduling.ScheduleBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Rebuilds the queue under perturbed inputs and reports the effect against the baseline.
 *
 * - priorities: every job promoted to "high"
 * - capacity: setup and processing times divided by 1.2 (+20%) or 0.8 (-20%)
 */
public class SensitivityAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SensitivityAnalyzer.class);

    static final double CAPACITY_STEP = 0.2;
    private static final double EPSILON = 1e-6;

    private final ScheduleBuilder scheduleBuilder;
    private final PerformanceAnalyzer performanceAnalyzer;

    public SensitivityAnalyzer(ScheduleBuilder scheduleBuilder, PerformanceAnalyzer performanceAnalyzer) {
        this.scheduleBuilder = scheduleBuilder;
        this.performanceAnalyzer = performanceAnalyzer;
    }

    public SensitivityAnalysis analyze(JobQueueProblem problem, WorkCalendar calendar, PerformanceMetrics baseline) {
        PerformanceMetrics allHigh = rebuild(problem, calendar, job -> {
            job.setPriority(PriorityTier.HIGH);
            return job;
        });
        List<PriorityCase> priority = new ArrayList<>(2);
        priority.add(new PriorityCase("All jobs high priority", allHigh.getElapsedMakespan(),
                allHigh.getOnTimeDeliveryRate(), priorityImpact(allHigh, baseline)));
        priority.add(new PriorityCase("Balanced priorities", baseline.getElapsedMakespan(),
                baseline.getOnTimeDeliveryRate(), "Current optimal balance"));

        PerformanceMetrics faster = rebuild(problem, calendar, scaled(1 + CAPACITY_STEP));
        PerformanceMetrics slower = rebuild(problem, calendar, scaled(1 - CAPACITY_STEP));
        List<CapacityCase> capacity = new ArrayList<>(2);
        capacity.add(new CapacityCase("+20% capacity", faster.getElapsedMakespan(), faster.getAverageUtilization(),
                faster.getElapsedMakespan() < baseline.getElapsedMakespan() - EPSILON
                        ? "Significant improvement in throughput"
                        : "No gain, the schedule is not capacity bound"));
        capacity.add(new CapacityCase("-20% capacity", slower.getElapsedMakespan(), slower.getAverageUtilization(),
                slower.getElapsedMakespan() > baseline.getElapsedMakespan() + EPSILON
                        ? "High utilization with limited flexibility"
                        : "No loss, the schedule is not capacity bound"));

        return SensitivityAnalysis.builder()
                .jobPriority(priority)
                .machineCapacity(capacity)
                .build();
    }

    private PerformanceMetrics rebuild(JobQueueProblem problem, WorkCalendar calendar, UnaryOperator<Job> change) {
        List<Job> jobs = new ArrayList<>(problem.getJobQueue().size());
        for (Job job : problem.getJobQueue()) {
            jobs.add(change.apply(job.copy()));
        }
        List<ScheduledJob> schedule = scheduleBuilder.build(jobs, problem.getMachines(),
                problem.getOptimizationGoals(), problem.getReferenceTime());
        PerformanceMetrics metrics = performanceAnalyzer.analyze(schedule, problem.getMachines(), calendar,
                problem.getReferenceTime());
        LOGGER.debug("Sensitivity rebuild: makespan {} h, on-time {}%", metrics.getElapsedMakespan(),
                metrics.getOnTimeDeliveryRate());
        return metrics;
    }

    private static UnaryOperator<Job> scaled(double capacityFactor) {
        return job -> {
            job.setEstimatedDuration(job.getEstimatedDuration() / capacityFactor);
            job.setSetupTime(job.getSetupTime() / capacityFactor);
            return job;
        };
    }

    static String priorityImpact(PerformanceMetrics allHigh, PerformanceMetrics baseline) {
        double onTimeDelta = allHigh.getOnTimeDeliveryRate() - baseline.getOnTimeDeliveryRate();
        if (Math.abs(onTimeDelta) < EPSILON) {
            return "Tiers do not change delivery performance";
        }
        String change = String.format(Locale.ROOT, "%+.1f%% on-time", onTimeDelta);
        return onTimeDelta > 0
                ? "Due dates alone deliver better (" + change + "), review tier assignments"
                : "Urgent jobs lose precedence (" + change + ")";
    }
}
