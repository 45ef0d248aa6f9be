package com.iimsoft.jobqueue.analysis;

import com.iimsoft.jobqueue.domain.AssignmentStatus;
import com.iimsoft.jobqueue.domain.CustomerImportance;
import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.JobQueueProblem;
import com.iimsoft.jobqueue.domain.PriorityTier;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import com.iimsoft.jobqueue.result.RiskAssessment;
import com.iimsoft.jobqueue.result.RiskAssessment.BufferRecommendation;
import com.iimsoft.jobqueue.result.RiskAssessment.DeliveryRisk;
import com.iimsoft.jobqueue.result.RiskLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based schedule risk.
 *
 * Ladder, each step overriding the previous one:
 *   medium   urgent > 2 or jobs > 8
 *   high     urgent > 3 or jobs > 12 or available machines < 2
 *   critical urgent > 5 or jobs > 15 or available machines < 1
 */
public class RiskAssessor {

    private static final int DELIVERY_RISK_JOBS = 3;

    public RiskAssessment assess(JobQueueProblem problem, List<ScheduledJob> schedule) {
        int jobCount = problem.getJobQueue().size();
        int urgentJobs = (int) problem.getUrgentJobCount();
        int availableMachines = (int) problem.getAvailableMachineCount();
        int availableOperators = problem.getResourceConstraints() == null
                ? 0 : problem.getResourceConstraints().getAvailableOperators();

        RiskLevel level = scheduleRisk(urgentJobs, jobCount, availableMachines);

        boolean unassigned = schedule.stream().anyMatch(j -> j.getStatus() != AssignmentStatus.ASSIGNED);
        boolean late = schedule.stream().anyMatch(ScheduledJob::isLate);
        double minimumBreak = problem.getOperationalConstraints() == null
                ? 0 : problem.getOperationalConstraints().getMinimumBreakTime();
        boolean shortBuffer = schedule.stream().anyMatch(j -> j.getBufferTime() < minimumBreak);

        List<String> factors = new ArrayList<>();
        if (urgentJobs > 2) factors.add("High number of urgent jobs in queue");
        if (jobCount > 10) factors.add("Large job queue may cause delays");
        if (availableMachines < 2) factors.add("Limited machine availability");
        if (availableOperators < 3) factors.add("Insufficient operator coverage");
        if (unassigned) factors.add("Jobs without a compatible machine");
        if (late) factors.add("Jobs projected to miss their due date");
        if (shortBuffer) factors.add("Buffer shorter than the minimum break between jobs");

        boolean hasVip = problem.getJobQueue().stream()
                .anyMatch(j -> j.getCustomerImportance() == CustomerImportance.VIP);
        boolean hasCritical = problem.getJobQueue().stream()
                .anyMatch(j -> j.getPriority() == PriorityTier.CRITICAL);

        List<String> plans = new ArrayList<>();
        if (availableMachines >= 2) {
            plans.add("Reschedule to backup machine on breakdown");
        } else {
            plans.add("Arrange subcontracting capacity, no backup machine available");
        }
        if (hasCritical || level.isAtLeast(RiskLevel.HIGH)) {
            plans.add("Schedule overtime shifts for critical jobs");
        }
        if (hasVip) {
            plans.add("Prioritize VIP customers when capacity is lost");
        }
        plans.add("Keep emergency material inventory for the most used materials");

        return RiskAssessment.builder()
                .scheduleRisk(level)
                .riskFactors(factors)
                .contingencyPlans(plans)
                .bufferAdequacy(bufferAdequacy(jobCount))
                .deliveryRisk(deliveryRisk(schedule))
                .bufferRecommendations(bufferRecommendations(schedule))
                .build();
    }

    public static RiskLevel scheduleRisk(int urgentJobs, int jobCount, int availableMachines) {
        RiskLevel level = RiskLevel.LOW;
        if (urgentJobs > 2 || jobCount > 8) level = RiskLevel.MEDIUM;
        if (urgentJobs > 3 || jobCount > 12 || availableMachines < 2) level = RiskLevel.HIGH;
        if (urgentJobs > 5 || jobCount > 15 || availableMachines < 1) level = RiskLevel.CRITICAL;
        return level;
    }

    public static double bufferAdequacy(int jobCount) {
        return Math.max(60, 100 - jobCount * 3);
    }

    private static List<DeliveryRisk> deliveryRisk(List<ScheduledJob> schedule) {
        List<DeliveryRisk> result = new ArrayList<>();
        for (ScheduledJob scheduled : schedule.subList(0, Math.min(DELIVERY_RISK_JOBS, schedule.size()))) {
            Job job = scheduled.getJob();
            if (job.getPriority() == PriorityTier.CRITICAL) {
                result.add(new DeliveryRisk(job.getId(), RiskLevel.HIGH, "Assign dedicated operator and monitor progress"));
            } else if (job.getPriority() == PriorityTier.URGENT) {
                result.add(new DeliveryRisk(job.getId(), RiskLevel.MEDIUM, "Confirm material availability before start"));
            } else {
                result.add(new DeliveryRisk(job.getId(), RiskLevel.LOW, "Standard monitoring"));
            }
        }
        return result;
    }

    private static List<BufferRecommendation> bufferRecommendations(List<ScheduledJob> schedule) {
        List<BufferRecommendation> result = new ArrayList<>(schedule.size());
        for (ScheduledJob scheduled : schedule) {
            result.add(new BufferRecommendation(scheduled.getJob().getId(),
                    Math.max(15, scheduled.getJob().getEstimatedDuration() * 0.15),
                    "Standard safety buffer for schedule stability"));
        }
        return result;
    }
}
