package com.iimsoft.jobqueue.analysis;

import com.iimsoft.jobqueue.domain.CustomerImportance;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import com.iimsoft.jobqueue.result.CustomerImpact;
import com.iimsoft.jobqueue.result.CustomerImpact.CommunicationPlanEntry;
import com.iimsoft.jobqueue.result.CustomerImpact.DeliveryPerformance;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class CustomerImpactAnalyzer {

    private static final Duration NOTICE = Duration.ofHours(24);

    public CustomerImpact analyze(List<ScheduledJob> schedule, Instant now) {
        return CustomerImpact.builder()
                .customerSatisfactionScore(satisfactionScore(schedule))
                .deliveryPerformance(deliveryPerformance(schedule))
                .communicationPlan(communicationPlan(schedule, now))
                .build();
    }

    /**
     * Importance-weighted on-time share scaled to 1..10. An empty schedule scores 10.
     */
    double satisfactionScore(List<ScheduledJob> schedule) {
        double weight = 0;
        double onTime = 0;
        for (ScheduledJob job : schedule) {
            double w = job.getJob().getCustomerWeight();
            weight += w;
            if (!job.isLate() && job.isAssigned()) onTime += w;
        }
        if (weight == 0) return 10;
        return Math.max(1, Math.min(10, onTime / weight * 10));
    }

    private List<DeliveryPerformance> deliveryPerformance(List<ScheduledJob> schedule) {
        List<DeliveryPerformance> result = new ArrayList<>();
        for (CustomerImportance tier : CustomerImportance.values()) {
            List<ScheduledJob> jobs = new ArrayList<>();
            for (ScheduledJob job : schedule) {
                CustomerImportance importance = job.getJob().getCustomerImportance();
                if ((importance == null ? CustomerImportance.STANDARD : importance) == tier) {
                    jobs.add(job);
                }
            }
            if (jobs.isEmpty()) continue;
            long onTime = jobs.stream().filter(j -> !j.isLate() && j.isAssigned()).count();
            double rate = onTime * 100d / jobs.size();
            result.add(new DeliveryPerformance(tier.getCode(), jobs.size(), rate, satisfactionScore(jobs)));
        }
        return result;
    }

    private static List<CommunicationPlanEntry> communicationPlan(List<ScheduledJob> schedule, Instant now) {
        List<CommunicationPlanEntry> result = new ArrayList<>(schedule.size());
        for (ScheduledJob job : schedule) {
            String notification;
            if (!job.isAssigned()) {
                notification = "Cannot confirm delivery, no compatible machine";
            } else if (job.isLate()) {
                notification = "Revised delivery estimate: " + job.getScheduledEnd();
            } else {
                notification = "Scheduled confirmation with delivery estimate";
            }
            Instant notifyAt = job.getScheduledStart().minus(NOTICE);
            String timing = notifyAt.isAfter(now) ? notifyAt.toString() : "Immediately";
            result.add(new CommunicationPlanEntry(job.getJob().getId(), notification, timing));
        }
        return result;
    }
}
