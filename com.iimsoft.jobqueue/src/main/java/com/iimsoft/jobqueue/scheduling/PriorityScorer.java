package com.iimsoft.jobqueue.scheduling;

import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.OptimizationGoals;

import java.time.Duration;
import java.time.Instant;

/**
 * Priority score of a job: the higher, the earlier it is sequenced.
 *
 * score = tierWeight * urgencyGoal
 *       + customerWeight * customerSatisfactionGoal
 *       + dueDateUrgency * 5
 *       + (profitMargin / 100) * profitabilityGoal * 10
 *
 * Unknown tiers score as "normal" (4), unknown customer importance as "standard" (1.0).
 */
public class PriorityScorer {

    public double score(Job job, OptimizationGoals goals, Instant now) {
        return job.getPriorityWeight() * goals.getUrgencyWeight()
                + job.getCustomerWeight() * goals.getCustomerSatisfactionWeight()
                + urgencyWeight(job.getDueDate(), now) * 5
                + (job.getProfitMargin() / 100d) * goals.getProfitabilityWeight() * 10;
    }

    /**
     * Due-date urgency from the hours left until the due date.
     * Overdue jobs fall into the first bucket; a missing due date into the last.
     */
    public int urgencyWeight(Instant dueDate, Instant now) {
        if (dueDate == null) {
            return 2;
        }
        double hoursUntilDue = Duration.between(now, dueDate).toMillis() / 3_600_000d;
        if (hoursUntilDue < 24) return 10;
        if (hoursUntilDue < 48) return 8;
        if (hoursUntilDue < 72) return 6;
        if (hoursUntilDue < 168) return 4;
        return 2;
    }
}
