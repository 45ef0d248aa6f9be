package com.iimsoft.jobqueue.insight;

import com.iimsoft.jobqueue.domain.ScheduledJob;
import com.iimsoft.jobqueue.result.CostAnalysis;
import com.iimsoft.jobqueue.result.PerformanceMetrics;
import lombok.Value;

import java.util.List;

/**
 * The schedule built from the caller's goals, with its metrics, cost and score.
 */
@Value
public class Baseline {
    List<ScheduledJob> schedule;
    PerformanceMetrics metrics;
    CostAnalysis cost;
    String score;
}
