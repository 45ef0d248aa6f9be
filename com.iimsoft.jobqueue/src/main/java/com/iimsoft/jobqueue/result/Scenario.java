package com.iimsoft.jobqueue.result;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A named alternative schedule obtained with another goal-weight vector.
 */
@Value
@Builder
public class Scenario {
    String scenarioName;
    String description;
    /** Elapsed makespan, hours. */
    double makespan;
    double onTimeRate;
    double totalCost;
    double totalTardiness;
    String score;
    List<String> jobSequence;
    List<String> tradeoffs;
}
