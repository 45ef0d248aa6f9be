package com.iimsoft.jobqueue.result;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * How the schedule reacts to flattened priorities and to a faster or slower machine pool.
 */
@Value
@Builder
public class SensitivityAnalysis {
    List<PriorityCase> jobPriority;
    List<CapacityCase> machineCapacity;

    @Value
    public static class PriorityCase {
        String scenario;
        /** Elapsed makespan, hours. */
        double makespan;
        double onTimeRate;
        String impact;
    }

    @Value
    public static class CapacityCase {
        String scenario;
        /** Elapsed makespan, hours. */
        double makespan;
        double utilization;
        String impact;
    }
}
