package com.iimsoft.jobqueue.result;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Time-based performance of a built schedule. Durations are in hours, rates in percent.
 */
@Value
@Builder
public class PerformanceMetrics {
    /** Sum of setup + processing time over all jobs. */
    double totalMakespan;
    /** Last completion minus first start. */
    double elapsedMakespan;
    double averageWaitTime;
    double onTimeDeliveryRate;
    double totalTardiness;
    /** Jobs per day over the elapsed makespan. */
    double throughputRate;
    double averageFlowTime;
    List<MachineUtilization> machineUtilization;
    /** Mean utilization of the available machines. */
    double averageUtilization;
    double totalSetupHours;
    /** Processing time falling outside the working-hours window. */
    double overtimeHours;
    int lateJobCount;

    @Value
    public static class MachineUtilization {
        String machineId;
        double utilization;
        double busyHours;
        int jobCount;
    }
}
