package com.iimsoft.jobqueue.analysis;

import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.Machine;
import com.iimsoft.jobqueue.domain.ResourceConstraints;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import com.iimsoft.jobqueue.result.PerformanceMetrics;
import com.iimsoft.jobqueue.result.PerformanceMetrics.MachineUtilization;
import com.iimsoft.jobqueue.result.ResourceUtilization;
import com.iimsoft.jobqueue.result.ResourceUtilization.MachineEfficiency;
import com.iimsoft.jobqueue.result.ResourceUtilization.MaterialUsage;
import com.iimsoft.jobqueue.result.ResourceUtilization.ShiftCoverage;
import com.iimsoft.jobqueue.result.ResourceUtilization.ToolingUtilization;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Operator, machine, material, tooling and shift usage of a schedule.
 */
public class ResourceUtilizationAnalyzer {

    private final double bottleneckUtilization;

    public ResourceUtilizationAnalyzer(double bottleneckUtilization) {
        this.bottleneckUtilization = bottleneckUtilization;
    }

    public ResourceUtilization analyze(List<ScheduledJob> schedule, List<Machine> machines,
                                       ResourceConstraints resources, PerformanceMetrics metrics, Instant now) {
        return ResourceUtilization.builder()
                .operatorUtilization(operatorUtilization(schedule, resources.getAvailableOperators(), now))
                .machineEfficiency(machineEfficiency(machines, metrics.getMachineUtilization()))
                .materialUsage(materialUsage(schedule, resources.getMaterialAvailability()))
                .toolingUtilization(toolingUtilization(resources.getToolingAvailability(), metrics.getAverageUtilization()))
                .shiftCoverage(shiftCoverage(resources.getOperatorShifts()))
                .build();
    }

    /** Busy hours over operator-hours between now and the last completion, percent. */
    double operatorUtilization(List<ScheduledJob> schedule, int operators, Instant now) {
        double busyMinutes = 0;
        Instant horizonEnd = now;
        for (ScheduledJob job : schedule) {
            if (!job.isAssigned()) continue;
            busyMinutes += job.getProcessingMinutes();
            if (job.getScheduledEnd().isAfter(horizonEnd)) horizonEnd = job.getScheduledEnd();
        }
        double horizonMinutes = Duration.between(now, horizonEnd).toMillis() / 60_000d;
        if (operators <= 0 || horizonMinutes <= 0) {
            return 0;
        }
        return Math.min(100, busyMinutes / (operators * horizonMinutes) * 100);
    }

    private List<MachineEfficiency> machineEfficiency(List<Machine> machines, List<MachineUtilization> utilization) {
        List<MachineEfficiency> result = new ArrayList<>(machines.size());
        for (int i = 0; i < machines.size(); i++) {
            Machine machine = machines.get(i);
            double used = utilization.get(i).getUtilization();
            result.add(new MachineEfficiency(machine.getId(), machine.getEfficiency(), used,
                    used >= bottleneckUtilization));
        }
        return result;
    }

    private static List<MaterialUsage> materialUsage(List<ScheduledJob> schedule,
                                                     List<ResourceConstraints.MaterialStock> stock) {
        List<MaterialUsage> result = new ArrayList<>();
        for (ResourceConstraints.MaterialStock material : stock) {
            int required = 0;
            for (ScheduledJob scheduled : schedule) {
                Job job = scheduled.getJob();
                if (material.getMaterialType() != null && material.getMaterialType().equalsIgnoreCase(job.getMaterialType())) {
                    required += job.getPartCount();
                }
            }
            double available = material.getAvailableQuantity();
            double utilization = available > 0 ? Math.min(100, required / available * 100) : (required > 0 ? 100 : 0);
            result.add(new MaterialUsage(material.getMaterialType(), required, utilization, required > available));
        }
        return result;
    }

    private static List<ToolingUtilization> toolingUtilization(List<ResourceConstraints.ToolingStock> tooling,
                                                               double averageUtilization) {
        List<ToolingUtilization> result = new ArrayList<>();
        for (ResourceConstraints.ToolingStock tool : tooling) {
            result.add(new ToolingUtilization(tool.getToolType(),
                    tool.isAvailable() ? averageUtilization : 0, tool.isAvailable()));
        }
        return result;
    }

    private static List<ShiftCoverage> shiftCoverage(List<ResourceConstraints.OperatorShift> shifts) {
        List<ShiftCoverage> result = new ArrayList<>();
        for (ResourceConstraints.OperatorShift shift : shifts) {
            result.add(new ShiftCoverage(shift.getShiftId(),
                    Math.min(100, shift.getOperatorCount() * 40), shift.getOperatorCount() < 2));
        }
        return result;
    }
}
