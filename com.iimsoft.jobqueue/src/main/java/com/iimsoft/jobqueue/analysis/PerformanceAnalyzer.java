package com.iimsoft.jobqueue.analysis;

import com.iimsoft.jobqueue.calendar.WorkCalendar;
import com.iimsoft.jobqueue.domain.Machine;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import com.iimsoft.jobqueue.result.PerformanceMetrics;
import com.iimsoft.jobqueue.result.PerformanceMetrics.MachineUtilization;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Time-based metrics of a schedule, measured against {@code now}.
 * A job without a machine is never delivered, so it counts as late.
 */
public class PerformanceAnalyzer {

    public PerformanceMetrics analyze(List<ScheduledJob> schedule, List<Machine> machines,
                                      WorkCalendar calendar, Instant now) {
        int jobCount = schedule.size();
        if (jobCount == 0) {
            return PerformanceMetrics.builder()
                    .machineUtilization(idleMachines(machines))
                    .onTimeDeliveryRate(100)
                    .build();
        }

        double processingMinutes = 0;
        double setupMinutes = 0;
        double waitHours = 0;
        double flowHours = 0;
        double tardiness = 0;
        double overtimeMinutes = 0;
        int late = 0;
        Instant firstStart = null;
        Instant lastEnd = null;
        for (ScheduledJob job : schedule) {
            processingMinutes += job.getProcessingMinutes();
            setupMinutes += job.getEffectiveSetupTime();
            waitHours += hoursBetween(now, job.getScheduledStart());
            flowHours += hoursBetween(now, job.getScheduledEnd());
            tardiness += job.getTardinessHours();
            overtimeMinutes += calendar.overtimeMinutesBetween(job.getScheduledStart(), job.getScheduledEnd());
            if (job.isLate() || !job.isAssigned()) late++;
            if (firstStart == null || job.getScheduledStart().isBefore(firstStart)) firstStart = job.getScheduledStart();
            if (lastEnd == null || job.getScheduledEnd().isAfter(lastEnd)) lastEnd = job.getScheduledEnd();
        }
        double elapsed = hoursBetween(firstStart, lastEnd);

        List<MachineUtilization> utilization = machineUtilization(schedule, machines, now);
        double averageUtilization = averageOfAvailable(utilization, machines);

        return PerformanceMetrics.builder()
                .totalMakespan(processingMinutes / 60d)
                .elapsedMakespan(elapsed)
                .averageWaitTime(waitHours / jobCount)
                .onTimeDeliveryRate((jobCount - late) * 100d / jobCount)
                .totalTardiness(tardiness)
                .throughputRate(elapsed > 0 ? jobCount / (elapsed / 24d) : 0)
                .averageFlowTime(flowHours / jobCount)
                .machineUtilization(utilization)
                .averageUtilization(averageUtilization)
                .totalSetupHours(setupMinutes / 60d)
                .overtimeHours(overtimeMinutes / 60d)
                .lateJobCount(late)
                .build();
    }

    /**
     * Busy share of each machine between {@code now} and the latest end on any machine, in percent.
     * Machines that are not available report 0.
     */
    List<MachineUtilization> machineUtilization(List<ScheduledJob> schedule, List<Machine> machines, Instant now) {
        Instant horizonEnd = now;
        for (ScheduledJob job : schedule) {
            if (job.isAssigned() && job.getScheduledEnd().isAfter(horizonEnd)) {
                horizonEnd = job.getScheduledEnd();
            }
        }
        double horizonMinutes = Duration.between(now, horizonEnd).toMillis() / 60_000d;

        List<MachineUtilization> result = new ArrayList<>(machines.size());
        for (Machine machine : machines) {
            double busy = 0;
            int count = 0;
            for (ScheduledJob job : schedule) {
                if (machine.getId().equals(job.getAssignedMachineId())) {
                    busy += job.getProcessingMinutes();
                    count++;
                }
            }
            double utilization = 0;
            if (machine.isAvailable() && horizonMinutes > 0) {
                utilization = Math.min(100, Math.max(0, busy / horizonMinutes * 100));
            }
            result.add(new MachineUtilization(machine.getId(), utilization, busy / 60d, count));
        }
        return result;
    }

    private static List<MachineUtilization> idleMachines(List<Machine> machines) {
        List<MachineUtilization> result = new ArrayList<>();
        for (Machine machine : machines) {
            result.add(new MachineUtilization(machine.getId(), 0, 0, 0));
        }
        return result;
    }

    private static double averageOfAvailable(List<MachineUtilization> utilization, List<Machine> machines) {
        double sum = 0;
        int count = 0;
        for (int i = 0; i < machines.size(); i++) {
            if (machines.get(i).isAvailable()) {
                sum += utilization.get(i).getUtilization();
                count++;
            }
        }
        return count == 0 ? 0 : sum / count;
    }

    private static double hoursBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 3_600_000d;
    }
}
