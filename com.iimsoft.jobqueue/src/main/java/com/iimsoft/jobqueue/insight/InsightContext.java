package com.iimsoft.jobqueue.insight;

import com.iimsoft.jobqueue.domain.AssignmentStatus;
import com.iimsoft.jobqueue.domain.JobQueueProblem;
import com.iimsoft.jobqueue.domain.Machine;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import com.iimsoft.jobqueue.result.CostAnalysis;
import com.iimsoft.jobqueue.result.PerformanceMetrics;
import com.iimsoft.jobqueue.result.ResourceUtilization;
import com.iimsoft.jobqueue.result.RiskAssessment;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the insight rules may look at.
 */
@Value
@Builder
public class InsightContext {
    JobQueueProblem problem;
    List<ScheduledJob> schedule;
    PerformanceMetrics metrics;
    CostAnalysis cost;
    RiskAssessment risk;
    ResourceUtilization resources;
    double bottleneckUtilization;

    public int getJobCount() {
        return schedule.size();
    }

    /** Share of processing time spent on setup, percent. */
    public double getSetupShare() {
        double total = metrics.getTotalMakespan();
        return total > 0 ? metrics.getTotalSetupHours() / total * 100 : 0;
    }

    /** Max minus min utilization over available machines. */
    public double getUtilizationSpread() {
        double min = Double.MAX_VALUE;
        double max = 0;
        List<Machine> machines = problem.getMachines();
        for (int i = 0; i < machines.size(); i++) {
            if (!machines.get(i).isAvailable()) continue;
            double u = metrics.getMachineUtilization().get(i).getUtilization();
            min = Math.min(min, u);
            max = Math.max(max, u);
        }
        return min == Double.MAX_VALUE ? 0 : max - min;
    }

    /** Consecutive jobs on the same machine with different materials. */
    public int getMaterialChangeovers() {
        int changes = 0;
        for (Machine machine : problem.getMachines()) {
            String previous = null;
            for (ScheduledJob job : schedule) {
                if (!machine.getId().equals(job.getAssignedMachineId())) continue;
                String material = job.getJob().getMaterialType();
                if (previous != null && !previous.equalsIgnoreCase(String.valueOf(material))) changes++;
                previous = String.valueOf(material);
            }
        }
        return changes;
    }

    public long countByStatus(AssignmentStatus status) {
        return schedule.stream().filter(j -> j.getStatus() == status).count();
    }

    public List<String> getBottleneckMachines() {
        List<String> ids = new ArrayList<>();
        for (PerformanceMetrics.MachineUtilization u : metrics.getMachineUtilization()) {
            if (u.getUtilization() >= bottleneckUtilization) ids.add(u.getMachineId());
        }
        return ids;
    }
}
