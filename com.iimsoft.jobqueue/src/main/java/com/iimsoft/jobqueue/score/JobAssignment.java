package com.iimsoft.jobqueue.score;

import com.iimsoft.jobqueue.domain.Job;
import com.iimsoft.jobqueue.domain.Machine;
import org.optaplanner.core.api.domain.entity.PlanningEntity;
import org.optaplanner.core.api.domain.lookup.PlanningId;
import org.optaplanner.core.api.domain.variable.PlanningVariable;

/**
 * One scheduled job as seen by the constraint streams. Times are whole minutes after {@code now}.
 */
@PlanningEntity
public class JobAssignment {

    @PlanningId
    private Long id;

    private Job job;

    // null = no compatible machine
    @PlanningVariable(valueRangeProviderRefs = "machineRange", nullable = true)
    private Machine machine;

    private long startMinute;
    private long endMinute;
    private long setupMinutes;
    private Long dueMinute;

    public JobAssignment() {}

    public JobAssignment(Long id, Job job, Machine machine,
                         long startMinute, long endMinute, long setupMinutes, Long dueMinute) {
        this.id = id;
        this.job = job;
        this.machine = machine;
        this.startMinute = startMinute;
        this.endMinute = endMinute;
        this.setupMinutes = setupMinutes;
        this.dueMinute = dueMinute;
    }

    public boolean overlaps(JobAssignment other) {
        return startMinute < other.endMinute && other.startMinute < endMinute;
    }

    public long getTardinessMinutes() {
        return dueMinute == null ? 0 : Math.max(0, endMinute - dueMinute);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Job getJob() { return job; }
    public void setJob(Job job) { this.job = job; }
    public Machine getMachine() { return machine; }
    public void setMachine(Machine machine) { this.machine = machine; }
    public long getStartMinute() { return startMinute; }
    public void setStartMinute(long startMinute) { this.startMinute = startMinute; }
    public long getEndMinute() { return endMinute; }
    public void setEndMinute(long endMinute) { this.endMinute = endMinute; }
    public long getSetupMinutes() { return setupMinutes; }
    public void setSetupMinutes(long setupMinutes) { this.setupMinutes = setupMinutes; }
    public Long getDueMinute() { return dueMinute; }
    public void setDueMinute(Long dueMinute) { this.dueMinute = dueMinute; }

    @Override
    public String toString() {
        return "Assignment{" + job.getId() + " -> " + (machine == null ? "NONE" : machine.getId())
                + " [" + startMinute + ", " + endMinute + ")}";
    }
}
