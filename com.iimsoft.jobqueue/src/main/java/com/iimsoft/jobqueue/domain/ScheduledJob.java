package com.iimsoft.jobqueue.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A job placed on the timeline. Immutable.
 * {@code scheduledEnd - scheduledStart == effectiveSetupTime + estimatedDuration} minutes.
 */
public final class ScheduledJob {
    private final Job job;
    private final String assignedMachineId;     // null when unassigned
    private final AssignmentStatus status;
    private final Instant scheduledStart;
    private final Instant scheduledEnd;
    private final double effectiveSetupTime;    // minutes
    private final int sequenceNumber;
    private final double bufferTime;            // minutes

    public ScheduledJob(Job job, String assignedMachineId, AssignmentStatus status,
                        Instant scheduledStart, double effectiveSetupTime,
                        int sequenceNumber, double bufferTime) {
        this.job = Objects.requireNonNull(job, "job");
        this.assignedMachineId = assignedMachineId;
        this.status = Objects.requireNonNull(status, "status");
        this.scheduledStart = Objects.requireNonNull(scheduledStart, "scheduledStart");
        this.effectiveSetupTime = effectiveSetupTime;
        this.scheduledEnd = scheduledStart.plus(minutes(effectiveSetupTime + job.getEstimatedDuration()));
        this.sequenceNumber = sequenceNumber;
        this.bufferTime = bufferTime;
    }

    /** Minutes as a millisecond-precise duration. */
    public static Duration minutes(double minutes) {
        return Duration.ofMillis(Math.round(minutes * 60_000d));
    }

    public double getProcessingMinutes() {
        return effectiveSetupTime + job.getEstimatedDuration();
    }

    /** The instant the next job on the same lane may start. */
    public Instant getReleaseTime() {
        return scheduledEnd.plus(minutes(bufferTime));
    }

    public boolean isAssigned() {
        return assignedMachineId != null;
    }

    public boolean isLate() {
        return job.getDueDate() != null && scheduledEnd.isAfter(job.getDueDate());
    }

    /** Hours past the due date; 0 when on time or without due date. */
    public double getTardinessHours() {
        if (!isLate()) return 0;
        return Duration.between(job.getDueDate(), scheduledEnd).toMillis() / 3_600_000d;
    }

    public Job getJob() { return job; }
    public String getAssignedMachineId() { return assignedMachineId; }
    public AssignmentStatus getStatus() { return status; }
    public Instant getScheduledStart() { return scheduledStart; }
    public Instant getScheduledEnd() { return scheduledEnd; }
    public double getEffectiveSetupTime() { return effectiveSetupTime; }
    public int getSequenceNumber() { return sequenceNumber; }
    public double getBufferTime() { return bufferTime; }

    @Override
    public String toString() {
        return "#" + sequenceNumber + " " + job.getId() + " @" + (assignedMachineId == null ? "-" : assignedMachineId)
                + " [" + scheduledStart + " .. " + scheduledEnd + "]";
    }
}
