package com.iimsoft.jobqueue.domain;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * One self-contained input bundle of an optimization run.
 * {@code referenceTime} is the "now" every component measures against.
 */
public class JobQueueProblem {
    private Instant referenceTime;
    private ZoneId zone = ZoneOffset.UTC;
    private List<Job> jobQueue = new ArrayList<>();
    private List<Machine> machines = new ArrayList<>();
    private OperationalConstraints operationalConstraints = new OperationalConstraints();
    private OptimizationGoals optimizationGoals = new OptimizationGoals();
    private ResourceConstraints resourceConstraints = new ResourceConstraints();
    private QualityRequirements qualityRequirements = new QualityRequirements();

    public JobQueueProblem() {}
    public JobQueueProblem(Instant referenceTime, List<Job> jobQueue, List<Machine> machines) {
        this.referenceTime = referenceTime;
        this.jobQueue = jobQueue;
        this.machines = machines;
    }

    public long getUrgentJobCount() {
        return jobQueue.stream().filter(Job::isUrgent).count();
    }

    public long getAvailableMachineCount() {
        return machines.stream().filter(Machine::isAvailable).count();
    }

    public Instant getReferenceTime() { return referenceTime; }
    public void setReferenceTime(Instant referenceTime) { this.referenceTime = referenceTime; }
    public ZoneId getZone() { return zone; }
    public void setZone(ZoneId zone) { this.zone = zone; }
    public List<Job> getJobQueue() { return jobQueue; }
    public void setJobQueue(List<Job> jobQueue) { this.jobQueue = jobQueue; }
    public List<Machine> getMachines() { return machines; }
    public void setMachines(List<Machine> machines) { this.machines = machines; }
    public OperationalConstraints getOperationalConstraints() { return operationalConstraints; }
    public void setOperationalConstraints(OperationalConstraints operationalConstraints) { this.operationalConstraints = operationalConstraints; }
    public OptimizationGoals getOptimizationGoals() { return optimizationGoals; }
    public void setOptimizationGoals(OptimizationGoals optimizationGoals) { this.optimizationGoals = optimizationGoals; }
    public ResourceConstraints getResourceConstraints() { return resourceConstraints; }
    public void setResourceConstraints(ResourceConstraints resourceConstraints) { this.resourceConstraints = resourceConstraints; }
    public QualityRequirements getQualityRequirements() { return qualityRequirements; }
    public void setQualityRequirements(QualityRequirements qualityRequirements) { this.qualityRequirements = qualityRequirements; }
}
