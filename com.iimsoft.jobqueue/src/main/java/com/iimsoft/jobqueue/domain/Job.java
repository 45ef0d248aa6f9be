package com.iimsoft.jobqueue.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A pending cutting job in the queue.
 */
public class Job {
    private String id;
    private String name;
    private PriorityTier priority;          // null when the submitted code is unknown
    private Instant dueDate;
    private double estimatedDuration;       // minutes
    private String materialType;
    private double thickness;               // mm
    private double setupTime;               // minutes, nominal (before machine multiplier)
    private int partCount;
    private CustomerImportance customerImportance;
    private double profitMargin;            // percent
    private List<String> dependencies = new ArrayList<>();

    public Job() {}
    public Job(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public boolean isUrgent() {
        return priority != null && priority.isUrgent();
    }

    public int getPriorityWeight() {
        return priority == null ? PriorityTier.DEFAULT_WEIGHT : priority.getWeight();
    }

    public double getCustomerWeight() {
        return customerImportance == null ? CustomerImportance.DEFAULT_WEIGHT : customerImportance.getWeight();
    }

    /** Field-by-field copy with its own dependency list. */
    public Job copy() {
        Job copy = new Job(id, name);
        copy.priority = priority;
        copy.dueDate = dueDate;
        copy.estimatedDuration = estimatedDuration;
        copy.materialType = materialType;
        copy.thickness = thickness;
        copy.setupTime = setupTime;
        copy.partCount = partCount;
        copy.customerImportance = customerImportance;
        copy.profitMargin = profitMargin;
        copy.dependencies = dependencies == null ? null : new ArrayList<>(dependencies);
        return copy;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public PriorityTier getPriority() { return priority; }
    public void setPriority(PriorityTier priority) { this.priority = priority; }
    public Instant getDueDate() { return dueDate; }
    public void setDueDate(Instant dueDate) { this.dueDate = dueDate; }
    public double getEstimatedDuration() { return estimatedDuration; }
    public void setEstimatedDuration(double estimatedDuration) { this.estimatedDuration = estimatedDuration; }
    public String getMaterialType() { return materialType; }
    public void setMaterialType(String materialType) { this.materialType = materialType; }
    public double getThickness() { return thickness; }
    public void setThickness(double thickness) { this.thickness = thickness; }
    public double getSetupTime() { return setupTime; }
    public void setSetupTime(double setupTime) { this.setupTime = setupTime; }
    public int getPartCount() { return partCount; }
    public void setPartCount(int partCount) { this.partCount = partCount; }
    public CustomerImportance getCustomerImportance() { return customerImportance; }
    public void setCustomerImportance(CustomerImportance customerImportance) { this.customerImportance = customerImportance; }
    public double getProfitMargin() { return profitMargin; }
    public void setProfitMargin(double profitMargin) { this.profitMargin = profitMargin; }
    public List<String> getDependencies() { return dependencies; }
    public void setDependencies(List<String> dependencies) { this.dependencies = dependencies; }

    @Override
    public String toString() {
        return "Job " + id;
    }
}
