package com.iimsoft.jobqueue.domain;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A laser cutting machine of the pool.
 */
public class Machine {
    private String id;
    private String name;
    private double maxPower;                 // W
    private Set<String> materialCompatibility = new LinkedHashSet<>();
    private ThicknessRange thicknessRange = new ThicknessRange(0, Double.MAX_VALUE);
    private MachineStatus status = MachineStatus.AVAILABLE;
    private double efficiency = 100;         // percent
    private double setupTimeMultiplier = 1.0;
    private OperatorSkillLevel operatorSkillLevel;

    public Machine() {}
    public Machine(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public boolean isAvailable() {
        return status == MachineStatus.AVAILABLE;
    }

    /** Material names compare ignoring case. */
    public boolean supportsMaterial(String materialType) {
        if (materialType == null || materialCompatibility == null) {
            return false;
        }
        return materialCompatibility.stream().anyMatch(materialType::equalsIgnoreCase);
    }

    public boolean supportsThickness(double thickness) {
        return thicknessRange != null && thicknessRange.contains(thickness);
    }

    /** Available, material compatible and within the thickness range. */
    public boolean canProcess(Job job) {
        return isAvailable() && supportsMaterial(job.getMaterialType()) && supportsThickness(job.getThickness());
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public double getMaxPower() { return maxPower; }
    public void setMaxPower(double maxPower) { this.maxPower = maxPower; }
    public Set<String> getMaterialCompatibility() { return materialCompatibility; }
    public void setMaterialCompatibility(Set<String> materialCompatibility) { this.materialCompatibility = materialCompatibility; }
    public ThicknessRange getThicknessRange() { return thicknessRange; }
    public void setThicknessRange(ThicknessRange thicknessRange) { this.thicknessRange = thicknessRange; }
    public MachineStatus getStatus() { return status; }
    public void setStatus(MachineStatus status) { this.status = status; }
    public double getEfficiency() { return efficiency; }
    public void setEfficiency(double efficiency) { this.efficiency = efficiency; }
    public double getSetupTimeMultiplier() { return setupTimeMultiplier; }
    public void setSetupTimeMultiplier(double setupTimeMultiplier) { this.setupTimeMultiplier = setupTimeMultiplier; }
    public OperatorSkillLevel getOperatorSkillLevel() { return operatorSkillLevel; }
    public void setOperatorSkillLevel(OperatorSkillLevel operatorSkillLevel) { this.operatorSkillLevel = operatorSkillLevel; }

    @Override
    public String toString() {
        return "Machine " + id;
    }
}
