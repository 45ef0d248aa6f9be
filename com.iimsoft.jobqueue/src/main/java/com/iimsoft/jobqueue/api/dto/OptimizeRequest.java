package com.iimsoft.jobqueue.api.dto;

import java.util.List;

public class OptimizeRequest {

    /** Optional "now" of the run, ISO-8601; defaults to the service clock. */
    public String referenceTime;
    /** Optional zone for due dates without offset and for working hours; default UTC. */
    public String timeZone;

    public List<JobDto> jobQueue;
    public List<MachineDto> machineCapabilities;
    public OperationalConstraintsDto operationalConstraints;
    public OptimizationGoalsDto optimizationGoals;
    public ResourceConstraintsDto resourceConstraints;
    public QualityRequirementsDto qualityRequirements;

    public static class JobDto {
        public String jobId;
        public String jobName;
        public String priority;             // low/normal/high/urgent/critical
        public String dueDate;              // ISO date or date-time
        public double estimatedDuration;    // minutes
        public String materialType;
        public double thickness;            // mm
        public double setupTime;            // minutes
        public int partCount;
        public String customerImportance;   // standard/preferred/vip
        public double profitMargin;         // percent
        public List<String> dependencies;
    }

    public static class MachineDto {
        public String machineId;
        public String machineName;
        public double maxPower;
        public List<String> materialCompatibility;
        public RangeDto thicknessRange;
        public String currentStatus;        // available/busy/maintenance/offline
        public Double efficiency;
        public Double setupTimeMultiplier;
        public String operatorSkillLevel;
    }

    public static class RangeDto {
        public double min;
        public double max;
    }

    public static class TimeWindowDto {
        public String start;                // HH:MM
        public String end;
    }

    public static class OperationalConstraintsDto {
        public TimeWindowDto workingHours;
        public List<String> workingDays;    // monday, tuesday, ...
        public double maxOvertimeHours;
        public double minimumBreakTime;
        public double maxContinuousRunTime;
        public List<MaintenanceWindowDto> maintenanceWindows;
    }

    public static class MaintenanceWindowDto {
        public String start;
        public String end;
        public String frequency;
    }

    public static class OptimizationGoalsDto {
        public String primaryObjective;
        public List<String> secondaryObjectives;
        public double customerSatisfactionWeight;
        public double profitabilityWeight;
        public double efficiencyWeight;
        public double urgencyWeight;
    }

    public static class ResourceConstraintsDto {
        public int availableOperators;
        public List<OperatorShiftDto> operatorShifts;
        public List<MaterialAvailabilityDto> materialAvailability;
        public List<ToolingAvailabilityDto> toolingAvailability;
    }

    public static class OperatorShiftDto {
        public String shiftId;
        public String startTime;
        public String endTime;
        public int operatorCount;
    }

    public static class MaterialAvailabilityDto {
        public String materialType;
        public double availableQuantity;
        public double leadTime;
    }

    public static class ToolingAvailabilityDto {
        public String toolType;
        public boolean available;
        public double setupTime;
    }

    public static class QualityRequirementsDto {
        public double allowableRework;
        public double qualityCheckTime;
        public String inspectionRequirements;
        public double qualityGateThreshold;
    }
}
