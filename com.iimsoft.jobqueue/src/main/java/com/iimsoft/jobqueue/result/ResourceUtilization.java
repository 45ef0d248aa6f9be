package com.iimsoft.jobqueue.result;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ResourceUtilization {
    double operatorUtilization;
    List<MachineEfficiency> machineEfficiency;
    List<MaterialUsage> materialUsage;
    List<ToolingUtilization> toolingUtilization;
    List<ShiftCoverage> shiftCoverage;

    @Value
    public static class MachineEfficiency {
        String machineId;
        double efficiency;
        double utilization;
        boolean bottleneck;
    }

    @Value
    public static class MaterialUsage {
        String materialType;
        int requiredParts;
        double utilization;
        boolean shortage;
    }

    @Value
    public static class ToolingUtilization {
        String toolType;
        double utilization;
        boolean availability;
    }

    @Value
    public static class ShiftCoverage {
        String shiftId;
        double coverage;
        boolean overtime;
    }
}
