package com.iimsoft.jobqueue.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class ResourceConstraints {
    private int availableOperators;
    private List<OperatorShift> operatorShifts = new ArrayList<>();
    private List<MaterialStock> materialAvailability = new ArrayList<>();
    private List<ToolingStock> toolingAvailability = new ArrayList<>();

    public ResourceConstraints(int availableOperators) {
        this.availableOperators = availableOperators;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OperatorShift {
        private String shiftId;
        private LocalTime startTime;
        private LocalTime endTime;
        private int operatorCount;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MaterialStock {
        private String materialType;
        private double availableQuantity;
        private double leadTime;            // days
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolingStock {
        private String toolType;
        private boolean available;
        private double setupTime;           // minutes
    }
}
