package com.iimsoft.jobqueue.result;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CostAnalysis {
    double totalOperatingCost;
    double overtimeCost;
    double setupCost;
    double tardinessPenalty;
    double opportunityCost;
    double profitOptimization;
    double totalCost;
    List<CostBreakdownEntry> costBreakdown;

    @Value
    public static class CostBreakdownEntry {
        String category;
        double amount;
        double percentage;
    }
}
