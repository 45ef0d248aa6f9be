package com.iimsoft.jobqueue.analysis;

import com.iimsoft.jobqueue.config.OptimizerSettings;
import com.iimsoft.jobqueue.domain.ScheduledJob;
import com.iimsoft.jobqueue.result.CostAnalysis;
import com.iimsoft.jobqueue.result.CostAnalysis.CostBreakdownEntry;

import java.util.List;

/**
 * Flat-rate cost estimate. Rates come from {@link OptimizerSettings}.
 *
 * operating = jobs * baseCostPerJob
 * overtime  = max(0, jobs - overtimeFreeJobs) * overtimeCostPerJob
 * setup     = sum(job setup minutes) * setupCostPerMinute
 */
public class CostModel {

    private final OptimizerSettings settings;

    public CostModel(OptimizerSettings settings) {
        this.settings = settings;
    }

    public CostAnalysis analyze(List<ScheduledJob> schedule) {
        int jobCount = schedule.size();
        double operating = jobCount * settings.getBaseCostPerJob();
        double overtime = Math.max(0, jobCount - settings.getOvertimeFreeJobs()) * settings.getOvertimeCostPerJob();
        double setup = 0;
        for (ScheduledJob job : schedule) {
            setup += job.getJob().getSetupTime() * settings.getSetupCostPerMinute();
        }
        // not modelled yet
        double tardinessPenalty = 0;
        double opportunityCost = 0;

        return CostAnalysis.builder()
                .totalOperatingCost(operating)
                .overtimeCost(overtime)
                .setupCost(setup)
                .tardinessPenalty(tardinessPenalty)
                .opportunityCost(opportunityCost)
                .profitOptimization(jobCount * settings.getProfitOptimizationPerJob())
                .totalCost(operating + overtime + setup + tardinessPenalty + opportunityCost)
                .costBreakdown(List.of(
                        new CostBreakdownEntry("Operating Cost", operating, 60),
                        new CostBreakdownEntry("Setup Cost", setup, 25),
                        new CostBreakdownEntry("Overtime Cost", overtime, 15)))
                .build();
    }
}
