package com.iimsoft.jobqueue.result;

import com.iimsoft.jobqueue.domain.ScheduledJob;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result bundle of one optimization run.
 */
@Value
@Builder
public class OptimizationResult {
    List<ScheduledJob> optimizedSchedule;
    List<ScheduledJob> unassignableJobs;
    PerformanceMetrics performanceMetrics;
    ResourceUtilization resourceUtilization;
    CostAnalysis costAnalysis;
    RiskAssessment riskAssessment;
    OptimizationInsights optimizationInsights;
    List<Scenario> alternativeSchedules;
    SensitivityAnalysis sensitivityAnalysis;
    RealTimeAdjustments realTimeAdjustments;
    CustomerImpact customerImpact;
    AlertsAndRecommendations alertsAndRecommendations;
    List<String> recommendations;
    Map<String, String> keyMetrics;
    String scheduleScore;
}
