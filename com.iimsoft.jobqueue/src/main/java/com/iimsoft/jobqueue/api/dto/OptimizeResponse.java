package com.iimsoft.jobqueue.api.dto;

import com.iimsoft.jobqueue.result.AlertsAndRecommendations;
import com.iimsoft.jobqueue.result.CostAnalysis;
import com.iimsoft.jobqueue.result.CustomerImpact;
import com.iimsoft.jobqueue.result.OptimizationInsights;
import com.iimsoft.jobqueue.result.PerformanceMetrics;
import com.iimsoft.jobqueue.result.RealTimeAdjustments;
import com.iimsoft.jobqueue.result.ResourceUtilization;
import com.iimsoft.jobqueue.result.RiskAssessment;
import com.iimsoft.jobqueue.result.Scenario;
import com.iimsoft.jobqueue.result.SensitivityAnalysis;

import java.util.List;
import java.util.Map;

public class OptimizeResponse {

    /** The "now" the schedule was computed against. */
    public String referenceTime;

    public List<ScheduledJobDto> optimizedSchedule;
    public List<ScheduledJobDto> unassignableJobs;
    public PerformanceMetrics performanceMetrics;
    public ResourceUtilization resourceUtilization;
    public CostAnalysis costAnalysis;
    public RiskAssessment riskAssessment;
    public OptimizationInsights optimizationInsights;
    public List<Scenario> alternativeSchedules;
    public SensitivityAnalysis sensitivityAnalysis;
    public RealTimeAdjustments realTimeAdjustments;
    public CustomerImpact customerImpact;
    public AlertsAndRecommendations alertsAndRecommendations;
    public List<String> recommendations;
    public Map<String, String> keyMetrics;
    /** Constraint score, e.g. "0hard/-1234soft". */
    public String scheduleScore;

    public static class ScheduledJobDto {
        public String jobId;
        public String jobName;
        public String assignedMachine;      // null when unassigned
        public String assignmentStatus;
        public String scheduledStart;       // ISO-8601
        public String scheduledEnd;
        public double estimatedDuration;    // minutes
        public double setupTime;            // effective, minutes
        public String priority;
        public int sequenceNumber;
        public double bufferTime;           // minutes
        public boolean late;
    }
}
