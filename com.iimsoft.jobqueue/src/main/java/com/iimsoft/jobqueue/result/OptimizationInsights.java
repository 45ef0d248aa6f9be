package com.iimsoft.jobqueue.result;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class OptimizationInsights {
    List<String> improvementAreas;
    List<String> bottleneckIdentification;
    List<String> capacityRecommendations;
    List<String> processImprovements;
    List<String> schedulingStrategies;
}
