package com.iimsoft.jobqueue.result;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AlertsAndRecommendations {
    List<String> urgentActions;
    List<String> capacityWarnings;
    List<String> qualityAlerts;
    List<String> efficiencyImprovements;
    List<String> schedulingTips;
}
