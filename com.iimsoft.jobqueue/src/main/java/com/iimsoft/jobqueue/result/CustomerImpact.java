package com.iimsoft.jobqueue.result;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CustomerImpact {
    /** 1..10 */
    double customerSatisfactionScore;
    List<DeliveryPerformance> deliveryPerformance;
    List<CommunicationPlanEntry> communicationPlan;

    @Value
    public static class DeliveryPerformance {
        String customerTier;
        int jobCount;
        double onTimeRate;
        double satisfaction;
    }

    @Value
    public static class CommunicationPlanEntry {
        String jobId;
        String customerNotification;
        String timing;
    }
}
