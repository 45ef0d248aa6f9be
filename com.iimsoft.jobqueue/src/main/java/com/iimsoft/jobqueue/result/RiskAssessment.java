package com.iimsoft.jobqueue.result;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RiskAssessment {
    RiskLevel scheduleRisk;
    List<String> riskFactors;
    List<String> contingencyPlans;
    /** Percent, 60..100. */
    double bufferAdequacy;
    List<DeliveryRisk> deliveryRisk;
    List<BufferRecommendation> bufferRecommendations;

    @Value
    public static class DeliveryRisk {
        String jobId;
        RiskLevel riskLevel;
        String mitigation;
    }

    @Value
    public static class BufferRecommendation {
        String jobId;
        double recommendedBuffer;   // minutes
        String reason;
    }
}
