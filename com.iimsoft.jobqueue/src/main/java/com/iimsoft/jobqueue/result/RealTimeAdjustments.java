package com.iimsoft.jobqueue.result;

import lombok.Value;

import java.util.List;

/**
 * Rescheduling triggers and strategies handed to the shop-floor side. Descriptive only;
 * the optimizer never executes them.
 */
@Value
public class RealTimeAdjustments {
    boolean dynamicRescheduling;
    List<String> triggerConditions;
    List<String> adjustmentStrategies;
    List<String> monitoringParameters;

    public static RealTimeAdjustments standard() {
        return new RealTimeAdjustments(true,
                List.of("Machine breakdown or unexpected downtime",
                        "Rush order insertion",
                        "Material availability changes",
                        "Quality issues requiring rework"),
                List.of("Automatic job resequencing",
                        "Load balancing across machines",
                        "Priority escalation protocols",
                        "Resource reallocation"),
                List.of("Real-time machine status",
                        "Job progress tracking",
                        "Quality metrics",
                        "Resource availability"));
    }
}
