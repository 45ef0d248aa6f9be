package com.iimsoft.jobqueue.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Quality settings of the run. Sequencing ignores them; quality alerts read them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QualityRequirements {
    private double allowableRework;         // percent
    private double qualityCheckTime;        // minutes per job
    private String inspectionRequirements;  // none / sampling / full / critical_only
    private double qualityGateThreshold;    // 1-10
}
