package com.iimsoft.jobqueue.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables of the optimizer: buffer rule, cost rates, thresholds and the unassignable-job policy.
 *
 * Source (highest priority first):
 * 1) JVM property: -Djobqueue.settings=JSON (only the listed fields need to be present)
 * 2) defaults of this class
 *
 * Instances are never mutated after loading; each optimizer keeps its own.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OptimizerSettings {

    /** JVM property key */
    public static final String SETTINGS_JSON_PROPERTY = "jobqueue.settings";

    private static final Logger LOGGER = LoggerFactory.getLogger(OptimizerSettings.class);

    @JsonProperty("minimumBufferMinutes")
    private double minimumBufferMinutes = 5;

    @JsonProperty("bufferFraction")
    private double bufferFraction = 0.1;

    @JsonProperty("baseCostPerJob")
    private double baseCostPerJob = 150;

    @JsonProperty("overtimeCostPerJob")
    private double overtimeCostPerJob = 50;

    /** Jobs the regular shift absorbs before overtime cost applies. */
    @JsonProperty("overtimeFreeJobs")
    private int overtimeFreeJobs = 5;

    @JsonProperty("setupCostPerMinute")
    private double setupCostPerMinute = 3;

    @JsonProperty("profitOptimizationPerJob")
    private double profitOptimizationPerJob = 75;

    /** Utilization percentage from which a machine counts as a bottleneck. */
    @JsonProperty("bottleneckUtilization")
    private double bottleneckUtilization = 85;

    @JsonProperty("unassignablePolicy")
    private UnassignablePolicy unassignablePolicy = UnassignablePolicy.FLAG_UNASSIGNABLE;

    public OptimizerSettings() {
    }

    public static OptimizerSettings defaults() {
        return new OptimizerSettings();
    }

    /**
     * Reads the JVM property; falls back to defaults when it is absent or invalid.
     */
    public static OptimizerSettings load() {
        String json = System.getProperty(SETTINGS_JSON_PROPERTY);
        if (json == null || json.isBlank()) {
            return defaults();
        }
        try {
            return fromJson(json);
        } catch (Exception e) {
            LOGGER.warn("Ignoring invalid -D{} value, using defaults: {}", SETTINGS_JSON_PROPERTY, e.getMessage());
            return defaults();
        }
    }

    public static OptimizerSettings fromJson(String json) throws java.io.IOException {
        return new ObjectMapper().readValue(json, OptimizerSettings.class);
    }

    public double getMinimumBufferMinutes() {
        return minimumBufferMinutes;
    }

    public double getBufferFraction() {
        return bufferFraction;
    }

    public double getBaseCostPerJob() {
        return baseCostPerJob;
    }

    public double getOvertimeCostPerJob() {
        return overtimeCostPerJob;
    }

    public int getOvertimeFreeJobs() {
        return overtimeFreeJobs;
    }

    public double getSetupCostPerMinute() {
        return setupCostPerMinute;
    }

    public double getProfitOptimizationPerJob() {
        return profitOptimizationPerJob;
    }

    public double getBottleneckUtilization() {
        return bottleneckUtilization;
    }

    public UnassignablePolicy getUnassignablePolicy() {
        return unassignablePolicy;
    }

    /** Copy with another unassignable policy. */
    public OptimizerSettings withUnassignablePolicy(UnassignablePolicy policy) {
        OptimizerSettings copy = new OptimizerSettings();
        copy.minimumBufferMinutes = minimumBufferMinutes;
        copy.bufferFraction = bufferFraction;
        copy.baseCostPerJob = baseCostPerJob;
        copy.overtimeCostPerJob = overtimeCostPerJob;
        copy.overtimeFreeJobs = overtimeFreeJobs;
        copy.setupCostPerMinute = setupCostPerMinute;
        copy.profitOptimizationPerJob = profitOptimizationPerJob;
        copy.bottleneckUtilization = bottleneckUtilization;
        copy.unassignablePolicy = policy;
        return copy;
    }
}
