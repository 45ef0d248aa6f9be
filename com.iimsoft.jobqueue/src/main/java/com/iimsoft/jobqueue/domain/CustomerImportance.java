package com.iimsoft.jobqueue.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Strategic value of the customer behind a job.
 */
public enum CustomerImportance {
    VIP("vip", 1.5),
    PREFERRED("preferred", 1.2),
    STANDARD("standard", 1.0);

    public static final double DEFAULT_WEIGHT = STANDARD.weight;

    private final String code;
    private final double weight;

    CustomerImportance(String code, double weight) {
        this.code = code;
        this.weight = weight;
    }

    @JsonValue
    public String getCode() { return code; }
    public double getWeight() { return weight; }

    public static CustomerImportance fromCode(String code) {
        if (code == null) return null;
        for (CustomerImportance importance : values()) {
            if (importance.code.equalsIgnoreCase(code.trim())) {
                return importance;
            }
        }
        return null;
    }
}
