package com.iimsoft.jobqueue.result;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Schedule risk, ordered from lowest to highest.
 */
public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String code;

    RiskLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() { return code; }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }
}
