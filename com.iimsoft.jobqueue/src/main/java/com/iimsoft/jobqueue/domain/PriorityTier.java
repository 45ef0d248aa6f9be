package com.iimsoft.jobqueue.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Priority tier of a job in the queue, with the tier weight used by priority scoring.
 */
public enum PriorityTier {
    CRITICAL("critical", 10),
    URGENT("urgent", 8),
    HIGH("high", 6),
    NORMAL("normal", 4),
    LOW("low", 2);

    /** Weight used when the tier is missing or unrecognized. */
    public static final int DEFAULT_WEIGHT = NORMAL.weight;

    private final String code;
    private final int weight;

    PriorityTier(String code, int weight) {
        this.code = code;
        this.weight = weight;
    }

    @JsonValue
    public String getCode() { return code; }
    public int getWeight() { return weight; }

    /** Urgent and critical jobs drive the schedule risk ladder. */
    public boolean isUrgent() {
        return this == CRITICAL || this == URGENT;
    }

    /**
     * @return the tier for the given code (case-insensitive), or null when unknown
     */
    public static PriorityTier fromCode(String code) {
        if (code == null) return null;
        for (PriorityTier tier : values()) {
            if (tier.code.equalsIgnoreCase(code.trim())) {
                return tier;
            }
        }
        return null;
    }
}
