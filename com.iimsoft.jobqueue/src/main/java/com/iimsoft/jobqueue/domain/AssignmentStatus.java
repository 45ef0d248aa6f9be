package com.iimsoft.jobqueue.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a job ended up on its lane.
 */
public enum AssignmentStatus {
    /** Placed on a machine satisfying its material, thickness and availability constraints. */
    ASSIGNED("assigned"),
    /** No compatible machine; placed on the first machine of the pool anyway. */
    FALLBACK("fallback"),
    /** No compatible machine; kept on the holding lane and reported. */
    UNASSIGNED("unassigned");

    private final String code;

    AssignmentStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() { return code; }
}
