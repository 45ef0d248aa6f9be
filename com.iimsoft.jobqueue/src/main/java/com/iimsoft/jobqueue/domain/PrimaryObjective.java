package com.iimsoft.jobqueue.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Primary objective selected on the optimization goals. Informational for sequencing;
 * the weights drive the priority score.
 */
public enum PrimaryObjective {
    MINIMIZE_MAKESPAN("minimize_makespan"),
    MAXIMIZE_THROUGHPUT("maximize_throughput"),
    MINIMIZE_TARDINESS("minimize_tardiness"),
    MAXIMIZE_PROFIT("maximize_profit"),
    BALANCE_WORKLOAD("balance_workload");

    private final String code;

    PrimaryObjective(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() { return code; }

    public static PrimaryObjective fromCode(String code) {
        if (code == null) return null;
        for (PrimaryObjective objective : values()) {
            if (objective.code.equalsIgnoreCase(code.trim())) {
                return objective;
            }
        }
        return null;
    }
}
