package com.iimsoft.jobqueue.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MachineStatus {
    AVAILABLE("available"),
    BUSY("busy"),
    MAINTENANCE("maintenance"),
    OFFLINE("offline");

    private final String code;

    MachineStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() { return code; }

    public static MachineStatus fromCode(String code) {
        if (code == null) return null;
        for (MachineStatus status : values()) {
            if (status.code.equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        return null;
    }
}
