package com.iimsoft.jobqueue.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OperatorSkillLevel {
    BASIC("basic"),
    INTERMEDIATE("intermediate"),
    ADVANCED("advanced"),
    EXPERT("expert");

    private final String code;

    OperatorSkillLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() { return code; }

    public static OperatorSkillLevel fromCode(String code) {
        if (code == null) return null;
        for (OperatorSkillLevel level : values()) {
            if (level.code.equalsIgnoreCase(code.trim())) {
                return level;
            }
        }
        return null;
    }
}
