package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PregnancyStatus {
    PREGNANT("pregnant"),
    NOT_PREGNANT("not_pregnant"),
    UNKNOWN("unknown");

    private final String code;

    PregnancyStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static PregnancyStatus fromCode(String code) {
        if (code == null || code.isBlank()) return UNKNOWN;
        for (PregnancyStatus p : values()) {
            if (p.code.equalsIgnoreCase(code.trim())) return p;
        }
        throw new IllegalArgumentException("Unknown pregnancy_status: " + code);
    }
}
