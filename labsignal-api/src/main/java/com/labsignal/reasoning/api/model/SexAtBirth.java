package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SexAtBirth {
    FEMALE("female"),
    MALE("male"),
    INTERSEX("intersex"),
    PREFER_NOT_TO_SAY("prefer_not_say");

    private final String code;

    SexAtBirth(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static SexAtBirth fromCode(String code) {
        if (code == null) return null;
        for (SexAtBirth s : values()) {
            if (s.code.equalsIgnoreCase(code.trim())) return s;
        }
        return null;
    }
}
