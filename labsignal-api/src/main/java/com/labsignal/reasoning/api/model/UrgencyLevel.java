/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How soon a medical condition should be looked at, ordered from least to most urgent.
 */
public enum UrgencyLevel {
    ROUTINE("routine"),
    SOON("soon"),
    URGENT("urgent"),
    EMERGENCY("emergency");

    private final String code;

    UrgencyLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static UrgencyLevel fromCode(String code) {
        if (code == null) return null;
        for (UrgencyLevel u : values()) {
            if (u.code.equalsIgnoreCase(code.trim())) return u;
        }
        return null;
    }
}
