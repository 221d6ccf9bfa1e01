/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Priority of a recommended action. Only {@link #HIGH} and {@link #CRITICAL}
 * actions are surfaced as clinical signals.
 */
public enum Priority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String code;

    Priority(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Returns true if actions of this priority are surfaced in the signal bundle.
     */
    public boolean isSurfaced() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonCreator
    public static Priority fromCode(String code) {
        if (code == null) return null;
        for (Priority p : values()) {
            if (p.code.equalsIgnoreCase(code.trim())) return p;
        }
        return null;
    }
}
