/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Abnormal flag printed by the laboratory next to a result.
 *
 * <p>Wire codes follow lab report conventions: {@code H}, {@code L},
 * {@code HH}, {@code LL}. A missing or blank flag maps to {@link #NONE}.
 */
public enum AbnormalFlag {
    HIGH("H"),
    LOW("L"),
    HIGH_HIGH("HH"),
    LOW_LOW("LL"),
    NONE("");

    private final String code;

    AbnormalFlag(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Returns true for every flag except {@link #NONE}.
     */
    public boolean isAbnormal() {
        return this != NONE;
    }

    @JsonCreator
    public static AbnormalFlag fromCode(String code) {
        if (code == null || code.isBlank()) return NONE;
        String normalized = code.trim();
        for (AbnormalFlag f : values()) {
            if (f != NONE && f.code.equalsIgnoreCase(normalized)) return f;
        }
        return switch (normalized.toLowerCase()) {
            case "high" -> HIGH;
            case "low" -> LOW;
            case "critical_high", "high_high" -> HIGH_HIGH;
            case "critical_low", "low_low" -> LOW_LOW;
            default -> NONE;
        };
    }
}
