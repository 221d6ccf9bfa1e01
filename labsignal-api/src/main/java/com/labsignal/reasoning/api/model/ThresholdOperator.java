/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operators a threshold can apply to a reading.
 *
 * <p>The wire codes ({@code >}, {@code <}, {@code >=}, {@code <=},
 * {@code between}, {@code abnormal_flag}) are the ones used in catalog JSON.
 * {@link #fromString(String)} also accepts the constant names
 * (e.g. {@code GREATER_THAN}).
 */
public enum ThresholdOperator {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    BETWEEN("between"),
    ABNORMAL_FLAG("abnormal_flag");

    private final String code;

    ThresholdOperator(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Returns true for the four single-bound comparison operators.
     */
    public boolean isComparison() {
        return this == GREATER_THAN || this == LESS_THAN
                || this == GREATER_OR_EQUAL || this == LESS_OR_EQUAL;
    }

    /**
     * Resolves an operator from its wire code or constant name.
     *
     * @return the operator, or null if the string names no operator
     */
    @JsonCreator
    public static ThresholdOperator fromString(String value) {
        if (value == null) return null;
        String normalized = value.trim();
        for (ThresholdOperator op : values()) {
            if (op.code.equalsIgnoreCase(normalized) || op.name().equalsIgnoreCase(normalized)) {
                return op;
            }
        }
        return null;
    }
}
