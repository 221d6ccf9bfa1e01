package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Informational tag describing how a rule was authored. Evaluation is always
 * the conjunction of the rule's thresholds regardless of the tag.
 */
public enum LogicType {
    THRESHOLD("threshold"),
    COMBINATION("combination"),
    PATTERN("pattern");

    private final String code;

    LogicType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static LogicType fromCode(String code) {
        if (code == null) return null;
        for (LogicType t : values()) {
            if (t.code.equalsIgnoreCase(code.trim())) return t;
        }
        return null;
    }
}
