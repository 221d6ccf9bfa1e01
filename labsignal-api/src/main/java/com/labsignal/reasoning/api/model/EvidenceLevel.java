package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Strength of the clinical evidence behind a rule.
 */
public enum EvidenceLevel {
    EXPERT_OPINION("expert_opinion"),
    OBSERVATIONAL("observational"),
    CLINICAL_TRIAL("clinical_trial"),
    META_ANALYSIS("meta_analysis");

    private final String code;

    EvidenceLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static EvidenceLevel fromCode(String code) {
        if (code == null) return null;
        for (EvidenceLevel e : values()) {
            if (e.code.equalsIgnoreCase(code.trim())) return e;
        }
        return null;
    }
}
