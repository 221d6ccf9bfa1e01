package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Symptom vocabulary offered on the patient intake form.
 */
public enum Symptom {
    FEVER("fever"),
    FATIGUE("fatigue"),
    SHORTNESS_OF_BREATH("shortness_of_breath"),
    BLEEDING_BRUISING("bleeding_bruising"),
    INFECTION_SYMPTOMS("infection_symptoms"),
    NONE("none"),
    OTHER("other");

    private final String code;

    Symptom(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Display form of the code, e.g. "shortness of breath".
     */
    public String displayName() {
        return code.replace('_', ' ');
    }

    /**
     * @throws IllegalArgumentException if the code is not part of the vocabulary
     */
    @JsonCreator
    public static Symptom fromCode(String code) {
        if (code == null) return null;
        for (Symptom s : values()) {
            if (s.code.equalsIgnoreCase(code.trim())) return s;
        }
        throw new IllegalArgumentException("Unknown symptom: " + code);
    }
}
