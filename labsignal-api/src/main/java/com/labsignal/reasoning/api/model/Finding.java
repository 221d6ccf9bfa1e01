package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A clinical pattern a rule can detect, e.g. "Anemia Pattern".
 */
public record Finding(
        @JsonProperty("id") String id,
        @JsonProperty("label") String label,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("description") String description,
        @JsonProperty("patient_friendly") String patientFriendly
) {
    public Finding {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }
}
