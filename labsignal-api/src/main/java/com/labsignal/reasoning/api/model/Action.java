package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A recommended next step linked from a condition.
 *
 * @param description guidance text shown to the patient
 */
public record Action(
        @JsonProperty("id") String id,
        @JsonProperty("label") String label,
        @JsonProperty("description") String description,
        @JsonProperty("priority") Priority priority
) {
    public Action {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
    }
}
