package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A medical condition that one or more findings may indicate.
 */
public record Condition(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("urgency_level") UrgencyLevel urgencyLevel
) {
    public Condition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(urgencyLevel, "urgencyLevel must not be null");
    }
}
