package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Set;

/**
 * Reference data for one laboratory test.
 *
 * <p>{@code aliases} exist for the upstream normalization pipeline; the engine
 * itself only ever matches on {@code canonicalName}.
 */
public record LabTest(
        @JsonProperty("id") String id,
        @JsonProperty("name") String canonicalName,
        @JsonProperty("unit") String unit,
        @JsonProperty("aliases") Set<String> aliases,
        @JsonProperty("loinc") String loinc,
        @JsonProperty("panel") String panel,
        @JsonProperty("label") String label,
        @JsonProperty("description") String description
) {
    public LabTest {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(canonicalName, "canonicalName must not be null");
        aliases = aliases == null ? Set.of() : Set.copyOf(aliases);
    }
}
