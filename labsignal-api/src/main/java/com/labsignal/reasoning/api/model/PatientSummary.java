package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Display digest of a {@link PatientProfile}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PatientSummary(
        @JsonProperty("age_group") String ageGroup,
        @JsonProperty("sex_display") String sexDisplay,
        @JsonProperty("pregnancy_display") String pregnancyDisplay,
        @JsonProperty("symptoms_display") List<String> symptomsDisplay
) {
    public PatientSummary {
        symptomsDisplay = symptomsDisplay == null ? List.of() : List.copyOf(symptomsDisplay);
    }
}
