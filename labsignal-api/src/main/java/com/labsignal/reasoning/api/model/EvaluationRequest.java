package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One patient's readings plus the optional profile collected at intake.
 *
 * @param patient null when the user skipped the intake form
 */
public record EvaluationRequest(
        @JsonProperty("readings") List<Reading> readings,
        @JsonProperty("patient") PatientProfile patient
) {
    public EvaluationRequest {
        readings = readings == null ? List.of() : List.copyOf(readings);
    }
}
