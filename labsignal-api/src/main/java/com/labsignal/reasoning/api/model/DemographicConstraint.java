package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Patient characteristics a rule is restricted to. Every field is optional;
 * an unset field places no restriction.
 *
 * @param requiredSex      sex at birth the patient must have
 * @param minAge           inclusive lower age bound
 * @param maxAge           inclusive upper age bound
 * @param requiresPregnant whether the patient must ({@code true}) or must not
 *                         ({@code false}) be pregnant
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DemographicConstraint(
        @JsonProperty("id") String id,
        @JsonProperty("sex") SexAtBirth requiredSex,
        @JsonProperty("age_min") Integer minAge,
        @JsonProperty("age_max") Integer maxAge,
        @JsonProperty("pregnancy") Boolean requiresPregnant
) {
    @JsonIgnore
    public boolean isUnrestricted() {
        return requiredSex == null && minAge == null && maxAge == null && requiresPregnant == null;
    }
}
