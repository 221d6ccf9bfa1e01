package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON representation of a clinical catalog for deserialization.
 * A plain DTO used only while loading; the compiler validates it and
 * turns it into an immutable catalog snapshot.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogDefinition(
        @JsonProperty("version") String version,
        @JsonProperty("tests") List<TestDef> tests,
        @JsonProperty("findings") List<FindingDef> findings,
        @JsonProperty("conditions") List<ConditionDef> conditions,
        @JsonProperty("actions") List<ActionDef> actions,
        @JsonProperty("demographic_constraints") List<ConstraintDef> demographicConstraints,
        @JsonProperty("rules") List<RuleDef> rules
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TestDef(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("unit") String unit,
            @JsonProperty("aliases") List<String> aliases,
            @JsonProperty("loinc") String loinc,
            @JsonProperty("panel") String panel,
            @JsonProperty("label") String label,
            @JsonProperty("description") String description
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FindingDef(
            @JsonProperty("id") String id,
            @JsonProperty("label") String label,
            @JsonProperty("severity") String severity,
            @JsonProperty("description") String description,
            @JsonProperty("patient_friendly") String patientFriendly,
            @JsonProperty("indicates") List<String> indicates
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConditionDef(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("urgency_level") String urgencyLevel,
            @JsonProperty("urgent_actions") List<String> urgentActions
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ActionDef(
            @JsonProperty("id") String id,
            @JsonProperty("label") String label,
            @JsonProperty("description") String description,
            @JsonProperty("priority") String priority
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConstraintDef(
            @JsonProperty("id") String id,
            @JsonProperty("sex") String sex,
            @JsonProperty("age_min") Integer ageMin,
            @JsonProperty("age_max") Integer ageMax,
            @JsonProperty("pregnancy") Boolean pregnancy
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RuleDef(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("logic_type") String logicType,
            @JsonProperty("rationale") String rationale,
            @JsonProperty("evidence_level") String evidenceLevel,
            @JsonProperty("thresholds") List<ThresholdDef> thresholds,
            @JsonProperty("constraint") String constraint,
            @JsonProperty("finding") String finding
    ) {}

    /**
     * A threshold as authored. Which of {@code value}, {@code value_min} and
     * {@code value_max} must be present depends on the operator.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ThresholdDef(
            @JsonProperty("id") String id,
            @JsonProperty("test_id") String testId,
            @JsonProperty("operator") String operator,
            @JsonProperty("value") Double value,
            @JsonProperty("value_min") Double valueMin,
            @JsonProperty("value_max") Double valueMax,
            @JsonProperty("unit") String unit
    ) {}
}
