/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Optional per-request patient context collected by the intake form.
 *
 * <p>The engine assumes a profile is valid; callers at the API boundary are
 * expected to reject profiles whose {@link #violations()} is non-empty.
 *
 * @param age               whole years, 0 to 120; null only when the intake omitted it
 * @param sexAtBirth        sex assigned at birth
 * @param pregnancyStatus   pregnancy status; {@link PregnancyStatus#UNKNOWN} when not given
 * @param symptoms          reported symptoms, at least one (may be just {@link Symptom#NONE})
 * @param symptomsOtherText free text for {@link Symptom#OTHER}
 */
public record PatientProfile(
        @JsonProperty("age") Integer age,
        @JsonProperty("sex_at_birth") SexAtBirth sexAtBirth,
        @JsonProperty("pregnancy_status") PregnancyStatus pregnancyStatus,
        @JsonProperty("symptoms") Set<Symptom> symptoms,
        @JsonProperty("symptoms_other_text") String symptomsOtherText
) {
    public static final int MIN_AGE = 0;
    public static final int MAX_AGE = 120;
    public static final int MAX_OTHER_TEXT_LENGTH = 500;

    public PatientProfile {
        if (pregnancyStatus == null) pregnancyStatus = PregnancyStatus.UNKNOWN;
        // unknown codes fail in Symptom.fromCode; only JSON nulls are skipped here
        EnumSet<Symptom> known = EnumSet.noneOf(Symptom.class);
        if (symptoms != null) {
            for (Symptom symptom : symptoms) {
                if (symptom != null) known.add(symptom);
            }
        }
        symptoms = Collections.unmodifiableSet(known);
    }

    public PatientProfile(Integer age, SexAtBirth sexAtBirth, PregnancyStatus pregnancyStatus, Set<Symptom> symptoms) {
        this(age, sexAtBirth, pregnancyStatus, symptoms, null);
    }

    @JsonIgnore
    public boolean isPregnant() {
        return pregnancyStatus == PregnancyStatus.PREGNANT;
    }

    /**
     * Lists every invariant this profile breaks. An empty list means the
     * profile is valid.
     */
    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (age == null) {
            violations.add("age is required");
        } else if (age < MIN_AGE || age > MAX_AGE) {
            violations.add("age must be between " + MIN_AGE + " and " + MAX_AGE + ", got " + age);
        }
        if (sexAtBirth == null) {
            violations.add("sex_at_birth is required");
        }
        if (symptoms.isEmpty()) {
            violations.add("symptoms must contain at least one entry");
        }
        if (sexAtBirth != SexAtBirth.FEMALE && pregnancyStatus != PregnancyStatus.UNKNOWN) {
            violations.add("pregnancy_status can only be specified for female sex at birth");
        }
        if (symptomsOtherText != null && symptomsOtherText.length() > MAX_OTHER_TEXT_LENGTH) {
            violations.add("symptoms_other_text must be at most " + MAX_OTHER_TEXT_LENGTH + " characters");
        }
        return violations;
    }

    /**
     * Display-oriented digest handed to the explanation generator.
     */
    public PatientSummary summarize() {
        String ageGroup = age == null ? null : age < 18 ? "pediatric" : age < 65 ? "adult" : "senior";

        String sexDisplay = sexAtBirth == null || sexAtBirth == SexAtBirth.PREFER_NOT_TO_SAY
                ? "not specified"
                : sexAtBirth.code();

        String pregnancyDisplay = switch (pregnancyStatus) {
            case PREGNANT -> "currently pregnant";
            case NOT_PREGNANT -> "not pregnant";
            case UNKNOWN -> null;
        };

        List<String> symptomsDisplay = new ArrayList<>();
        for (Symptom symptom : symptoms) {
            if (symptom == Symptom.OTHER && symptomsOtherText != null && !symptomsOtherText.isBlank()) {
                symptomsDisplay.add(symptomsOtherText.trim());
            } else {
                symptomsDisplay.add(symptom.displayName());
            }
        }

        return new PatientSummary(ageGroup, sexDisplay, pregnancyDisplay, symptomsDisplay);
    }
}
