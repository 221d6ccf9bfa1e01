package com.labsignal.reasoning.runtime.demographics;

import com.labsignal.reasoning.api.model.DemographicConstraint;
import com.labsignal.reasoning.api.model.PatientProfile;
import com.labsignal.reasoning.api.model.PregnancyStatus;
import com.labsignal.reasoning.api.model.SexAtBirth;
import com.labsignal.reasoning.api.model.Symptom;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DemographicFilterTest {

    private static final DemographicConstraint PREGNANT = new DemographicConstraint("DC001", SexAtBirth.FEMALE, null, null, true);
    private static final DemographicConstraint PEDIATRIC = new DemographicConstraint("DC002", null, 0, 18, null);
    private static final DemographicConstraint SENIOR = new DemographicConstraint("DC003", null, 65, null, null);
    private static final DemographicConstraint CHILDBEARING = new DemographicConstraint("DC004", SexAtBirth.FEMALE, 18, 50, null);

    private static PatientProfile profile(int age, SexAtBirth sex, PregnancyStatus pregnancy) {
        return new PatientProfile(age, sex, pregnancy, Set.of(Symptom.NONE));
    }

    @Test
    @DisplayName("A rule without constraint applies with or without a profile")
    void unconstrainedAlwaysApplies() {
        assertThat(DemographicFilter.applies(null, null)).isTrue();
        assertThat(DemographicFilter.applies(null, profile(40, SexAtBirth.MALE, PregnancyStatus.UNKNOWN))).isTrue();
    }

    @Test
    @DisplayName("A constrained rule never applies without a profile")
    void constrainedRequiresProfile() {
        assertThat(DemographicFilter.applies(SENIOR, null)).isFalse();
        assertThat(DemographicFilter.reasonRejected(SENIOR, null)).contains("no patient profile");
    }

    @Test
    @DisplayName("Pregnancy constraint needs a pregnant female")
    void pregnancyConstraint() {
        assertThat(DemographicFilter.applies(PREGNANT, profile(28, SexAtBirth.FEMALE, PregnancyStatus.PREGNANT))).isTrue();
        assertThat(DemographicFilter.applies(PREGNANT, profile(28, SexAtBirth.FEMALE, PregnancyStatus.NOT_PREGNANT))).isFalse();
        assertThat(DemographicFilter.applies(PREGNANT, profile(28, SexAtBirth.FEMALE, PregnancyStatus.UNKNOWN))).isFalse();
        assertThat(DemographicFilter.applies(PREGNANT, profile(28, SexAtBirth.MALE, PregnancyStatus.UNKNOWN))).isFalse();
    }

    @Test
    @DisplayName("Age bounds are inclusive")
    void ageBoundsInclusive() {
        assertThat(DemographicFilter.applies(PEDIATRIC, profile(0, SexAtBirth.MALE, PregnancyStatus.UNKNOWN))).isTrue();
        assertThat(DemographicFilter.applies(PEDIATRIC, profile(18, SexAtBirth.MALE, PregnancyStatus.UNKNOWN))).isTrue();
        assertThat(DemographicFilter.applies(PEDIATRIC, profile(19, SexAtBirth.MALE, PregnancyStatus.UNKNOWN))).isFalse();
        assertThat(DemographicFilter.applies(SENIOR, profile(65, SexAtBirth.FEMALE, PregnancyStatus.UNKNOWN))).isTrue();
        assertThat(DemographicFilter.applies(SENIOR, profile(64, SexAtBirth.FEMALE, PregnancyStatus.UNKNOWN))).isFalse();
        assertThat(DemographicFilter.reasonRejected(SENIOR, profile(64, SexAtBirth.FEMALE, PregnancyStatus.UNKNOWN)))
                .isEqualTo("requires age >= 65");
    }

    @Test
    @DisplayName("An age-bounded rule does not apply when the age is unknown")
    void unknownAgeFailsAgeBounds() {
        PatientProfile noAge = new PatientProfile(null, SexAtBirth.FEMALE, PregnancyStatus.PREGNANT, Set.of(Symptom.NONE));

        assertThat(DemographicFilter.applies(SENIOR, noAge)).isFalse();
        assertThat(DemographicFilter.reasonRejected(CHILDBEARING, noAge)).isEqualTo("requires a known age");
        assertThat(DemographicFilter.applies(PREGNANT, noAge)).isTrue();
    }

    @Test
    @DisplayName("All constraint fields must hold together")
    void fieldsAreConjunctive() {
        assertThat(DemographicFilter.applies(CHILDBEARING, profile(30, SexAtBirth.FEMALE, PregnancyStatus.UNKNOWN))).isTrue();
        assertThat(DemographicFilter.applies(CHILDBEARING, profile(55, SexAtBirth.FEMALE, PregnancyStatus.UNKNOWN))).isFalse();
        assertThat(DemographicFilter.applies(CHILDBEARING, profile(30, SexAtBirth.MALE, PregnancyStatus.UNKNOWN))).isFalse();
    }

    @Test
    @DisplayName("prefer_not_say and intersex never satisfy a sex constraint")
    void undisclosedSexNeverMatches() {
        assertThat(DemographicFilter.applies(CHILDBEARING, profile(30, SexAtBirth.PREFER_NOT_TO_SAY, PregnancyStatus.UNKNOWN))).isFalse();
        assertThat(DemographicFilter.applies(CHILDBEARING, profile(30, SexAtBirth.INTERSEX, PregnancyStatus.UNKNOWN))).isFalse();
        assertThat(DemographicFilter.reasonRejected(CHILDBEARING, profile(30, SexAtBirth.PREFER_NOT_TO_SAY, PregnancyStatus.UNKNOWN)))
                .isEqualTo("requires sex female");
    }
}
