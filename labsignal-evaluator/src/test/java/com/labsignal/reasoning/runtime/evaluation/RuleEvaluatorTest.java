package com.labsignal.reasoning.runtime.evaluation;

import com.labsignal.reasoning.api.exceptions.RuleNotFoundException;
import com.labsignal.reasoning.api.model.AbnormalFlag;
import com.labsignal.reasoning.api.model.PatientProfile;
import com.labsignal.reasoning.api.model.PregnancyStatus;
import com.labsignal.reasoning.api.model.Reading;
import com.labsignal.reasoning.api.model.RuleExplanation;
import com.labsignal.reasoning.api.model.RuleMatch;
import com.labsignal.reasoning.api.model.SexAtBirth;
import com.labsignal.reasoning.api.model.Symptom;
import com.labsignal.reasoning.runtime.TestCatalogs;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleEvaluatorTest {

    private static final PatientProfile PREGNANT_28 = new PatientProfile(28, SexAtBirth.FEMALE,
            PregnancyStatus.PREGNANT, Set.of(Symptom.FATIGUE));

    private RuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new RuleEvaluator(TestCatalogs.small(), OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    @DisplayName("Should match a rule only when every threshold is met")
    void conjunction() {
        List<RuleMatch> both = evaluator.evaluateRules(List.of(
                new Reading("Hemoglobin", 9.5, "g/dL"),
                new Reading("Hematocrit", 28.0, "%")), null);
        List<RuleMatch> oneMet = evaluator.evaluateRules(List.of(
                new Reading("Hemoglobin", 9.5, "g/dL"),
                new Reading("Hematocrit", 40.0, "%")), null);

        assertThat(both).extracting(RuleMatch::ruleId).containsExactly("R1");
        assertThat(oneMet).isEmpty();
    }

    @Test
    @DisplayName("Should produce one evidence line per threshold")
    void evidencePerThreshold() {
        List<RuleMatch> matches = evaluator.evaluateRules(List.of(
                new Reading("Hemoglobin", 9.5, "g/dL"),
                new Reading("Hematocrit", 28.0, "%")), null);

        assertThat(matches.get(0).evidence()).containsExactly(
                "Hemoglobin 9.5 g/dL < 12.0 g/dL",
                "Hematocrit 28.0 % < 36.0 %");
        assertThat(matches.get(0).findingId()).isEqualTo("F1");
    }

    @Test
    @DisplayName("Should never partially match a rule with a missing test")
    void missingTestMeansNoMatch() {
        List<RuleMatch> matches = evaluator.evaluateRules(List.of(new Reading("Hemoglobin", 5.0, "g/dL")), null);

        assertThat(matches).isEmpty();
    }

    @Test
    @DisplayName("Should ignore readings for tests the catalog does not know")
    void unknownTestsIgnored() {
        assertThat(evaluator.evaluateRules(List.of(new Reading("NonExistentTest", 100, "u")), null)).isEmpty();
        assertThat(evaluator.evaluateRules(List.of(), null)).isEmpty();
    }

    @Test
    @DisplayName("Should keep the first reading when a test is reported twice")
    void firstDuplicateWins() {
        List<RuleMatch> firstLow = evaluator.evaluateRules(List.of(
                new Reading("Platelet Count", 30, "10^3/mcL"),
                new Reading("Platelet Count", 300, "10^3/mcL")), null);
        List<RuleMatch> firstNormal = evaluator.evaluateRules(List.of(
                new Reading("Platelet Count", 300, "10^3/mcL"),
                new Reading("Platelet Count", 30, "10^3/mcL")), null);

        assertThat(firstLow).extracting(RuleMatch::ruleId).containsExactly("R3");
        assertThat(firstNormal).isEmpty();
    }

    @Test
    @DisplayName("Should treat a reading without a value as absent rather than as zero")
    void valuelessReadingIsAbsent() {
        Reading noValue = new Reading("Platelet Count", null, "10^3/mcL", AbnormalFlag.LOW_LOW);

        assertThat(evaluator.evaluateRules(List.of(noValue), null)).isEmpty();
        assertThat(evaluator.evaluateRules(List.of(
                noValue, new Reading("Platelet Count", 30, "10^3/mcL")), null))
                .extracting(RuleMatch::ruleId).containsExactly("R3");
    }

    @Test
    @DisplayName("Should explain a reading without a value as missing")
    void explainValuelessReading() {
        RuleExplanation explanation = evaluator.explainRule(List.of(
                new Reading("Platelet Count", null, "10^3/mcL", null)), null, "R3");

        assertThat(explanation.matched()).isFalse();
        assertThat(explanation.thresholds().get(0).observedValue()).isNull();
        assertThat(explanation.thresholds().get(0).reason())
                .isEqualTo(RuleExplanation.ThresholdExplanation.REASON_READING_MISSING);
    }

    @Test
    @DisplayName("Should gate constrained rules on the patient profile")
    void demographicGate() {
        List<Reading> readings = List.of(new Reading("Hemoglobin", 11.0, "g/dL"));

        assertThat(evaluator.evaluateRules(readings, PREGNANT_28)).extracting(RuleMatch::ruleId).containsExactly("R4");
        assertThat(evaluator.evaluateRules(readings, null)).isEmpty();
    }

    @Test
    @DisplayName("Should return matches ordered by rule id regardless of reading order")
    void orderedByRuleId() {
        List<Reading> readings = List.of(
                new Reading("Mean Corpuscular Volume", 70, "fL"),
                new Reading("Platelet Count", 20, "10^3/mcL"),
                new Reading("Hematocrit", 30, "%"),
                new Reading("Hemoglobin", 9, "g/dL"));

        List<RuleMatch> matches = evaluator.evaluateRules(readings, null);

        assertThat(matches).extracting(RuleMatch::ruleId).containsExactly("R1", "R2", "R3", "R5");
        assertThat(evaluator.evaluateRules(List.of(readings.get(3), readings.get(2), readings.get(1), readings.get(0)), null))
                .isEqualTo(matches);
    }

    @Test
    @DisplayName("Should explain a matched rule")
    void explainMatched() {
        RuleExplanation explanation = evaluator.explainRule(List.of(
                new Reading("Hemoglobin", 9.5, "g/dL"),
                new Reading("Hematocrit", 28.0, "%")), null, "R1");

        assertThat(explanation.matched()).isTrue();
        assertThat(explanation.demographicsApplicable()).isTrue();
        assertThat(explanation.metCount()).isEqualTo(2);
        assertThat(explanation.summary()).isEqualTo("Rule R1 matched");
    }

    @Test
    @DisplayName("Should explain missing readings and unmet thresholds")
    void explainNotMatched() {
        RuleExplanation explanation = evaluator.explainRule(List.of(
                new Reading("Hemoglobin", 13.0, "g/dL")), null, "R1");

        assertThat(explanation.matched()).isFalse();
        assertThat(explanation.summary()).isEqualTo("Rule R1 did not match (failed 2/2 thresholds)");
        assertThat(explanation.thresholds().get(0).observedValue()).isEqualTo(13.0);
        assertThat(explanation.thresholds().get(0).reason())
                .isEqualTo(RuleExplanation.ThresholdExplanation.REASON_OUT_OF_RANGE);
        assertThat(explanation.thresholds().get(1).observedValue()).isNull();
        assertThat(explanation.thresholds().get(1).reason())
                .isEqualTo(RuleExplanation.ThresholdExplanation.REASON_READING_MISSING);
    }

    @Test
    @DisplayName("Should explain a demographic rejection")
    void explainDemographicRejection() {
        RuleExplanation explanation = evaluator.explainRule(List.of(
                new Reading("Hemoglobin", 11.0, "g/dL")), null, "R4");

        assertThat(explanation.matched()).isFalse();
        assertThat(explanation.demographicsApplicable()).isFalse();
        assertThat(explanation.thresholds()).allMatch(RuleExplanation.ThresholdExplanation::met);
        assertThat(explanation.summary()).contains("does not apply");
    }

    @Test
    @DisplayName("Should reject explanation of an unknown rule")
    void explainUnknownRule() {
        assertThatThrownBy(() -> evaluator.explainRule(List.of(), null, "R999"))
                .isInstanceOf(RuleNotFoundException.class)
                .hasMessageContaining("Rule not found: R999")
                .satisfies(e -> assertThat(((RuleNotFoundException) e).getRuleId()).isEqualTo("R999"));
    }
}
