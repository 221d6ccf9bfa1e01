package com.labsignal.reasoning.runtime.operators;

import com.labsignal.reasoning.api.model.AbnormalFlag;
import com.labsignal.reasoning.api.model.Reading;
import com.labsignal.reasoning.api.model.Threshold;
import com.labsignal.reasoning.api.model.ThresholdCondition;
import com.labsignal.reasoning.api.model.ThresholdOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class ThresholdEvaluatorTest {

    private static Threshold hemoglobin(ThresholdCondition condition) {
        return new Threshold("TH1", "HGB", "Hemoglobin", "g/dL", condition);
    }

    private static Reading reading(double value) {
        return new Reading("Hemoglobin", value, "g/dL");
    }

    @ParameterizedTest(name = "{1} {0} 12.0 -> {2}")
    @CsvSource({
            "GREATER_THAN, 12.1, true",
            "GREATER_THAN, 12.0, false",
            "LESS_THAN, 11.9, true",
            "LESS_THAN, 12.0, false",
            "GREATER_OR_EQUAL, 12.0, true",
            "GREATER_OR_EQUAL, 11.9, false",
            "LESS_OR_EQUAL, 12.0, true",
            "LESS_OR_EQUAL, 12.1, false"
    })
    @DisplayName("Comparison operators are strict or non-strict as named")
    void comparisonBoundaries(ThresholdOperator operator, double value, boolean expected) {
        Threshold threshold = hemoglobin(new ThresholdCondition.Comparison(operator, 12.0));

        assertThat(ThresholdEvaluator.evaluate(threshold, reading(value))).isEqualTo(expected);
    }

    @Test
    @DisplayName("Between is inclusive at both ends")
    void betweenIsInclusive() {
        Threshold threshold = hemoglobin(new ThresholdCondition.Between(4.0, 11.0));

        assertThat(ThresholdEvaluator.evaluate(threshold, reading(4.0))).isTrue();
        assertThat(ThresholdEvaluator.evaluate(threshold, reading(11.0))).isTrue();
        assertThat(ThresholdEvaluator.evaluate(threshold, reading(7.5))).isTrue();
        assertThat(ThresholdEvaluator.evaluate(threshold, reading(3.99))).isFalse();
        assertThat(ThresholdEvaluator.evaluate(threshold, reading(11.01))).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = AbnormalFlag.class, names = {"HIGH", "LOW", "HIGH_HIGH", "LOW_LOW"})
    @DisplayName("Abnormal flag threshold is met by any printed flag")
    void abnormalFlagMet(AbnormalFlag flag) {
        Threshold threshold = hemoglobin(new ThresholdCondition.AbnormalFlagPresent());

        assertThat(ThresholdEvaluator.evaluate(threshold, new Reading("Hemoglobin", 9.0, "g/dL", flag))).isTrue();
    }

    @Test
    @DisplayName("Abnormal flag threshold is not met without a flag")
    void abnormalFlagNotMet() {
        Threshold threshold = hemoglobin(new ThresholdCondition.AbnormalFlagPresent());

        assertThat(ThresholdEvaluator.evaluate(threshold, reading(2.0))).isFalse();
        assertThat(ThresholdEvaluator.evaluate(threshold, new Reading("Hemoglobin", 2.0, "g/dL", null))).isFalse();
    }

    @Test
    @DisplayName("NaN satisfies no numeric operator")
    void nanNeverMatches() {
        Reading nan = reading(Double.NaN);
        for (ThresholdOperator op : new ThresholdOperator[]{
                ThresholdOperator.GREATER_THAN, ThresholdOperator.LESS_THAN,
                ThresholdOperator.GREATER_OR_EQUAL, ThresholdOperator.LESS_OR_EQUAL}) {
            assertThat(ThresholdEvaluator.evaluate(hemoglobin(new ThresholdCondition.Comparison(op, 12.0)), nan))
                    .as(op.code())
                    .isFalse();
        }
        assertThat(ThresholdEvaluator.evaluate(hemoglobin(new ThresholdCondition.Between(0, 20)), nan)).isFalse();
    }

    @Test
    @DisplayName("A reading without a value meets no threshold, flagged or not")
    void missingValueNeverMatches() {
        Reading noValue = new Reading("Hemoglobin", null, "g/dL", AbnormalFlag.LOW_LOW);

        assertThat(noValue.hasValue()).isFalse();
        assertThat(ThresholdEvaluator.evaluate(
                hemoglobin(new ThresholdCondition.Comparison(ThresholdOperator.LESS_THAN, 12.0)), noValue)).isFalse();
        assertThat(ThresholdEvaluator.evaluate(hemoglobin(new ThresholdCondition.Between(0, 20)), noValue)).isFalse();
        assertThat(ThresholdEvaluator.evaluate(hemoglobin(new ThresholdCondition.AbnormalFlagPresent()), noValue)).isFalse();
    }

    @Test
    @DisplayName("Units are not compared")
    void unitsIgnored() {
        Threshold threshold = hemoglobin(new ThresholdCondition.Comparison(ThresholdOperator.LESS_THAN, 12.0));

        assertThat(ThresholdEvaluator.evaluate(threshold, new Reading("Hemoglobin", 95.0, "g/L"))).isFalse();
        assertThat(ThresholdEvaluator.evaluate(threshold, new Reading("Hemoglobin", 9.5, "mmol/L"))).isTrue();
    }

    @Test
    @DisplayName("Renders expectations and evidence lines")
    void describesThresholds() {
        Threshold lessThan = hemoglobin(new ThresholdCondition.Comparison(ThresholdOperator.LESS_THAN, 12.0));
        Threshold between = new Threshold("TH2", "WBC", "White Blood Cell Count", "10^3/mcL",
                new ThresholdCondition.Between(4.0, 11.0));
        Threshold flag = hemoglobin(new ThresholdCondition.AbnormalFlagPresent());

        assertThat(ThresholdEvaluator.describe(lessThan)).isEqualTo("< 12.0 g/dL");
        assertThat(ThresholdEvaluator.describe(between)).isEqualTo("between 4.0 and 11.0 10^3/mcL");
        assertThat(ThresholdEvaluator.describe(flag)).isEqualTo("abnormal flag present");

        assertThat(ThresholdEvaluator.evidence(lessThan, reading(9.5)))
                .isEqualTo("Hemoglobin 9.5 g/dL < 12.0 g/dL");
        assertThat(ThresholdEvaluator.evidence(flag, new Reading("Hemoglobin", 6.0, "g/dL", AbnormalFlag.LOW_LOW)))
                .isEqualTo("Hemoglobin 6.0 g/dL flagged LL");
    }
}
