package com.labsignal.reasoning.compiler.analysis;

import com.labsignal.reasoning.api.model.LogicType;
import com.labsignal.reasoning.api.model.Rule;
import com.labsignal.reasoning.api.model.Threshold;
import com.labsignal.reasoning.api.model.ThresholdCondition;
import com.labsignal.reasoning.api.model.ThresholdOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ThresholdConflictAnalyzerTest {

    private final ThresholdConflictAnalyzer analyzer = new ThresholdConflictAnalyzer();

    private static Threshold threshold(String id, String test, ThresholdCondition condition) {
        return new Threshold(id, test.toUpperCase(), test, "u", condition);
    }

    private static Threshold cmp(String id, String test, ThresholdOperator op, double bound) {
        return threshold(id, test, new ThresholdCondition.Comparison(op, bound));
    }

    private static Rule rule(String id, Threshold... thresholds) {
        return new Rule(id, id, LogicType.COMBINATION, null, null, List.of(thresholds), null, "F1");
    }

    @Test
    @DisplayName("Should flag disjoint comparisons on the same test")
    void shouldFlagDisjointComparisons() {
        Rule rule = rule("R1",
                cmp("T1", "Hemoglobin", ThresholdOperator.GREATER_THAN, 17.5),
                cmp("T2", "Hemoglobin", ThresholdOperator.LESS_THAN, 12.0));

        List<ThresholdConflictAnalyzer.Contradiction> found = analyzer.analyze(List.of(rule));

        assertThat(found).hasSize(1);
        assertThat(found.get(0).ruleId()).isEqualTo("R1");
        assertThat(found.get(0).testName()).isEqualTo("Hemoglobin");
    }

    @Test
    @DisplayName("Should treat touching bounds as satisfiable only when both are inclusive")
    void shouldHandleTouchingBounds() {
        Rule inclusive = rule("R1",
                cmp("T1", "Hemoglobin", ThresholdOperator.GREATER_OR_EQUAL, 12.0),
                cmp("T2", "Hemoglobin", ThresholdOperator.LESS_OR_EQUAL, 12.0));
        Rule halfOpen = rule("R2",
                cmp("T1", "Hemoglobin", ThresholdOperator.GREATER_OR_EQUAL, 12.0),
                cmp("T2", "Hemoglobin", ThresholdOperator.LESS_THAN, 12.0));

        assertThat(analyzer.analyze(List.of(inclusive, halfOpen)))
                .extracting(ThresholdConflictAnalyzer.Contradiction::ruleId)
                .containsExactly("R2");
    }

    @Test
    @DisplayName("Should intersect between ranges with comparisons")
    void shouldIntersectBetween() {
        Rule disjoint = rule("R1",
                threshold("T1", "White Blood Cell Count", new ThresholdCondition.Between(4.0, 11.0)),
                cmp("T2", "White Blood Cell Count", ThresholdOperator.GREATER_THAN, 11.0));
        Rule overlapping = rule("R2",
                threshold("T1", "White Blood Cell Count", new ThresholdCondition.Between(4.0, 11.0)),
                cmp("T2", "White Blood Cell Count", ThresholdOperator.GREATER_THAN, 10.0));

        assertThat(analyzer.analyze(List.of(disjoint, overlapping)))
                .extracting(ThresholdConflictAnalyzer.Contradiction::ruleId)
                .containsExactly("R1");
    }

    @Test
    @DisplayName("Should ignore thresholds on different tests and abnormal flag checks")
    void shouldIgnoreUnrelatedThresholds() {
        Rule rule = rule("R1",
                cmp("T1", "Hemoglobin", ThresholdOperator.GREATER_THAN, 17.5),
                cmp("T2", "Hematocrit", ThresholdOperator.LESS_THAN, 12.0),
                threshold("T3", "Hemoglobin", new ThresholdCondition.AbnormalFlagPresent()));

        assertThat(analyzer.analyze(List.of(rule))).isEmpty();
    }
}
