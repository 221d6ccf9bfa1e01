/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.runtime.aggregation;

import com.labsignal.reasoning.api.ISignalAggregator;
import com.labsignal.reasoning.api.model.Action;
import com.labsignal.reasoning.api.model.ClinicalSignals;
import com.labsignal.reasoning.api.model.Condition;
import com.labsignal.reasoning.api.model.Finding;
import com.labsignal.reasoning.api.model.MatchedCondition;
import com.labsignal.reasoning.api.model.MatchedFinding;
import com.labsignal.reasoning.api.model.RuleMatch;
import com.labsignal.reasoning.runtime.model.ClinicalCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Folds rule matches into a {@link ClinicalSignals} bundle.
 *
 * <ul>
 *   <li>Findings are deduplicated by id. The first match supplies label and
 *       severity; evidence and contributing rule ids accumulate across every
 *       match that produced the finding.</li>
 *   <li>Conditions are those reachable through an {@code indicates} edge from a
 *       matched finding, deduplicated, each listing the finding ids that led to it.</li>
 *   <li>Actions are those reachable through an {@code urgent_action} edge from a
 *       matched condition, deduplicated, and kept only at high or critical priority.</li>
 * </ul>
 * Output is sorted most severe first (findings by severity, conditions by
 * urgency, actions by priority) with ties broken by id. Findings carry a base
 * confidence of {@value #FINDING_CONFIDENCE}, conditions {@value #CONDITION_CONFIDENCE}.
 */
public final class SignalAggregator implements ISignalAggregator {
    private static final Logger logger = LoggerFactory.getLogger(SignalAggregator.class);

    public static final double FINDING_CONFIDENCE = 0.85;
    public static final double CONDITION_CONFIDENCE = 0.7;

    private static final Comparator<MatchedFinding> FINDING_ORDER =
            Comparator.comparing(MatchedFinding::severity, Comparator.reverseOrder())
                    .thenComparing(MatchedFinding::id);
    private static final Comparator<MatchedCondition> CONDITION_ORDER =
            Comparator.comparing(MatchedCondition::urgencyLevel, Comparator.reverseOrder())
                    .thenComparing(MatchedCondition::id);
    private static final Comparator<Action> ACTION_ORDER =
            Comparator.comparing(Action::priority, Comparator.reverseOrder())
                    .thenComparing(Action::id);

    private final ClinicalCatalog catalog;

    public SignalAggregator(ClinicalCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    @Override
    public ClinicalSignals aggregate(List<RuleMatch> matches) {
        Objects.requireNonNull(matches, "matches must not be null");
        if (matches.isEmpty()) {
            return ClinicalSignals.empty();
        }

        List<MatchedFinding> findings = collectFindings(matches);

        // condition id -> ids of matched findings indicating it
        Map<String, Set<String>> conditionSources = new TreeMap<>();
        for (MatchedFinding finding : findings) {
            for (String conditionId : catalog.getIndicatedConditionIds(finding.id())) {
                conditionSources.computeIfAbsent(conditionId, k -> new TreeSet<>()).add(finding.id());
            }
        }

        List<MatchedCondition> conditions = new ArrayList<>();
        Set<String> actionIds = new TreeSet<>();
        for (Map.Entry<String, Set<String>> entry : conditionSources.entrySet()) {
            Condition condition = catalog.getCondition(entry.getKey());
            if (condition == null) {
                continue;
            }
            List<String> related = List.copyOf(entry.getValue());
            conditions.add(new MatchedCondition(condition.id(), condition.name(), condition.description(),
                    condition.urgencyLevel(), related, "Based on findings: " + String.join(", ", related),
                    CONDITION_CONFIDENCE));
            actionIds.addAll(catalog.getUrgentActionIds(condition.id()));
        }

        List<Action> actions = new ArrayList<>();
        for (String actionId : actionIds) {
            Action action = catalog.getAction(actionId);
            if (action != null && action.priority().isSurfaced()) {
                actions.add(action);
            }
        }

        findings.sort(FINDING_ORDER);
        conditions.sort(CONDITION_ORDER);
        actions.sort(ACTION_ORDER);

        logger.debug("Aggregated {} matches into {} findings, {} conditions, {} actions",
                matches.size(), findings.size(), conditions.size(), actions.size());
        return new ClinicalSignals(findings, conditions, actions);
    }

    private static List<MatchedFinding> collectFindings(List<RuleMatch> matches) {
        Map<String, FindingAccumulator> byId = new LinkedHashMap<>();
        for (RuleMatch match : matches) {
            byId.computeIfAbsent(match.findingId(), k -> new FindingAccumulator(match.finding()))
                    .add(match);
        }
        List<MatchedFinding> findings = new ArrayList<>(byId.size());
        byId.values().forEach(acc -> findings.add(acc.toMatchedFinding()));
        return findings;
    }

    private static final class FindingAccumulator {
        private final Finding finding;
        private final List<String> evidence = new ArrayList<>();
        private final List<String> ruleIds = new ArrayList<>();
        private final Set<String> relatedTests = new LinkedHashSet<>();

        FindingAccumulator(Finding finding) {
            this.finding = finding;
        }

        void add(RuleMatch match) {
            evidence.addAll(match.evidence());
            ruleIds.add(match.ruleId());
            relatedTests.addAll(match.rule().requiredTestNames());
        }

        MatchedFinding toMatchedFinding() {
            return new MatchedFinding(finding.id(), finding.label(), finding.severity(), finding.description(),
                    finding.patientFriendly(), evidence, ruleIds, new ArrayList<>(relatedTests),
                    FINDING_CONFIDENCE);
        }
    }
}
