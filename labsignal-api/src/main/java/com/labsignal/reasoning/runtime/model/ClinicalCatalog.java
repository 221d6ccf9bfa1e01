/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.runtime.model;

import com.labsignal.reasoning.api.model.Action;
import com.labsignal.reasoning.api.model.CatalogStats;
import com.labsignal.reasoning.api.model.Condition;
import com.labsignal.reasoning.api.model.Finding;
import com.labsignal.reasoning.api.model.LabTest;
import com.labsignal.reasoning.api.model.Rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The loaded, immutable snapshot of the Test Catalog and the Rule Catalog.
 *
 * <p>Entities are stored in maps keyed by their stable string ids and the
 * relationship graph is kept as adjacency lists of ids:
 * <ul>
 *   <li>{@code indicates}: finding id to the condition ids it indicates</li>
 *   <li>{@code urgentActions}: condition id to the action ids linked to it</li>
 * </ul>
 * No entity holds a reference to another, so a snapshot can be swapped
 * atomically on reload while in-flight evaluations keep reading the old one.
 *
 * <p>Rules are held in id order and every adjacency list is sorted, so
 * iteration never depends on the order the catalog source listed things in.
 * Instances are built through {@link Builder} and are thread-safe.
 */
public final class ClinicalCatalog {

    private final Map<String, LabTest> testsById;
    private final Map<String, LabTest> testsByName;
    private final List<Rule> rules;
    private final Map<String, Rule> rulesById;
    private final Map<String, Finding> findings;
    private final Map<String, Condition> conditions;
    private final Map<String, Action> actions;
    private final Map<String, List<String>> indicates;
    private final Map<String, List<String>> urgentActions;
    private final CatalogStats stats;

    private ClinicalCatalog(Builder builder) {
        this.testsById = Collections.unmodifiableMap(new TreeMap<>(builder.testsById));

        Map<String, LabTest> byName = new TreeMap<>();
        for (LabTest test : builder.testsById.values()) {
            byName.put(test.canonicalName(), test);
        }
        this.testsByName = Collections.unmodifiableMap(byName);

        List<Rule> sortedRules = new ArrayList<>(builder.rulesById.values());
        sortedRules.sort(Comparator.comparing(Rule::id));
        this.rules = List.copyOf(sortedRules);
        this.rulesById = Collections.unmodifiableMap(new TreeMap<>(builder.rulesById));

        this.findings = Collections.unmodifiableMap(new TreeMap<>(builder.findings));
        this.conditions = Collections.unmodifiableMap(new TreeMap<>(builder.conditions));
        this.actions = Collections.unmodifiableMap(new TreeMap<>(builder.actions));
        this.indicates = freezeEdges(builder.indicates);
        this.urgentActions = freezeEdges(builder.urgentActions);
        this.stats = builder.stats;
    }

    private static Map<String, List<String>> freezeEdges(Map<String, ? extends Set<String>> edges) {
        Map<String, List<String>> frozen = new TreeMap<>();
        edges.forEach((from, targets) -> frozen.put(from, List.copyOf(new TreeSet<>(targets))));
        return Collections.unmodifiableMap(frozen);
    }

    // --- Test Catalog ---

    public Map<String, LabTest> getTests() {
        return testsById;
    }

    public Optional<LabTest> findTest(String testId) {
        return Optional.ofNullable(testsById.get(testId));
    }

    public Optional<LabTest> findTestByName(String canonicalName) {
        return Optional.ofNullable(testsByName.get(canonicalName));
    }

    /**
     * @return true if a reading with this canonical name can be consulted by any rule
     */
    public boolean isKnownTestName(String canonicalName) {
        return canonicalName != null && testsByName.containsKey(canonicalName);
    }

    // --- Rule Catalog ---

    /**
     * @return all rules, ordered by id
     */
    public List<Rule> getRules() {
        return rules;
    }

    public Optional<Rule> findRule(String ruleId) {
        return Optional.ofNullable(rulesById.get(ruleId));
    }

    public Finding getFinding(String findingId) {
        return findings.get(findingId);
    }

    public Map<String, Finding> getFindings() {
        return findings;
    }

    public Condition getCondition(String conditionId) {
        return conditions.get(conditionId);
    }

    public Map<String, Condition> getConditions() {
        return conditions;
    }

    public Action getAction(String actionId) {
        return actions.get(actionId);
    }

    public Map<String, Action> getActions() {
        return actions;
    }

    // --- Relationship graph ---

    /**
     * @return sorted ids of the conditions the finding indicates; empty if none
     */
    public List<String> getIndicatedConditionIds(String findingId) {
        return indicates.getOrDefault(findingId, List.of());
    }

    /**
     * @return sorted ids of the actions linked to the condition; empty if none
     */
    public List<String> getUrgentActionIds(String conditionId) {
        return urgentActions.getOrDefault(conditionId, List.of());
    }

    public CatalogStats getStats() {
        return stats;
    }

    public int getNumRules() {
        return rules.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable builder. Performs no validation beyond rejecting duplicate ids;
     * reference checking is the compiler's job.
     */
    public static final class Builder {
        private final Map<String, LabTest> testsById = new LinkedHashMap<>();
        private final Map<String, Rule> rulesById = new LinkedHashMap<>();
        private final Map<String, Finding> findings = new LinkedHashMap<>();
        private final Map<String, Condition> conditions = new LinkedHashMap<>();
        private final Map<String, Action> actions = new LinkedHashMap<>();
        private final Map<String, Set<String>> indicates = new LinkedHashMap<>();
        private final Map<String, Set<String>> urgentActions = new LinkedHashMap<>();
        private CatalogStats stats;

        private Builder() {
        }

        public Builder addTest(LabTest test) {
            putUnique(testsById, test.id(), test, "test");
            return this;
        }

        public Builder addRule(Rule rule) {
            putUnique(rulesById, rule.id(), rule, "rule");
            return this;
        }

        public Builder addFinding(Finding finding) {
            putUnique(findings, finding.id(), finding, "finding");
            return this;
        }

        public Builder addCondition(Condition condition) {
            putUnique(conditions, condition.id(), condition, "condition");
            return this;
        }

        public Builder addAction(Action action) {
            putUnique(actions, action.id(), action, "action");
            return this;
        }

        public Builder linkIndicates(String findingId, String conditionId) {
            indicates.computeIfAbsent(findingId, k -> new TreeSet<>()).add(conditionId);
            return this;
        }

        public Builder linkUrgentAction(String conditionId, String actionId) {
            urgentActions.computeIfAbsent(conditionId, k -> new TreeSet<>()).add(actionId);
            return this;
        }

        public Builder withStats(CatalogStats stats) {
            this.stats = stats;
            return this;
        }

        public int getTestCount() {
            return testsById.size();
        }

        public int getRuleCount() {
            return rulesById.size();
        }

        public int getThresholdCount() {
            return rulesById.values().stream().mapToInt(r -> r.thresholds().size()).sum();
        }

        public int getIndicatesEdgeCount() {
            return indicates.values().stream().mapToInt(Set::size).sum();
        }

        public int getUrgentActionEdgeCount() {
            return urgentActions.values().stream().mapToInt(Set::size).sum();
        }

        public int getFindingCount() {
            return findings.size();
        }

        public int getConditionCount() {
            return conditions.size();
        }

        public int getActionCount() {
            return actions.size();
        }

        public ClinicalCatalog build() {
            return new ClinicalCatalog(this);
        }

        private static <T> void putUnique(Map<String, T> target, String id, T value, String kind) {
            if (target.putIfAbsent(id, value) != null) {
                throw new IllegalArgumentException("Duplicate " + kind + " id: " + id);
            }
        }
    }
}
