/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labsignal.reasoning.api.CompilationListener;
import com.labsignal.reasoning.api.ICatalogCompiler;
import com.labsignal.reasoning.api.exceptions.CompilationException;
import com.labsignal.reasoning.api.model.Action;
import com.labsignal.reasoning.api.model.CatalogDefinition;
import com.labsignal.reasoning.api.model.CatalogStats;
import com.labsignal.reasoning.api.model.Condition;
import com.labsignal.reasoning.api.model.DemographicConstraint;
import com.labsignal.reasoning.api.model.EvidenceLevel;
import com.labsignal.reasoning.api.model.Finding;
import com.labsignal.reasoning.api.model.LabTest;
import com.labsignal.reasoning.api.model.LogicType;
import com.labsignal.reasoning.api.model.PatientProfile;
import com.labsignal.reasoning.api.model.Priority;
import com.labsignal.reasoning.api.model.Rule;
import com.labsignal.reasoning.api.model.Severity;
import com.labsignal.reasoning.api.model.SexAtBirth;
import com.labsignal.reasoning.api.model.Threshold;
import com.labsignal.reasoning.api.model.ThresholdCondition;
import com.labsignal.reasoning.api.model.ThresholdOperator;
import com.labsignal.reasoning.api.model.UrgencyLevel;
import com.labsignal.reasoning.compiler.analysis.ThresholdConflictAnalyzer;
import com.labsignal.reasoning.runtime.model.ClinicalCatalog;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles a catalog JSON document into an immutable {@link ClinicalCatalog}.
 *
 * <p>The compilation process runs four stages, each reported to the optional
 * {@link CompilationListener}:
 * <ol>
 *   <li>PARSING: deserialize the document into a {@link CatalogDefinition}.</li>
 *   <li>VALIDATION: check ids, enum codes, operators, bounds and constraint ranges.</li>
 *   <li>LINKING: resolve every reference (threshold to test, rule to finding and
 *       constraint, finding to condition, condition to action).</li>
 *   <li>MODEL_BUILDING: assemble the snapshot, detect contradictory rules and
 *       collect statistics.</li>
 * </ol>
 *
 * <p>Any problem in the first three stages is fatal and raised as a
 * {@link CompilationException} naming the offending entity. Contradictory rules
 * are only warned about: they are kept and simply never match.
 */
public class CatalogCompiler implements ICatalogCompiler {
    private static final Logger logger = Logger.getLogger(CatalogCompiler.class.getName());

    static final String STAGE_PARSING = "PARSING";
    static final String STAGE_VALIDATION = "VALIDATION";
    static final String STAGE_LINKING = "LINKING";
    static final String STAGE_MODEL_BUILDING = "MODEL_BUILDING";
    private static final int TOTAL_STAGES = 4;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ThresholdConflictAnalyzer conflictAnalyzer = new ThresholdConflictAnalyzer();
    private Tracer tracer;
    private CompilationListener listener;

    /**
     * No-arg constructor required by {@link java.util.ServiceLoader}; traces to a no-op tracer.
     */
    public CatalogCompiler() {
        this(OpenTelemetry.noop().getTracer("labsignal-compiler"));
    }

    public CatalogCompiler(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    @Override
    public ClinicalCatalog compile(Path catalogPath) throws IOException {
        try (InputStream in = Files.newInputStream(catalogPath)) {
            return compile(in, catalogPath.toString());
        }
    }

    @Override
    public ClinicalCatalog compile(InputStream json, String origin) throws IOException {
        Span span = tracer.spanBuilder("compile-catalog").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("catalogOrigin", origin);
            long startTime = System.nanoTime();

            CatalogDefinition definition = runStage(STAGE_PARSING, 1, () -> parse(json, origin),
                    def -> Map.of("ruleCount", sizeOf(def.rules()), "testCount", sizeOf(def.tests())));

            Validated validated = runStage(STAGE_VALIDATION, 2, () -> validate(definition),
                    v -> Map.of("testCount", v.tests.size(), "ruleCount", v.rules.size()));

            Linked linked = runStage(STAGE_LINKING, 3, () -> link(validated),
                    l -> Map.of("ruleCount", l.rules.size(),
                            "indicatesEdges", l.indicates.values().stream().mapToInt(List::size).sum(),
                            "urgentActionEdges", l.urgentActions.values().stream().mapToInt(List::size).sum()));

            ClinicalCatalog catalog = runStage(STAGE_MODEL_BUILDING, 4,
                    () -> buildCatalog(validated, linked, definition.version(), origin, startTime),
                    c -> Map.of("ruleCount", c.getNumRules(),
                            "unsatisfiableRules", c.getStats().unsatisfiableRules().size()));

            CatalogStats stats = catalog.getStats();
            span.setAttribute("ruleCount", stats.ruleCount());
            span.setAttribute("testCount", stats.testCount());
            span.setAttribute("compilationTimeMs", stats.compilationTimeMillis());

            logger.info(String.format("Compiled catalog %s: %d tests, %d rules, %d findings, %d conditions, %d actions in %d ms",
                    origin, stats.testCount(), stats.ruleCount(), stats.findingCount(),
                    stats.conditionCount(), stats.actionCount(), stats.compilationTimeMillis()));
            return catalog;
        } catch (IOException | CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    // --- Stage 1: parsing ---

    private CatalogDefinition parse(InputStream json, String origin) throws IOException {
        CatalogDefinition definition;
        try {
            definition = objectMapper.readValue(json, CatalogDefinition.class);
        } catch (JsonProcessingException e) {
            throw new CompilationException("Malformed catalog JSON in " + origin + ": " + e.getOriginalMessage(), e);
        }
        if (definition == null) {
            throw new CompilationException("Catalog document " + origin + " is empty");
        }
        return definition;
    }

    // --- Stage 2: validation ---

    private Validated validate(CatalogDefinition def) {
        if (def.tests() == null || def.tests().isEmpty()) {
            throw new CompilationException("Catalog must define at least one test");
        }
        if (def.rules() == null || def.rules().isEmpty()) {
            throw new CompilationException("Catalog must define at least one rule");
        }

        Validated v = new Validated();

        Set<String> canonicalNames = new HashSet<>();
        for (int i = 0; i < def.tests().size(); i++) {
            CatalogDefinition.TestDef t = def.tests().get(i);
            String id = requireId(t.id(), "Test", i);
            if (t.name() == null || t.name().isBlank()) {
                throw new CompilationException("Test '" + id + "' has missing or empty name");
            }
            if (!canonicalNames.add(t.name())) {
                throw new CompilationException("Duplicate test name: " + t.name());
            }
            putUnique(v.tests, id, new LabTest(id, t.name(), t.unit(),
                    t.aliases() == null ? Set.of() : new HashSet<>(t.aliases()),
                    t.loinc(), t.panel(), t.label(), t.description()), "test");
        }

        for (int i = 0; i < sizeOf(def.findings()); i++) {
            CatalogDefinition.FindingDef f = def.findings().get(i);
            String id = requireId(f.id(), "Finding", i);
            Severity severity = requireEnum(Severity.fromCode(f.severity()), f.severity(), "severity", "Finding", id);
            putUnique(v.findings, id, new Finding(id, f.label(), severity, f.description(), f.patientFriendly()), "finding");
            v.findingDefs.put(id, f);
        }

        for (int i = 0; i < sizeOf(def.conditions()); i++) {
            CatalogDefinition.ConditionDef c = def.conditions().get(i);
            String id = requireId(c.id(), "Condition", i);
            UrgencyLevel urgency = requireEnum(UrgencyLevel.fromCode(c.urgencyLevel()), c.urgencyLevel(),
                    "urgency_level", "Condition", id);
            putUnique(v.conditions, id, new Condition(id, c.name(), c.description(), urgency), "condition");
            v.conditionDefs.put(id, c);
        }

        for (int i = 0; i < sizeOf(def.actions()); i++) {
            CatalogDefinition.ActionDef a = def.actions().get(i);
            String id = requireId(a.id(), "Action", i);
            Priority priority = requireEnum(Priority.fromCode(a.priority()), a.priority(), "priority", "Action", id);
            putUnique(v.actions, id, new Action(id, a.label(), a.description(), priority), "action");
        }

        for (int i = 0; i < sizeOf(def.demographicConstraints()); i++) {
            CatalogDefinition.ConstraintDef c = def.demographicConstraints().get(i);
            putUnique(v.constraints, requireId(c.id(), "Demographic constraint", i), validateConstraint(c), "demographic constraint");
        }

        Map<String, ValidatedThreshold> thresholdsById = new HashMap<>();
        for (int i = 0; i < def.rules().size(); i++) {
            CatalogDefinition.RuleDef r = def.rules().get(i);
            String id = requireId(r.id(), "Rule", i);
            if (v.rules.containsKey(id)) {
                throw new CompilationException("Duplicate rule id: " + id);
            }
            if (r.thresholds() == null || r.thresholds().isEmpty()) {
                throw new CompilationException("Rule '" + id + "' has no thresholds");
            }
            if (r.finding() == null || r.finding().isBlank()) {
                throw new CompilationException("Rule '" + id + "' has no finding");
            }
            LogicType logicType = r.logicType() == null
                    ? LogicType.THRESHOLD
                    : requireEnum(LogicType.fromCode(r.logicType()), r.logicType(), "logic_type", "Rule", id);
            EvidenceLevel evidenceLevel = r.evidenceLevel() == null
                    ? null
                    : requireEnum(EvidenceLevel.fromCode(r.evidenceLevel()), r.evidenceLevel(), "evidence_level", "Rule", id);

            List<ValidatedThreshold> thresholds = new ArrayList<>();
            Set<String> ruleThresholdIds = new HashSet<>();
            for (int j = 0; j < r.thresholds().size(); j++) {
                CatalogDefinition.ThresholdDef t = r.thresholds().get(j);
                if (t.id() == null || t.id().isBlank()) {
                    throw new CompilationException("Rule '" + id + "' threshold " + j + " has missing or empty id");
                }
                if (!ruleThresholdIds.add(t.id())) {
                    throw new CompilationException("Duplicate threshold id in rule '" + id + "': " + t.id());
                }
                if (t.testId() == null || t.testId().isBlank()) {
                    throw new CompilationException("Threshold '" + t.id() + "' of rule '" + id + "' has no test_id");
                }
                ValidatedThreshold threshold = new ValidatedThreshold(t.id(), t.testId(), t.unit(), toCondition(id, t));
                // rules may share a threshold by id, but only with an identical definition
                ValidatedThreshold previous = thresholdsById.putIfAbsent(t.id(), threshold);
                if (previous != null && !previous.equals(threshold)) {
                    throw new CompilationException("Threshold id '" + t.id() + "' is redefined differently in rule '" + id + "'");
                }
                thresholds.add(threshold);
            }
            v.rules.put(id, new ValidatedRule(id, r.name(), logicType, r.rationale(), evidenceLevel,
                    thresholds, r.constraint(), r.finding()));
        }
        return v;
    }

    private ThresholdCondition toCondition(String ruleId, CatalogDefinition.ThresholdDef t) {
        String where = "Threshold '" + t.id() + "' of rule '" + ruleId + "'";
        if (t.operator() == null) {
            throw new CompilationException(where + " has null operator");
        }
        ThresholdOperator operator = ThresholdOperator.fromString(t.operator());
        if (operator == null) {
            throw new CompilationException(where + " has unknown operator: " + t.operator());
        }
        switch (operator) {
            case ABNORMAL_FLAG:
                return new ThresholdCondition.AbnormalFlagPresent();
            case BETWEEN:
                if (t.valueMin() == null || t.valueMax() == null) {
                    throw new CompilationException(where + " operator between requires value_min and value_max");
                }
                requireFinite(where, t.valueMin());
                requireFinite(where, t.valueMax());
                if (t.valueMin() > t.valueMax()) {
                    throw new CompilationException(where + " has inverted between range: ["
                            + t.valueMin() + ", " + t.valueMax() + "]");
                }
                return new ThresholdCondition.Between(t.valueMin(), t.valueMax());
            default:
                if (t.value() == null) {
                    throw new CompilationException(where + " operator " + operator.code() + " requires a value");
                }
                requireFinite(where, t.value());
                return new ThresholdCondition.Comparison(operator, t.value());
        }
    }

    private DemographicConstraint validateConstraint(CatalogDefinition.ConstraintDef c) {
        String where = "Demographic constraint '" + c.id() + "'";
        SexAtBirth sex = c.sex() == null
                ? null
                : requireEnum(SexAtBirth.fromCode(c.sex()), c.sex(), "sex", "Demographic constraint", c.id());
        checkAge(where, "age_min", c.ageMin());
        checkAge(where, "age_max", c.ageMax());
        if (c.ageMin() != null && c.ageMax() != null && c.ageMin() > c.ageMax()) {
            throw new CompilationException(where + " has age_min " + c.ageMin() + " greater than age_max " + c.ageMax());
        }
        DemographicConstraint constraint = new DemographicConstraint(c.id(), sex, c.ageMin(), c.ageMax(), c.pregnancy());
        if (constraint.isUnrestricted()) {
            logger.warning(where + " places no restriction");
        }
        return constraint;
    }

    private static void checkAge(String where, String field, Integer age) {
        if (age != null && (age < PatientProfile.MIN_AGE || age > PatientProfile.MAX_AGE)) {
            throw new CompilationException(where + " has " + field + " " + age + " outside "
                    + PatientProfile.MIN_AGE + "-" + PatientProfile.MAX_AGE);
        }
    }

    private static void requireFinite(String where, double value) {
        if (!Double.isFinite(value)) {
            throw new CompilationException(where + " has non-finite bound: " + value);
        }
    }

    // --- Stage 3: linking ---

    private Linked link(Validated v) {
        Linked linked = new Linked();

        for (ValidatedRule r : v.rules.values()) {
            if (!v.findings.containsKey(r.findingId)) {
                throw new CompilationException("Rule '" + r.id + "' references unknown finding: " + r.findingId);
            }
            DemographicConstraint constraint = null;
            if (r.constraintId != null && !r.constraintId.isBlank()) {
                constraint = v.constraints.get(r.constraintId);
                if (constraint == null) {
                    throw new CompilationException("Rule '" + r.id + "' references unknown demographic constraint: " + r.constraintId);
                }
            }
            List<Threshold> thresholds = new ArrayList<>();
            for (ValidatedThreshold t : r.thresholds) {
                LabTest test = v.tests.get(t.testId);
                if (test == null) {
                    throw new CompilationException("Threshold '" + t.id + "' of rule '" + r.id + "' references unknown test: " + t.testId);
                }
                String unit = t.unit != null ? t.unit : test.unit();
                thresholds.add(new Threshold(t.id, test.id(), test.canonicalName(), unit, t.condition));
            }
            linked.rules.add(new Rule(r.id, r.name, r.logicType, r.rationale, r.evidenceLevel,
                    thresholds, constraint, r.findingId));
        }

        for (Map.Entry<String, CatalogDefinition.FindingDef> e : v.findingDefs.entrySet()) {
            List<String> targets = e.getValue().indicates() == null ? List.of() : e.getValue().indicates();
            for (String conditionId : targets) {
                if (!v.conditions.containsKey(conditionId)) {
                    throw new CompilationException("Finding '" + e.getKey() + "' indicates unknown condition: " + conditionId);
                }
            }
            linked.indicates.put(e.getKey(), targets);
        }

        for (Map.Entry<String, CatalogDefinition.ConditionDef> e : v.conditionDefs.entrySet()) {
            List<String> targets = e.getValue().urgentActions() == null ? List.of() : e.getValue().urgentActions();
            for (String actionId : targets) {
                if (!v.actions.containsKey(actionId)) {
                    throw new CompilationException("Condition '" + e.getKey() + "' references unknown urgent action: " + actionId);
                }
            }
            linked.urgentActions.put(e.getKey(), targets);
        }
        return linked;
    }

    // --- Stage 4: model building ---

    private ClinicalCatalog buildCatalog(Validated v, Linked linked, String version, String origin, long startTime) {
        Span span = tracer.spanBuilder("build-catalog-model").startSpan();
        try (Scope scope = span.makeCurrent()) {
            ClinicalCatalog.Builder builder = ClinicalCatalog.builder();
            v.tests.values().forEach(builder::addTest);
            v.findings.values().forEach(builder::addFinding);
            v.conditions.values().forEach(builder::addCondition);
            v.actions.values().forEach(builder::addAction);
            linked.rules.forEach(builder::addRule);
            linked.indicates.forEach((findingId, conditionIds) ->
                    conditionIds.forEach(conditionId -> builder.linkIndicates(findingId, conditionId)));
            linked.urgentActions.forEach((conditionId, actionIds) ->
                    actionIds.forEach(actionId -> builder.linkUrgentAction(conditionId, actionId)));

            List<String> unsatisfiable = new ArrayList<>();
            for (ThresholdConflictAnalyzer.Contradiction contradiction : conflictAnalyzer.analyze(linked.rules)) {
                logger.warning(contradiction.describe());
                unsatisfiable.add(contradiction.ruleId());
            }
            reportUnreachable(v, linked);

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("origin", origin);
            if (version != null) {
                metadata.put("version", version);
            }
            metadata.put("constraintCount", v.constraints.size());

            CatalogStats stats = new CatalogStats(
                    builder.getTestCount(),
                    builder.getRuleCount(),
                    builder.getThresholdCount(),
                    builder.getFindingCount(),
                    builder.getConditionCount(),
                    builder.getActionCount(),
                    builder.getIndicatesEdgeCount(),
                    builder.getUrgentActionEdgeCount(),
                    System.nanoTime() - startTime,
                    unsatisfiable,
                    metadata);
            span.setAttribute("unsatisfiableRuleCount", unsatisfiable.size());
            return builder.withStats(stats).build();
        } finally {
            span.end();
        }
    }

    private void reportUnreachable(Validated v, Linked linked) {
        Set<String> producedFindings = new HashSet<>();
        linked.rules.forEach(r -> producedFindings.add(r.findingId()));
        for (String findingId : v.findings.keySet()) {
            if (!producedFindings.contains(findingId)) {
                logger.fine("Finding '" + findingId + "' is not produced by any rule");
            }
        }
        Set<String> indicated = new HashSet<>();
        linked.indicates.values().forEach(indicated::addAll);
        for (String conditionId : v.conditions.keySet()) {
            if (!indicated.contains(conditionId)) {
                logger.fine("Condition '" + conditionId + "' is not indicated by any finding");
            }
        }
    }

    // --- stage plumbing ---

    @FunctionalInterface
    private interface StageBody<T> {
        T run() throws IOException;
    }

    private <T> T runStage(String stageName, int stageNumber, StageBody<T> body,
                           Function<T, Map<String, Object>> metrics) throws IOException {
        if (listener != null) {
            listener.onStageStart(stageName, stageNumber, TOTAL_STAGES);
        }
        long start = System.nanoTime();
        try {
            T result = body.run();
            long duration = System.nanoTime() - start;
            logger.log(Level.FINE, "Stage {0} completed in {1} ms",
                    new Object[]{stageName, TimeUnit.NANOSECONDS.toMillis(duration)});
            if (listener != null) {
                listener.onStageComplete(stageName,
                        new CompilationListener.StageResult(stageName, duration, metrics.apply(result)));
            }
            return result;
        } catch (IOException | RuntimeException e) {
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        }
    }

    // --- helpers ---

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }

    private static String requireId(String id, String kind, int index) {
        if (id == null || id.isBlank()) {
            throw new CompilationException(kind + " at index " + index + " has missing or empty id");
        }
        return id;
    }

    private static <E> E requireEnum(E value, String code, String field, String kind, String id) {
        if (value == null) {
            throw new CompilationException(kind + " '" + id + "' has unknown " + field + ": " + code);
        }
        return value;
    }

    private static <T> void putUnique(Map<String, T> target, String id, T value, String kind) {
        if (target.putIfAbsent(id, value) != null) {
            throw new CompilationException("Duplicate " + kind + " id: " + id);
        }
    }

    private record ValidatedThreshold(String id, String testId, String unit, ThresholdCondition condition) {
    }

    private record ValidatedRule(String id, String name, LogicType logicType, String rationale,
                                 EvidenceLevel evidenceLevel, List<ValidatedThreshold> thresholds,
                                 String constraintId, String findingId) {
    }

    private static final class Validated {
        final Map<String, LabTest> tests = new LinkedHashMap<>();
        final Map<String, Finding> findings = new LinkedHashMap<>();
        final Map<String, CatalogDefinition.FindingDef> findingDefs = new LinkedHashMap<>();
        final Map<String, Condition> conditions = new LinkedHashMap<>();
        final Map<String, CatalogDefinition.ConditionDef> conditionDefs = new LinkedHashMap<>();
        final Map<String, Action> actions = new LinkedHashMap<>();
        final Map<String, DemographicConstraint> constraints = new LinkedHashMap<>();
        final Map<String, ValidatedRule> rules = new LinkedHashMap<>();
    }

    private static final class Linked {
        final List<Rule> rules = new ArrayList<>();
        final Map<String, List<String>> indicates = new LinkedHashMap<>();
        final Map<String, List<String>> urgentActions = new LinkedHashMap<>();
    }
}
