/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api;

import java.util.Map;

/**
 * Callback interface for catalog compilation stage events.
 *
 * <p>Catalog compilation runs in four stages:
 * <ol>
 *   <li>PARSING - read the JSON document</li>
 *   <li>VALIDATION - check ids, enum codes, operators and bounds</li>
 *   <li>LINKING - resolve test, finding, constraint, condition and action references</li>
 *   <li>MODEL_BUILDING - assemble the immutable snapshot and analyze contradictions</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * compiler.setCompilationListener(new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         log.info(stageName + " (" + stageNumber + "/" + totalStages + ")");
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         log.info(stageName + " took " + result.durationMillis() + " ms");
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         log.warning(stageName + " failed: " + error.getMessage());
 *     }
 * });
 * </pre>
 */
public interface CompilationListener {

    /**
     * @param stageNumber current stage number (1-based)
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    void onStageComplete(String stageName, StageResult result);

    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param metrics stage-specific metrics (e.g. "ruleCount", "indicatesEdges")
     */
    record StageResult(
            String stageName,
            long durationNanos,
            Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
