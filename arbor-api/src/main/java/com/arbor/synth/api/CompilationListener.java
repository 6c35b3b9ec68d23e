/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.synth.api;

import java.util.Map;

/**
 * Callback interface for grammar compilation stage events.
 *
 * <p>The compilation pipeline consists of 4 stages:
 * <ol>
 *   <li>VALIDATION - Check rule categories and that the grammar is not empty</li>
 *   <li>CATEGORY_INDEXING - Group live rules into per-category domains</li>
 *   <li>ANALYSIS - Compute minimal sizes and heights, find unproductive categories</li>
 *   <li>MODEL_BUILDING - Re-validate constraints and build the immutable grammar</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * CompilationListener listener = new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         System.out.printf("Completed %s in %d us%n", stageName, result.durationMicros());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * };
 *
 * IGrammarCompiler compiler = new GrammarCompiler();
 * compiler.setCompilationListener(listener);
 * Grammar grammar = compiler.compile(definition);
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName Name of the stage (e.g., "VALIDATION", "ANALYSIS")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes successfully.
     *
     * @param stageName Name of the stage
     * @param result Result containing duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a compilation stage fails.
     *
     * @param stageName Name of the stage that failed
     * @param error The exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics Stage-specific metrics (e.g., "liveRules", "unproductiveCategories")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }

        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
