package com.scholary.knowledge.pipeline;

/**
 * Progress report emitted as each stage starts and completes.
 *
 * @param percentage share of stages completed, 0 to 100
 * @param elapsedMs time since the run started
 */
public record StageProgress(
    PipelineStage stage, boolean completed, String message, int percentage, long elapsedMs) {}
