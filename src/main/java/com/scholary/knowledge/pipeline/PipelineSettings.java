package com.scholary.knowledge.pipeline;

import java.nio.file.Path;

/**
 * Run-wide settings for {@link KnowledgePipeline}.
 *
 * @param ruleSetVersion version of the loaded rule set, part of the cache key
 * @param saveIntermediateResults write every stage's output under {@code outputDir}
 */
public record PipelineSettings(
    PipelineOptions options,
    String ruleSetVersion,
    boolean saveIntermediateResults,
    Path outputDir) {}
