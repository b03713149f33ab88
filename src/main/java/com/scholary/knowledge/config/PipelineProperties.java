package com.scholary.knowledge.config;

import com.scholary.knowledge.cleaning.CleaningOptions;
import com.scholary.knowledge.extraction.ImportanceThresholds;
import com.scholary.knowledge.pipeline.PipelineOptions;
import com.scholary.knowledge.reconstruct.ReconstructionOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the knowledge pipeline.
 *
 * <p>Controls the rule set, stage thresholds, and where results are written.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @Valid @NotNull RulesProperties rules,
    @Valid @NotNull ReconstructionProperties reconstruction,
    @Valid @NotNull CleaningProperties cleaning,
    @Valid @NotNull ExtractionProperties extraction,
    @Valid @NotNull ChunkingProperties chunking,
    @Valid @NotNull OutputProperties output) {

  public record RulesProperties(@NotBlank String location) {}

  public record ReconstructionProperties(
      @PositiveOrZero long silenceGapMs, @Positive int maxSentencesPerParagraph) {}

  public record CleaningProperties(
      boolean normalizeCharacters,
      boolean applyCorrections,
      boolean removeNonVerbal,
      boolean removeFillers) {}

  public record ExtractionProperties(
      @PositiveOrZero int longContentChars,
      @Positive int minQuotesForHigh,
      @Positive int minConceptsForHigh) {}

  public record ChunkingProperties(@Positive int maxChunkChars) {}

  public record OutputProperties(boolean saveIntermediateResults, @NotBlank String dir) {}

  public PipelineOptions toPipelineOptions() {
    return new PipelineOptions(
        new ReconstructionOptions(
            reconstruction.silenceGapMs(), reconstruction.maxSentencesPerParagraph()),
        new CleaningOptions(
            cleaning.normalizeCharacters(),
            cleaning.applyCorrections(),
            cleaning.removeNonVerbal(),
            cleaning.removeFillers()),
        chunking.maxChunkChars());
  }

  public ImportanceThresholds importanceThresholds() {
    return new ImportanceThresholds(
        extraction.longContentChars(),
        extraction.minQuotesForHigh(),
        extraction.minConceptsForHigh());
  }
}
