package com.scholary.knowledge.pipeline;

import com.scholary.knowledge.cleaning.CleaningOptions;
import com.scholary.knowledge.reconstruct.ReconstructionOptions;

/** Per-run stage options. Part of the result cache key. */
public record PipelineOptions(
    ReconstructionOptions reconstruction, CleaningOptions cleaning, int maxChunkChars) {

  public PipelineOptions {
    if (reconstruction == null || cleaning == null) {
      throw new IllegalArgumentException("Reconstruction and cleaning options are required");
    }
    if (maxChunkChars <= 0) {
      throw new IllegalArgumentException("Chunk budget must be positive: " + maxChunkChars);
    }
  }

  public static PipelineOptions defaults() {
    return new PipelineOptions(
        ReconstructionOptions.defaults(), CleaningOptions.defaults(), 1000);
  }
}
