package com.scholary.knowledge.chunking;

import java.util.List;
import java.util.Map;

/** Chunks for a transcript and their size profile. */
public record ChunkingResult(List<Chunk> chunks, Stats stats) {

  /**
   * @param oversizedChunks single-object chunks whose text exceeds the budget
   * @param byImportance counts keyed by importance label
   */
  public record Stats(
      int totalChunks,
      int totalKnowledge,
      double averageChunkSize,
      int oversizedChunks,
      SizeDistribution sizeDistribution,
      Map<String, Integer> byImportance) {}

  /** Chunk counts by size: small below 400, medium below 700, large from 700. */
  public record SizeDistribution(int small, int medium, int large) {}
}
