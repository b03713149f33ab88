package com.scholary.knowledge.extraction;

import java.util.List;
import java.util.Map;

/** Knowledge objects for a transcript plus counts by band and type. */
public record ExtractionResult(List<KnowledgeObject> knowledge, Stats stats) {

  /**
   * @param byType counts keyed by knowledge type label
   */
  public record Stats(int total, int high, int medium, int low, Map<String, Integer> byType) {}
}
