package com.scholary.knowledge.extraction;

/**
 * Cut-offs for the importance bands.
 *
 * @param longContentChars content longer than this (in code points) counts as long
 * @param minQuotesForHigh quotes needed, with long content, for {@code high}
 * @param minConceptsForHigh concepts needed, with long content, for {@code high}
 */
public record ImportanceThresholds(
    int longContentChars, int minQuotesForHigh, int minConceptsForHigh) {

  public ImportanceThresholds {
    if (longContentChars < 0 || minQuotesForHigh < 1 || minConceptsForHigh < 1) {
      throw new IllegalArgumentException("Importance thresholds must be positive");
    }
  }

  public static ImportanceThresholds defaults() {
    return new ImportanceThresholds(100, 2, 2);
  }
}
