package com.scholary.knowledge.cleaning;

import java.util.List;

/** Cleaned paragraphs, counts, and every correction applied across the transcript. */
public record CleaningResult(
    List<CleanedParagraph> cleanedParagraphs, Stats stats, List<CorrectionRecord> corrections) {

  public record Stats(
      int paragraphsProcessed,
      int paragraphsCorrected,
      int paragraphsSkipped,
      int totalCorrections,
      int uniqueCorrections) {}
}
