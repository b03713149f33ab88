package com.scholary.knowledge.cleaning;

import java.util.List;

/** A paragraph after cleaning, keeping its original text and source timing. */
public record CleanedParagraph(
    int paragraphId,
    String originalText,
    String cleanedText,
    String startTime,
    String endTime,
    List<Integer> segmentIds,
    List<CorrectionRecord> corrections,
    CleaningOptions cleaningApplied) {

  public CleanedParagraph {
    segmentIds = segmentIds == null ? List.of() : List.copyOf(segmentIds);
    corrections = corrections == null ? List.of() : List.copyOf(corrections);
  }

  public boolean corrected() {
    return !corrections.isEmpty();
  }
}
