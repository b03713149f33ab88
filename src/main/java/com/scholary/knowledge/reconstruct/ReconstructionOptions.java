package com.scholary.knowledge.reconstruct;

/**
 * Tuning for sentence and paragraph reconstruction.
 *
 * @param silenceGapMs a pause longer than this between two cues ends the sentence
 * @param maxSentencesPerParagraph sentences grouped into one paragraph
 */
public record ReconstructionOptions(long silenceGapMs, int maxSentencesPerParagraph) {

  public static final long DEFAULT_SILENCE_GAP_MS = 2000;

  public ReconstructionOptions {
    if (silenceGapMs < 0) {
      throw new IllegalArgumentException("Silence gap cannot be negative");
    }
    if (maxSentencesPerParagraph < 1) {
      throw new IllegalArgumentException("A paragraph holds at least one sentence");
    }
  }

  public static ReconstructionOptions defaults() {
    return new ReconstructionOptions(DEFAULT_SILENCE_GAP_MS, 1);
  }
}
