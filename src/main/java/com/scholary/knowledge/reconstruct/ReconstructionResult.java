package com.scholary.knowledge.reconstruct;

import java.util.List;

/** Sentences and paragraphs rebuilt from one transcript. */
public record ReconstructionResult(
    List<Sentence> sentences, List<Paragraph> paragraphs, Stats stats) {

  public record Stats(
      int originalSegments,
      int reconstructedSentences,
      int paragraphs,
      int splitsAtPunctuation,
      int splitsAtSilence,
      double averageSentencesPerParagraph) {}
}
