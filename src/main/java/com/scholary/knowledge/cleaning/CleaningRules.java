package com.scholary.knowledge.cleaning;

import java.util.List;

/**
 * Language data the cleaner works from.
 *
 * @param corrections ordered correction rules, applied one after another
 * @param nonVerbalMarkers labels written in brackets by the transcriber, e.g. {@code 音楽}
 * @param fillerWords verbal fillers removed when filler removal is enabled
 */
public record CleaningRules(
    List<CorrectionRule> corrections, List<String> nonVerbalMarkers, List<String> fillerWords) {

  public CleaningRules {
    corrections = corrections == null ? List.of() : List.copyOf(corrections);
    nonVerbalMarkers = nonVerbalMarkers == null ? List.of() : List.copyOf(nonVerbalMarkers);
    fillerWords = fillerWords == null ? List.of() : List.copyOf(fillerWords);
  }
}
