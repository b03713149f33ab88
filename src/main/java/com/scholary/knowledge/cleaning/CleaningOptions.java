package com.scholary.knowledge.cleaning;

/** Switches for the optional cleaning steps. Punctuation and whitespace cleanup always run. */
public record CleaningOptions(
    boolean normalizeCharacters,
    boolean applyCorrections,
    boolean removeNonVerbal,
    boolean removeFillers) {

  public static CleaningOptions defaults() {
    return new CleaningOptions(true, true, true, false);
  }
}
