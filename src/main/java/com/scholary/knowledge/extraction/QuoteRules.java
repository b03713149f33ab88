package com.scholary.knowledge.extraction;

import java.util.List;

/**
 * Quote delimiters and key statement patterns.
 *
 * @param open opening quote mark, a single character
 * @param close closing quote mark, a single character
 * @param keyStatementPatterns regular expressions matching whole key sentences
 */
public record QuoteRules(String open, String close, List<String> keyStatementPatterns) {

  public QuoteRules {
    if (open == null || open.codePointCount(0, open.length()) != 1) {
      throw new IllegalArgumentException("Opening quote must be a single character");
    }
    if (close == null || close.codePointCount(0, close.length()) != 1) {
      throw new IllegalArgumentException("Closing quote must be a single character");
    }
    keyStatementPatterns =
        keyStatementPatterns == null ? List.of() : List.copyOf(keyStatementPatterns);
  }
}
