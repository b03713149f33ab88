package com.scholary.knowledge.cleaning;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A known mis-transcription and its fix.
 *
 * @param pattern regular expression matched against the paragraph text
 * @param replacement replacement text, may use group references
 */
public record CorrectionRule(String pattern, String replacement) {

  public CorrectionRule {
    if (pattern == null || pattern.isBlank()) {
      throw new IllegalArgumentException("Correction pattern cannot be blank");
    }
    if (replacement == null) {
      throw new IllegalArgumentException("Correction replacement cannot be null");
    }
    try {
      Pattern.compile(pattern);
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException("Invalid correction pattern: " + pattern, e);
    }
  }
}
