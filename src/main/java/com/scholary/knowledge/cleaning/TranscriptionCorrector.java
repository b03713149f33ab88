package com.scholary.knowledge.cleaning;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies correction rules in order, each against the output of the previous one.
 *
 * <p>Positions are code-point offsets into the string being rebuilt by the current rule, so a
 * later rule's positions reflect earlier corrections.
 */
public class TranscriptionCorrector {

  private final List<CompiledRule> rules;

  public TranscriptionCorrector(List<CorrectionRule> rules) {
    this.rules =
        rules.stream()
            .map(rule -> new CompiledRule(Pattern.compile(rule.pattern()), rule.replacement()))
            .toList();
  }

  public Outcome correct(String text) {
    String current = text;
    List<CorrectionRecord> corrections = new ArrayList<>();

    for (CompiledRule rule : rules) {
      Matcher matcher = rule.pattern().matcher(current);
      StringBuilder rebuilt = new StringBuilder();
      int lastEnd = 0;
      while (matcher.find()) {
        // appendReplacement writes the unmatched gap first, then the expanded replacement
        int replacementStart = rebuilt.length() + (matcher.start() - lastEnd);
        matcher.appendReplacement(rebuilt, rule.replacement());
        lastEnd = matcher.end();

        String original = matcher.group();
        String replaced = rebuilt.substring(replacementStart);
        if (!replaced.equals(original)) {
          corrections.add(
              new CorrectionRecord(
                  original, replaced, rebuilt.codePointCount(0, replacementStart)));
        }
      }
      matcher.appendTail(rebuilt);
      current = rebuilt.toString();
    }
    return new Outcome(current, corrections);
  }

  /** Corrected text and the corrections applied to reach it. */
  public record Outcome(String text, List<CorrectionRecord> corrections) {

    public Outcome {
      corrections = List.copyOf(corrections);
    }
  }

  private record CompiledRule(Pattern pattern, String replacement) {}
}
