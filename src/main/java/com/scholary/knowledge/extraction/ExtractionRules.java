package com.scholary.knowledge.extraction;

import java.util.List;

/**
 * Everything the extractor needs from the rule set.
 *
 * @param topicKeywords topic vocabulary in priority order
 * @param classification classification rules, first match wins
 */
public record ExtractionRules(
    EntityRules entities,
    QuoteRules quotes,
    List<String> topicKeywords,
    List<ClassificationRule> classification) {

  public ExtractionRules {
    if (entities == null || quotes == null) {
      throw new IllegalArgumentException("Entity and quote rules are required");
    }
    topicKeywords = topicKeywords == null ? List.of() : List.copyOf(topicKeywords);
    classification = classification == null ? List.of() : List.copyOf(classification);
  }
}
