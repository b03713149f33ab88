package com.scholary.knowledge.extraction;

import java.util.List;

/** Runs classification rules in order; the first match decides the type. */
public class KnowledgeClassifier {

  private final List<ClassificationRule> rules;

  public KnowledgeClassifier(List<ClassificationRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public KnowledgeType classify(String text, Entities entities) {
    if (text == null || text.isEmpty()) {
      return KnowledgeType.GENERAL;
    }
    return rules.stream()
        .filter(rule -> rule.matches(text, entities))
        .map(ClassificationRule::type)
        .findFirst()
        .orElse(KnowledgeType.GENERAL);
  }
}
