package com.scholary.knowledge.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;

/** The bundled Japanese rule set, loaded once for tests. */
public final class RuleSetFixtures {

  public static final String JAPANESE_LOCATION = "rules/knowledge-rules-ja-v1.json";

  private static KnowledgeRuleSet japanese;

  private RuleSetFixtures() {}

  public static synchronized KnowledgeRuleSet japanese() {
    if (japanese == null) {
      japanese =
          new KnowledgeRuleSetLoader(new ObjectMapper())
              .load(new ClassPathResource(JAPANESE_LOCATION));
    }
    return japanese;
  }
}
