package com.scholary.knowledge.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/** Reads a {@link KnowledgeRuleSet} from JSON. */
@Component
public class KnowledgeRuleSetLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(KnowledgeRuleSetLoader.class);

  private final ObjectMapper objectMapper;

  public KnowledgeRuleSetLoader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Load a rule set.
   *
   * @param resource JSON rule set, e.g. {@code classpath:rules/knowledge-rules-ja-v1.json}
   * @return the parsed rule set
   * @throws IllegalStateException if the resource is missing or not a valid rule set
   */
  public KnowledgeRuleSet load(Resource resource) {
    if (!resource.exists()) {
      throw new IllegalStateException("Rule set not found: " + resource.getDescription());
    }
    try (InputStream in = resource.getInputStream()) {
      KnowledgeRuleSet ruleSet = objectMapper.readValue(in, KnowledgeRuleSet.class);
      LOGGER.info(
          "Loaded rule set {} ({} corrections, {} classification rules) from {}",
          ruleSet.version(),
          ruleSet.cleaning().corrections().size(),
          ruleSet.extraction().classification().size(),
          resource.getDescription());
      return ruleSet;
    } catch (IOException e) {
      throw new IllegalStateException(
          "Failed to load rule set from " + resource.getDescription(), e);
    }
  }
}
