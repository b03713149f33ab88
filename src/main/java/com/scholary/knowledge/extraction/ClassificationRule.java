package com.scholary.knowledge.extraction;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A matcher paired with the knowledge type it assigns.
 *
 * <p>Rules are read from the rule set JSON, tagged by {@code kind}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(value = MarkerRule.class, name = "marker"),
  @JsonSubTypes.Type(value = AgeWithVerbRule.class, name = "age-with-verb"),
  @JsonSubTypes.Type(value = PatternRule.class, name = "pattern")
})
public interface ClassificationRule {

  KnowledgeType type();

  boolean matches(String text, Entities entities);
}
