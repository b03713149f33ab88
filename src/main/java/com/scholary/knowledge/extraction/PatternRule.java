package com.scholary.knowledge.extraction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.regex.Pattern;

/** Matches when the regular expression is found anywhere in the text. */
public final class PatternRule implements ClassificationRule {

  private final KnowledgeType type;
  private final Pattern pattern;

  @JsonCreator
  public PatternRule(
      @JsonProperty("type") KnowledgeType type, @JsonProperty("pattern") String pattern) {
    if (type == null) {
      throw new IllegalArgumentException("Rule type is required");
    }
    if (pattern == null || pattern.isBlank()) {
      throw new IllegalArgumentException("Rule pattern cannot be blank");
    }
    this.type = type;
    this.pattern = Pattern.compile(pattern);
  }

  @Override
  public KnowledgeType type() {
    return type;
  }

  @JsonProperty("pattern")
  public String pattern() {
    return pattern.pattern();
  }

  @Override
  public boolean matches(String text, Entities entities) {
    return pattern.matcher(text).find();
  }
}
