package com.scholary.knowledge.extraction;

import java.util.List;

/** Matches when the text contains any of the markers verbatim. */
public record MarkerRule(KnowledgeType type, List<String> markers) implements ClassificationRule {

  public MarkerRule {
    if (type == null) {
      throw new IllegalArgumentException("Rule type is required");
    }
    markers = markers == null ? List.of() : List.copyOf(markers);
  }

  @Override
  public boolean matches(String text, Entities entities) {
    return markers.stream().anyMatch(text::contains);
  }
}
