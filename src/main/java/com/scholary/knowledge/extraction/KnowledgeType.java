package com.scholary.knowledge.extraction;

import com.fasterxml.jackson.annotation.JsonValue;

/** What kind of knowledge a passage carries. */
public enum KnowledgeType {
  ADVICE("advice"),
  BIOGRAPHICAL_EVENT("biographical_event"),
  CONCEPT_DEFINITION("concept_definition"),
  GENERAL("general");

  private final String label;

  KnowledgeType(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}
