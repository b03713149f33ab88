package com.scholary.knowledge.extraction;

import com.fasterxml.jackson.annotation.JsonValue;

/** Importance band, declared from lowest to highest so constants compare by rank. */
public enum Importance {
  LOW("low"),
  MEDIUM("medium"),
  HIGH("high");

  private final String label;

  Importance(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public static Importance max(Importance a, Importance b) {
    return a.compareTo(b) >= 0 ? a : b;
  }
}
