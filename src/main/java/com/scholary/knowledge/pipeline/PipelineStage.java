package com.scholary.knowledge.pipeline;

/** The five stages, in execution order. */
public enum PipelineStage {
  PARSE("Parse SRT"),
  RECONSTRUCT("Reconstruct Text"),
  CLEAN("Clean Content"),
  EXTRACT("Extract Knowledge"),
  CHUNK("Create Chunks");

  private final String displayName;

  PipelineStage(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  /** 1-based position in the pipeline. */
  public int number() {
    return ordinal() + 1;
  }

  public static int count() {
    return values().length;
  }
}
