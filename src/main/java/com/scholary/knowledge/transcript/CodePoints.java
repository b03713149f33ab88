package com.scholary.knowledge.transcript;

/** Text length in Unicode code points, the unit every size budget in the pipeline is counted in. */
public final class CodePoints {

  private CodePoints() {}

  public static int length(String text) {
    return text == null ? 0 : text.codePointCount(0, text.length());
  }
}
