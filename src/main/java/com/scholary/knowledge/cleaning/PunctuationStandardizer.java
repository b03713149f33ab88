package com.scholary.knowledge.cleaning;

import java.util.regex.Pattern;

/** Collapses repeated punctuation and tidies whitespace. */
public final class PunctuationStandardizer {

  private static final Pattern REPEATED_MARK = Pattern.compile("([!！?？、])\\1+");
  private static final Pattern ELLIPSIS_RUN = Pattern.compile("\\.{3,}|。{3,}|．{3,}");
  private static final Pattern SPACE_BEFORE_MARK = Pattern.compile("\\s+([。！？、])");
  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

  private PunctuationStandardizer() {}

  /**
   * Runs of one repeated {@code ! ！ ? ？ 、} collapse to a single mark, runs of three or more
   * periods collapse to {@code …}. Runs that alternate marks, such as {@code !?}, are left alone.
   */
  public static String standardize(String text) {
    String result = ELLIPSIS_RUN.matcher(text).replaceAll("…");
    return REPEATED_MARK.matcher(result).replaceAll("$1");
  }

  public static String cleanWhitespace(String text) {
    String result = SPACE_BEFORE_MARK.matcher(text).replaceAll("$1");
    return WHITESPACE_RUN.matcher(result).replaceAll(" ").trim();
  }
}
