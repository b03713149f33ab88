package com.scholary.knowledge.transcript;

import java.util.Objects;

/**
 * A citation range expressed as SRT timecodes.
 *
 * <p>Used for knowledge objects and chunks, which point back to the original recording by the
 * start of their first segment and the end of their last. When both ends are well-formed
 * timecodes the range must not run backwards.
 */
public record TimestampRange(String start, String end) {

  public TimestampRange {
    if (start == null || end == null) {
      throw new IllegalArgumentException("Timestamp range bounds cannot be null");
    }
    if (SubtitleTimestamp.isValid(start)
        && SubtitleTimestamp.isValid(end)
        && SubtitleTimestamp.parse(end) < SubtitleTimestamp.parse(start)) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  /**
   * Range over two timecodes in either order. Missing bounds become empty strings, so records
   * built outside the parser still get a range.
   */
  public static TimestampRange covering(String first, String second) {
    String a = Objects.requireNonNullElse(first, "");
    String b = Objects.requireNonNullElse(second, "");
    if (SubtitleTimestamp.isValid(a)
        && SubtitleTimestamp.isValid(b)
        && SubtitleTimestamp.parse(b) < SubtitleTimestamp.parse(a)) {
      return new TimestampRange(b, a);
    }
    return new TimestampRange(a, b);
  }

  /** Range from the earliest start to the latest end of two ranges. */
  public static TimestampRange spanning(TimestampRange first, TimestampRange last) {
    return new TimestampRange(
        earlier(first.start(), last.start()), later(first.end(), last.end()));
  }

  private static String earlier(String a, String b) {
    if (SubtitleTimestamp.isValid(a)
        && SubtitleTimestamp.isValid(b)
        && SubtitleTimestamp.parse(b) < SubtitleTimestamp.parse(a)) {
      return b;
    }
    return a;
  }

  private static String later(String a, String b) {
    if (SubtitleTimestamp.isValid(a)
        && SubtitleTimestamp.isValid(b)
        && SubtitleTimestamp.parse(a) > SubtitleTimestamp.parse(b)) {
      return a;
    }
    return b;
  }
}
