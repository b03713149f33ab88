package com.scholary.knowledge.transcript;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversion between SRT timecodes and milliseconds.
 *
 * <p>Format: HH:MM:SS,mmm (hours:minutes:seconds,milliseconds). Hours may exceed two digits for
 * very long recordings. {@code parse(format(ms)) == ms} and {@code format(parse(s)) == s} for every
 * valid input.
 */
public final class SubtitleTimestamp {

  private static final Pattern TIMECODE =
      Pattern.compile("(\\d{2,}):([0-5]\\d):([0-5]\\d),(\\d{3})");

  private SubtitleTimestamp() {}

  /**
   * Parse an SRT timecode to milliseconds: {@code ((H*60+M)*60+S)*1000+mmm}.
   *
   * @param timestamp the timecode, surrounding whitespace ignored
   * @return milliseconds from the start of the recording
   * @throws IllegalArgumentException if the timecode is not HH:MM:SS,mmm
   */
  public static long parse(String timestamp) {
    if (timestamp == null) {
      throw new IllegalArgumentException("Timestamp is null");
    }
    Matcher matcher = TIMECODE.matcher(timestamp.trim());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid SRT timestamp: " + timestamp);
    }
    long hours = Long.parseLong(matcher.group(1));
    long minutes = Long.parseLong(matcher.group(2));
    long seconds = Long.parseLong(matcher.group(3));
    long millis = Long.parseLong(matcher.group(4));
    return ((hours * 60 + minutes) * 60 + seconds) * 1000 + millis;
  }

  /**
   * Format milliseconds as an SRT timecode.
   *
   * @param millis non-negative milliseconds
   * @return the timecode, zero-padded
   */
  public static String format(long millis) {
    if (millis < 0) {
      throw new IllegalArgumentException("Timestamp cannot be negative: " + millis);
    }
    long hours = millis / 3_600_000;
    long minutes = (millis % 3_600_000) / 60_000;
    long seconds = (millis % 60_000) / 1000;
    long ms = millis % 1000;

    return String.format("%02d:%02d:%02d,%03d", hours, minutes, seconds, ms);
  }

  /** True when the value is a well-formed timecode. */
  public static boolean isValid(String timestamp) {
    return timestamp != null && TIMECODE.matcher(timestamp.trim()).matches();
  }
}
