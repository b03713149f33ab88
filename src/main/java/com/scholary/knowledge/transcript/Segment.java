package com.scholary.knowledge.transcript;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One parsed subtitle cue.
 *
 * <p>Timing is kept both as the original timecode strings (for citation) and as milliseconds (for
 * gap arithmetic). Duration is derived, never parsed.
 *
 * @param id sequential cue number, strictly increasing in source order
 * @param text cue body, physical lines joined by single spaces
 * @param startTime start timecode, HH:MM:SS,mmm
 * @param endTime end timecode, HH:MM:SS,mmm
 * @param startMs start in milliseconds
 * @param endMs end in milliseconds
 */
public record Segment(
    int id, String text, String startTime, String endTime, long startMs, long endMs) {

  public Segment {
    if (id <= 0) {
      throw new IllegalArgumentException("Segment id must be positive: " + id);
    }
    if (endMs < startMs) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
    text = text == null ? "" : text;
  }

  /** Build a segment from timecodes, deriving the millisecond fields. */
  public static Segment of(int id, String text, String startTime, String endTime) {
    return new Segment(
        id,
        text,
        startTime,
        endTime,
        SubtitleTimestamp.parse(startTime),
        SubtitleTimestamp.parse(endTime));
  }

  @JsonProperty("duration")
  public long duration() {
    return endMs - startMs;
  }

  public int textLength() {
    return CodePoints.length(text);
  }
}
