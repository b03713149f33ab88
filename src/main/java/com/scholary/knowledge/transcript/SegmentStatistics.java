package com.scholary.knowledge.transcript;

import java.util.List;

/**
 * Aggregate view over a parsed transcript. Derived on demand, never stored.
 *
 * @param totalSegments number of cues
 * @param totalDurationMs sum of cue durations
 * @param averageDurationMs mean cue duration, 0 for an empty transcript
 * @param totalCharacters sum of cue text lengths in code points
 * @param averageCharacters mean cue text length, 0 for an empty transcript
 */
public record SegmentStatistics(
    int totalSegments,
    long totalDurationMs,
    double averageDurationMs,
    long totalCharacters,
    double averageCharacters) {

  public static SegmentStatistics of(List<Segment> segments) {
    int count = segments.size();
    long duration = segments.stream().mapToLong(Segment::duration).sum();
    long characters = segments.stream().mapToLong(Segment::textLength).sum();

    if (count == 0) {
      return new SegmentStatistics(0, 0, 0.0, 0, 0.0);
    }
    return new SegmentStatistics(
        count, duration, (double) duration / count, characters, (double) characters / count);
  }
}
