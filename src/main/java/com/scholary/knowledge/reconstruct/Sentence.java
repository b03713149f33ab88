package com.scholary.knowledge.reconstruct;

import java.util.List;

/**
 * One logical utterance rebuilt from contiguous subtitle cues.
 *
 * <p>Timing is inherited: earliest start and latest end among the contributing segments.
 *
 * @param text segment texts concatenated with no separator
 * @param segmentIds contributing segment ids, non-empty and strictly increasing
 */
public record Sentence(
    String text,
    List<Integer> segmentIds,
    String startTime,
    String endTime,
    long startMs,
    long endMs) {

  public Sentence {
    if (segmentIds == null || segmentIds.isEmpty()) {
      throw new IllegalArgumentException("A sentence needs at least one segment");
    }
    segmentIds = List.copyOf(segmentIds);
  }
}
