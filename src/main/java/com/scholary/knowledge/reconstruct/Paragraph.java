package com.scholary.knowledge.reconstruct;

import java.util.List;

/**
 * The cleaner's unit of work: one or more consecutive sentences.
 *
 * <p>{@code fullText} and the timecodes may be null on records that did not come from the
 * reconstructor; such records are malformed and are skipped by the cleaner.
 */
public record Paragraph(
    int paragraphId,
    List<String> sentences,
    String fullText,
    String startTime,
    String endTime,
    List<Integer> segmentIds) {

  public Paragraph {
    sentences = sentences == null ? List.of() : List.copyOf(sentences);
    segmentIds = segmentIds == null ? List.of() : List.copyOf(segmentIds);
  }
}
