package com.scholary.knowledge.reconstruct;

import com.scholary.knowledge.transcript.Segment;
import java.util.List;

/**
 * Decides whether a sentence ends between two consecutive segments.
 *
 * <p>Two signals, checked in order: the earlier segment's text ends with a sentence-ending mark,
 * or the pause between the segments exceeds the silence threshold.
 */
public class SentenceBoundaryDetector {

  private final List<String> sentenceEndings;

  public SentenceBoundaryDetector(List<String> sentenceEndings) {
    if (sentenceEndings == null || sentenceEndings.isEmpty()) {
      throw new IllegalArgumentException("At least one sentence-ending mark is required");
    }
    this.sentenceEndings = List.copyOf(sentenceEndings);
  }

  /**
   * Decide whether to close the current sentence before appending {@code next}.
   *
   * @param last the last segment currently buffered
   * @param next the segment about to be appended
   * @param silenceGapMs gap threshold in milliseconds (exclusive)
   * @return the reason to split, or {@link SplitReason#NONE}
   */
  public SplitReason decide(Segment last, Segment next, long silenceGapMs) {
    if (hasSentenceEnding(last.text())) {
      return SplitReason.SENTENCE_ENDING;
    }
    if (hasSilenceGap(last, next, silenceGapMs)) {
      return SplitReason.SILENCE_GAP;
    }
    return SplitReason.NONE;
  }

  public boolean hasSentenceEnding(String text) {
    String trimmed = text.trim();
    return sentenceEndings.stream().anyMatch(trimmed::endsWith);
  }

  public static boolean hasSilenceGap(Segment previous, Segment next, long silenceGapMs) {
    return next.startMs() - previous.endMs() > silenceGapMs;
  }
}
