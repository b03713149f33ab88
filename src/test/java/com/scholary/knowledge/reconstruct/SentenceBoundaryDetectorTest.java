package com.scholary.knowledge.reconstruct;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.knowledge.transcript.Segment;
import java.util.List;
import org.junit.jupiter.api.Test;

class SentenceBoundaryDetectorTest {

  private final SentenceBoundaryDetector detector =
      new SentenceBoundaryDetector(List.of("。", "！", "？", "!", "?", "."));

  @Test
  void decide_shouldPreferSentenceEndingOverSilence() {
    Segment last = Segment.of(1, "終わり。", "00:00:00,000", "00:00:01,000");
    Segment next = Segment.of(2, "次", "00:00:09,000", "00:00:10,000");

    assertThat(detector.decide(last, next, 2000)).isEqualTo(SplitReason.SENTENCE_ENDING);
  }

  @Test
  void decide_shouldSplitOnGapLongerThanThreshold() {
    Segment last = Segment.of(1, "途中", "00:00:00,000", "00:00:01,000");
    Segment next = Segment.of(2, "次", "00:00:03,001", "00:00:04,000");

    assertThat(detector.decide(last, next, 2000)).isEqualTo(SplitReason.SILENCE_GAP);
  }

  @Test
  void decide_shouldKeepCollectingOtherwise() {
    Segment last = Segment.of(1, "途中", "00:00:00,000", "00:00:01,000");
    Segment next = Segment.of(2, "次", "00:00:01,500", "00:00:02,000");

    assertThat(detector.decide(last, next, 2000)).isEqualTo(SplitReason.NONE);
  }

  @Test
  void hasSentenceEnding_shouldIgnoreTrailingWhitespace() {
    assertThat(detector.hasSentenceEnding("本当ですか？ ")).isTrue();
    assertThat(detector.hasSentenceEnding("Really!")).isTrue();
    assertThat(detector.hasSentenceEnding("まだ、")).isFalse();
    assertThat(detector.hasSentenceEnding("")).isFalse();
  }

  @Test
  void constructor_shouldRequireEndings() {
    assertThatThrownBy(() -> new SentenceBoundaryDetector(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
