package com.scholary.knowledge.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SubtitleTimestampTest {

  @Test
  void parse_shouldConvertTimecodeToMillis() {
    assertThat(SubtitleTimestamp.parse("00:00:00,160")).isEqualTo(160);
    assertThat(SubtitleTimestamp.parse("00:00:03,879")).isEqualTo(3879);
    assertThat(SubtitleTimestamp.parse("01:01:01,500")).isEqualTo(3_661_500);
  }

  @Test
  void parse_shouldAcceptHoursBeyondTwoDigits() {
    assertThat(SubtitleTimestamp.parse("100:00:00,000")).isEqualTo(360_000_000L);
  }

  @Test
  void parse_shouldRejectMalformedTimecodes() {
    assertThatThrownBy(() -> SubtitleTimestamp.parse("00:00:03.879"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid SRT timestamp");
    assertThatThrownBy(() -> SubtitleTimestamp.parse("00:61:00,000"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SubtitleTimestamp.parse(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void format_shouldZeroPadEveryField() {
    assertThat(SubtitleTimestamp.format(0)).isEqualTo("00:00:00,000");
    assertThat(SubtitleTimestamp.format(3_665_750)).isEqualTo("01:01:05,750");
  }

  @Test
  void format_shouldRejectNegativeMillis() {
    assertThatThrownBy(() -> SubtitleTimestamp.format(-1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("negative");
  }

  @Test
  void parseAndFormat_shouldRoundTrip() {
    for (String timecode : new String[] {"00:00:00,000", "00:12:07,240", "23:59:59,999"}) {
      assertThat(SubtitleTimestamp.format(SubtitleTimestamp.parse(timecode))).isEqualTo(timecode);
    }
    for (long millis : new long[] {0, 999, 60_000, 86_399_999}) {
      assertThat(SubtitleTimestamp.parse(SubtitleTimestamp.format(millis))).isEqualTo(millis);
    }
  }
}
