package com.scholary.knowledge.transcript;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Writes segments back out as SRT.
 *
 * <p>Format:
 *
 * <pre>
 * 1
 * 00:00:00,160 --> 00:00:03,879
 * 本当に自分に責任がある
 *
 * 2
 * 00:00:03,879 --> 00:00:07,240
 * 人間って変わらないんだよ
 * </pre>
 *
 * <p>Cue numbers are the segment ids, so a parsed transcript re-serializes to the same cue
 * numbering and timecodes.
 */
@Component
public class SubtitleWriter {

  public String toSrt(List<Segment> segments) {
    StringBuilder srt = new StringBuilder();

    for (Segment segment : segments) {
      srt.append(segment.id()).append("\n");
      srt.append(SubtitleTimestamp.format(segment.startMs()))
          .append(" --> ")
          .append(SubtitleTimestamp.format(segment.endMs()))
          .append("\n");
      srt.append(segment.text()).append("\n");
      srt.append("\n");
    }

    return srt.toString();
  }

  public byte[] writeSrt(List<Segment> segments) {
    return toSrt(segments).getBytes(StandardCharsets.UTF_8);
  }
}
