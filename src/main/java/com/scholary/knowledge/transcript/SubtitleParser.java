package com.scholary.knowledge.transcript;

import com.scholary.knowledge.error.ErrorKind;
import com.scholary.knowledge.error.KnowledgePipelineException;
import com.scholary.knowledge.error.MalformedTranscriptException;
import com.scholary.knowledge.error.TranscriptNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses SRT subtitle text into {@link Segment}s.
 *
 * <p>Expected layout per cue: an integer id line, a timestamp arrow line, one or more text lines,
 * and a blank line before the next cue:
 *
 * <pre>
 * 1
 * 00:00:00,160 --> 00:00:03,879
 * 本当に自分に責任がある
 * </pre>
 *
 * <p>Any defect in a cue is fatal: dropping a cue silently would merge the wrong fragments into a
 * sentence later on.
 */
@Component
public class SubtitleParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleParser.class);

  private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\n\\s*\\n");
  private static final Pattern CUE_ID = Pattern.compile("\\d{1,9}");
  private static final Pattern ARROW = Pattern.compile("(\\S+)\\s*-->\\s*(\\S+)");

  /**
   * Read and parse a subtitle file (UTF-8).
   *
   * @param path the file to read
   * @return segments in source order
   * @throws TranscriptNotFoundException if the file does not exist
   * @throws MalformedTranscriptException if a cue cannot be parsed
   */
  public List<Segment> parseFile(Path path) {
    return parse(read(path));
  }

  /**
   * Read a subtitle file as UTF-8 text without parsing it.
   *
   * @throws TranscriptNotFoundException if the file does not exist
   */
  public String read(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new TranscriptNotFoundException(path);
    }

    String content;
    try {
      content = Files.readString(path, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      throw new TranscriptNotFoundException(path);
    } catch (CharacterCodingException e) {
      throw new KnowledgePipelineException(
          ErrorKind.MALFORMED_INPUT, "Transcript is not valid UTF-8: " + path, e);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read transcript: " + path, e);
    }

    LOGGER.debug("Read transcript {} ({} chars)", path, content.length());
    return content;
  }

  /**
   * Parse subtitle text already in memory.
   *
   * @param content the SRT content
   * @return segments in source order, empty for blank content
   */
  public List<Segment> parse(String content) {
    String normalized =
        content.replace("\uFEFF", "").replace("\r\n", "\n").replace('\r', '\n').trim();
    if (normalized.isEmpty()) {
      LOGGER.warn("Transcript is empty, no segments parsed");
      return List.of();
    }

    String[] blocks = BLOCK_SEPARATOR.split(normalized);
    List<Segment> segments = new ArrayList<>(blocks.length);
    int previousId = 0;
    long previousStartMs = 0;

    for (int i = 0; i < blocks.length; i++) {
      Segment segment = parseBlock(blocks[i], i + 1, previousId, previousStartMs);
      segments.add(segment);
      previousId = segment.id();
      previousStartMs = segment.startMs();
    }

    LOGGER.info("Parsed {} segments", segments.size());
    return List.copyOf(segments);
  }

  private Segment parseBlock(
      String block, int blockNumber, int previousId, long previousStartMs) {
    List<String> lines = Arrays.stream(block.split("\n")).map(String::trim).toList();

    String idLine = lines.get(0);
    if (!CUE_ID.matcher(idLine).matches()) {
      throw new MalformedTranscriptException("missing numeric cue id", blockNumber, null, idLine);
    }
    int id = Integer.parseInt(idLine);
    if (id <= previousId) {
      throw new MalformedTranscriptException(
          "cue id must be greater than previous id " + previousId, blockNumber, id, idLine);
    }

    if (lines.size() < 2) {
      throw new MalformedTranscriptException("missing timestamp line", blockNumber, id, "");
    }
    String arrowLine = lines.get(1);
    Matcher arrow = ARROW.matcher(arrowLine);
    if (!arrow.matches()) {
      throw new MalformedTranscriptException(
          "expected 'HH:MM:SS,mmm --> HH:MM:SS,mmm'", blockNumber, id, arrowLine);
    }

    long startMs;
    long endMs;
    try {
      startMs = SubtitleTimestamp.parse(arrow.group(1));
      endMs = SubtitleTimestamp.parse(arrow.group(2));
    } catch (IllegalArgumentException e) {
      throw new MalformedTranscriptException(e.getMessage(), blockNumber, id, arrowLine, e);
    }
    if (endMs < startMs) {
      throw new MalformedTranscriptException(
          "negative duration " + (endMs - startMs) + "ms", blockNumber, id, arrowLine);
    }
    if (startMs < previousStartMs) {
      throw new MalformedTranscriptException(
          "cue starts before the previous cue at " + SubtitleTimestamp.format(previousStartMs),
          blockNumber,
          id,
          arrowLine);
    }

    String text = String.join(" ", lines.subList(2, lines.size())).trim();

    return new Segment(
        id,
        text,
        SubtitleTimestamp.format(startMs),
        SubtitleTimestamp.format(endMs),
        startMs,
        endMs);
  }
}
