package com.scholary.knowledge.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.knowledge.pipeline.PipelineResult;
import com.scholary.knowledge.transcript.SubtitleWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes every stage's output for inspection.
 *
 * <p>Files written to the target directory:
 *
 * <pre>
 * 01-segments.json       parsed cues and their statistics
 * 01-segments.srt        the cues re-serialized as SRT
 * 02-reconstructed.json  sentences and paragraphs
 * 03-cleaned.json        cleaned paragraphs and corrections
 * 04-knowledge.json      knowledge objects
 * 05-chunks.json         chunks
 * </pre>
 */
@Component
public class PipelineResultWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineResultWriter.class);

  private final ObjectMapper objectMapper;
  private final SubtitleWriter subtitleWriter;

  public PipelineResultWriter(ObjectMapper objectMapper, SubtitleWriter subtitleWriter) {
    this.objectMapper = objectMapper;
    this.subtitleWriter = subtitleWriter;
  }

  /**
   * Write all intermediate results of a run.
   *
   * @param result the finished run
   * @param directory target directory, created if missing
   */
  public void writeIntermediateResults(PipelineResult result, Path directory) {
    Map<String, Object> segments = new LinkedHashMap<>();
    segments.put("statistics", result.segmentStatistics());
    segments.put("segments", result.segments());

    try {
      Files.createDirectories(directory);
      write(directory.resolve("01-segments.json"), writeJson(segments));
      write(directory.resolve("01-segments.srt"), subtitleWriter.writeSrt(result.segments()));
      write(directory.resolve("02-reconstructed.json"), writeJson(result.reconstruction()));
      write(directory.resolve("03-cleaned.json"), writeJson(result.cleaning()));
      write(directory.resolve("04-knowledge.json"), writeJson(result.extraction()));
      write(directory.resolve("05-chunks.json"), writeJson(result.chunking()));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write intermediate results to " + directory, e);
    }
    LOGGER.info("Saved intermediate results for {} to {}", result.transcriptName(), directory);
  }

  public byte[] writeJson(Object value) throws IOException {
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
  }

  private static void write(Path file, byte[] content) throws IOException {
    Files.write(file, content);
  }
}
