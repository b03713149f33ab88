package com.scholary.knowledge.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.knowledge.chunking.Chunk;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each transcript's chunks to {@code <outputDir>/<transcript>-chunks.json}.
 *
 * <p>Format:
 *
 * <pre>
 * [
 *   {"chunkId": "chunk_001", "text": "...", "metadata": {"topic": "信用", ...}}
 * ]
 * </pre>
 */
public class JsonFileChunkSink implements ChunkSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileChunkSink.class);

  private final ObjectMapper objectMapper;
  private final Path outputDir;

  public JsonFileChunkSink(ObjectMapper objectMapper, Path outputDir) {
    this.objectMapper = objectMapper;
    this.outputDir = outputDir;
  }

  @Override
  public void accept(String transcriptName, List<Chunk> chunks) {
    Path target = outputDir.resolve(baseName(transcriptName) + "-chunks.json");
    List<RetrievalDocument> documents = chunks.stream().map(RetrievalDocument::from).toList();
    try {
      Files.createDirectories(outputDir);
      byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(documents);
      Files.write(target, json);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write chunks to " + target, e);
    }
    LOGGER.info("Wrote {} chunks to {}", chunks.size(), target);
  }

  static String baseName(String transcriptName) {
    return transcriptName.replaceAll("\\.[^.]+$", "");
  }
}
