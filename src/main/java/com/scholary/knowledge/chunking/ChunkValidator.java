package com.scholary.knowledge.chunking;

import java.util.ArrayList;
import java.util.List;

/** Checks chunker output against its budget and metadata expectations. */
public final class ChunkValidator {

  private ChunkValidator() {}

  public static Validation validate(List<Chunk> chunks, int maxChunkChars) {
    List<String> issues = new ArrayList<>();
    for (Chunk chunk : chunks) {
      if (chunk.knowledge().isEmpty()) {
        issues.add(chunk.chunkId() + ": no knowledge objects");
      }
      if (chunk.size() > maxChunkChars && chunk.knowledge().size() > 1) {
        issues.add(
            String.format(
                "%s: %d chars exceeds budget of %d with %d objects",
                chunk.chunkId(), chunk.size(), maxChunkChars, chunk.knowledge().size()));
      }
      if (chunk.metadata().topic() == null || chunk.metadata().topic().isBlank()) {
        issues.add(chunk.chunkId() + ": no topic");
      }
    }
    return new Validation(issues.isEmpty(), issues);
  }

  public record Validation(boolean valid, List<String> issues) {

    public Validation {
      issues = List.copyOf(issues);
    }
  }
}
