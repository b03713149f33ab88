package com.scholary.knowledge.output;

import com.scholary.knowledge.chunking.Chunk;
import java.util.List;

/**
 * Where finished chunks go: an embedding job, a vector store loader, a file.
 *
 * <p>Implementations report I/O failures as {@link java.io.UncheckedIOException}.
 */
public interface ChunkSink {

  /**
   * Hand over the chunks of one transcript.
   *
   * @param transcriptName the transcript the chunks came from
   * @param chunks chunks in source order
   */
  void accept(String transcriptName, List<Chunk> chunks);
}
