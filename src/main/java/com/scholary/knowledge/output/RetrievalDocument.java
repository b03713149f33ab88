package com.scholary.knowledge.output;

import com.scholary.knowledge.chunking.Chunk;
import com.scholary.knowledge.chunking.ChunkMetadata;

/** The shape a downstream loader consumes: text to embed plus metadata to filter and cite. */
public record RetrievalDocument(String chunkId, String text, ChunkMetadata metadata) {

  public static RetrievalDocument from(Chunk chunk) {
    return new RetrievalDocument(chunk.chunkId(), chunk.text(), chunk.metadata());
  }
}
