package com.scholary.knowledge.chunking;

import com.scholary.knowledge.extraction.Importance;
import com.scholary.knowledge.transcript.TimestampRange;
import java.util.List;

/**
 * Retrieval metadata for a chunk.
 *
 * @param contextBefore topic of the preceding chunk, null for the first chunk
 * @param contextAfter topic of the following chunk, null for the last chunk
 */
public record ChunkMetadata(
    TimestampRange timestampRange,
    String topic,
    Importance importance,
    List<String> concepts,
    List<String> keywords,
    List<Integer> segmentIds,
    String contextBefore,
    String contextAfter,
    String language) {

  public ChunkMetadata {
    concepts = concepts == null ? List.of() : List.copyOf(concepts);
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
    segmentIds = segmentIds == null ? List.of() : List.copyOf(segmentIds);
  }
}
