package com.scholary.knowledge.chunking;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.knowledge.extraction.KnowledgeObject;
import com.scholary.knowledge.transcript.CodePoints;
import java.util.List;

/**
 * A retrieval unit: consecutive knowledge objects merged under a size budget.
 *
 * <p>Serialized with member ids only; the members themselves live in the knowledge output.
 */
public record Chunk(
    String chunkId,
    @JsonIgnore List<KnowledgeObject> knowledge,
    String text,
    ChunkMetadata metadata) {

  public Chunk {
    knowledge = knowledge == null ? List.of() : List.copyOf(knowledge);
  }

  @JsonProperty("knowledgeIds")
  public List<String> knowledgeIds() {
    return knowledge.stream().map(KnowledgeObject::knowledgeId).toList();
  }

  @JsonIgnore
  public int size() {
    return CodePoints.length(text);
  }
}
