package com.scholary.knowledge.extraction;

import com.scholary.knowledge.transcript.TimestampRange;
import java.util.List;

/** One cleaned paragraph with its entities, type, importance and citation range. */
public record KnowledgeObject(
    String knowledgeId,
    int paragraphId,
    String topic,
    KnowledgeType knowledgeType,
    KnowledgeContent content,
    Entities entities,
    TimestampRange timestamp,
    Importance importance,
    List<Integer> segmentIds) {

  public KnowledgeObject {
    segmentIds = segmentIds == null ? List.of() : List.copyOf(segmentIds);
  }
}
