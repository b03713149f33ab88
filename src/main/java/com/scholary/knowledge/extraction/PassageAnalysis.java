package com.scholary.knowledge.extraction;

/** Extraction output for a bare passage, before it is tied to a paragraph. */
public record PassageAnalysis(
    KnowledgeContent content,
    Entities entities,
    String topic,
    KnowledgeType knowledgeType,
    Importance importance) {}
