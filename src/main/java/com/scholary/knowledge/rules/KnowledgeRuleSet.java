package com.scholary.knowledge.rules;

import com.scholary.knowledge.cleaning.CleaningRules;
import com.scholary.knowledge.extraction.ExtractionRules;
import java.util.List;

/**
 * Versioned language data for the whole pipeline.
 *
 * <p>Each stage receives only its own slice: the reconstructor the sentence endings, the cleaner
 * {@link CleaningRules}, the extractor {@link ExtractionRules}, the chunker the keyword terms and
 * language.
 */
public record KnowledgeRuleSet(
    String version,
    String language,
    List<String> sentenceEndings,
    CleaningRules cleaning,
    ExtractionRules extraction,
    List<String> keywordTerms) {

  public KnowledgeRuleSet {
    if (version == null || version.isBlank()) {
      throw new IllegalArgumentException("Rule set version is required");
    }
    if (sentenceEndings == null || sentenceEndings.isEmpty()) {
      throw new IllegalArgumentException("Rule set must define sentence endings");
    }
    if (cleaning == null || extraction == null) {
      throw new IllegalArgumentException("Rule set must define cleaning and extraction rules");
    }
    sentenceEndings = List.copyOf(sentenceEndings);
    keywordTerms = keywordTerms == null ? List.of() : List.copyOf(keywordTerms);
  }
}
