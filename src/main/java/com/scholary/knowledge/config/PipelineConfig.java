package com.scholary.knowledge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.knowledge.chunking.SemanticChunker;
import com.scholary.knowledge.cleaning.ContentCleaner;
import com.scholary.knowledge.extraction.KnowledgeExtractor;
import com.scholary.knowledge.output.ChunkSink;
import com.scholary.knowledge.output.JsonFileChunkSink;
import com.scholary.knowledge.pipeline.PipelineSettings;
import com.scholary.knowledge.reconstruct.SentenceBoundaryDetector;
import com.scholary.knowledge.reconstruct.TextReconstructor;
import com.scholary.knowledge.rules.KnowledgeRuleSet;
import com.scholary.knowledge.rules.KnowledgeRuleSetLoader;
import java.nio.file.Path;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the pipeline stages.
 *
 * <p>The rule set is loaded once at startup and each stage receives its own slice of it.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

  @Bean
  public KnowledgeRuleSet knowledgeRuleSet(
      KnowledgeRuleSetLoader loader, ResourceLoader resourceLoader, PipelineProperties properties) {
    return loader.load(resourceLoader.getResource(properties.rules().location()));
  }

  @Bean
  public TextReconstructor textReconstructor(KnowledgeRuleSet ruleSet) {
    return new TextReconstructor(new SentenceBoundaryDetector(ruleSet.sentenceEndings()));
  }

  @Bean
  public ContentCleaner contentCleaner(KnowledgeRuleSet ruleSet) {
    return new ContentCleaner(ruleSet.cleaning());
  }

  @Bean
  public KnowledgeExtractor knowledgeExtractor(
      KnowledgeRuleSet ruleSet, PipelineProperties properties) {
    return new KnowledgeExtractor(ruleSet.extraction(), properties.importanceThresholds());
  }

  @Bean
  public SemanticChunker semanticChunker(KnowledgeRuleSet ruleSet) {
    return new SemanticChunker(ruleSet.keywordTerms(), ruleSet.language());
  }

  @Bean
  public PipelineSettings pipelineSettings(
      KnowledgeRuleSet ruleSet, PipelineProperties properties) {
    return new PipelineSettings(
        properties.toPipelineOptions(),
        ruleSet.version(),
        properties.output().saveIntermediateResults(),
        Path.of(properties.output().dir()));
  }

  @Bean
  public ChunkSink chunkSink(ObjectMapper objectMapper, PipelineProperties properties) {
    return new JsonFileChunkSink(objectMapper, Path.of(properties.output().dir()));
  }
}
