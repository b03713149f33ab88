package com.scholary.knowledge.extraction;

import com.scholary.knowledge.cleaning.CleanedParagraph;
import com.scholary.knowledge.transcript.TimestampRange;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns cleaned paragraphs into knowledge objects.
 *
 * <p>Works on any string: unexpected text yields empty entities, {@code general}, {@code low},
 * never an exception.
 */
public class KnowledgeExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(KnowledgeExtractor.class);

  static final String GENERAL_TOPIC = "General";
  private static final int TAKEAWAY_FALLBACK_CHARS = 100;

  private final EntityExtractor entityExtractor;
  private final QuoteExtractor quoteExtractor;
  private final KnowledgeClassifier classifier;
  private final ImportanceScorer scorer;
  private final List<String> topicKeywords;

  public KnowledgeExtractor(ExtractionRules rules, ImportanceThresholds thresholds) {
    this.entityExtractor = new EntityExtractor(rules.entities());
    this.quoteExtractor = new QuoteExtractor(rules.quotes());
    this.classifier = new KnowledgeClassifier(rules.classification());
    this.scorer = new ImportanceScorer(thresholds);
    this.topicKeywords = rules.topicKeywords();
  }

  public ExtractionResult extract(List<CleanedParagraph> paragraphs) {
    List<KnowledgeObject> knowledge = new ArrayList<>(paragraphs.size());
    for (CleanedParagraph paragraph : paragraphs) {
      PassageAnalysis analysis = extract(paragraph.cleanedText());
      knowledge.add(
          new KnowledgeObject(
              String.format("k%03d", knowledge.size() + 1),
              paragraph.paragraphId(),
              analysis.topic(),
              analysis.knowledgeType(),
              analysis.content(),
              analysis.entities(),
              TimestampRange.covering(paragraph.startTime(), paragraph.endTime()),
              analysis.importance(),
              paragraph.segmentIds()));
    }

    ExtractionResult.Stats stats = stats(knowledge);
    LOGGER.info(
        "Extracted {} knowledge objects (high={}, medium={}, low={})",
        stats.total(),
        stats.high(),
        stats.medium(),
        stats.low());
    return new ExtractionResult(List.copyOf(knowledge), stats);
  }

  /** Analyze one passage of cleaned text. */
  public PassageAnalysis extract(String text) {
    String main = text == null ? "" : text;
    Entities entities = entityExtractor.extract(main);
    List<String> quotes = quoteExtractor.extractQuotes(main);
    List<String> keyStatements = quoteExtractor.extractKeyStatements(main);

    KnowledgeContent content =
        new KnowledgeContent(main, quotes, keyStatements, keyTakeaway(main, quotes, keyStatements));
    return new PassageAnalysis(
        content,
        entities,
        topic(main),
        classifier.classify(main, entities),
        scorer.score(main, quotes, entities));
  }

  private String topic(String text) {
    return topicKeywords.stream().filter(text::contains).findFirst().orElse(GENERAL_TOPIC);
  }

  private static String keyTakeaway(String text, List<String> quotes, List<String> statements) {
    if (!quotes.isEmpty()) {
      return quotes.get(0);
    }
    if (!statements.isEmpty()) {
      return statements.get(0);
    }
    int length = text.codePointCount(0, text.length());
    if (length <= TAKEAWAY_FALLBACK_CHARS) {
      return text;
    }
    return text.substring(0, text.offsetByCodePoints(0, TAKEAWAY_FALLBACK_CHARS));
  }

  private static ExtractionResult.Stats stats(List<KnowledgeObject> knowledge) {
    Map<String, Integer> byType = new LinkedHashMap<>();
    int high = 0;
    int medium = 0;
    int low = 0;
    for (KnowledgeObject object : knowledge) {
      byType.merge(object.knowledgeType().label(), 1, Integer::sum);
      if (object.importance() == Importance.HIGH) {
        high++;
      } else if (object.importance() == Importance.MEDIUM) {
        medium++;
      } else {
        low++;
      }
    }
    return new ExtractionResult.Stats(knowledge.size(), high, medium, low, byType);
  }
}
