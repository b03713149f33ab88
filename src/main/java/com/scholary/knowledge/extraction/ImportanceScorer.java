package com.scholary.knowledge.extraction;

import com.scholary.knowledge.transcript.CodePoints;
import java.util.List;

/**
 * Scores a passage {@code high}, {@code medium} or {@code low}.
 *
 * <p>Monotonic: adding quotes or entities never lowers the band.
 */
public class ImportanceScorer {

  private final ImportanceThresholds thresholds;

  public ImportanceScorer(ImportanceThresholds thresholds) {
    this.thresholds = thresholds;
  }

  public Importance score(String content, List<String> quotes, Entities entities) {
    boolean longContent = CodePoints.length(content) > thresholds.longContentChars();

    if (longContent
        && (quotes.size() >= thresholds.minQuotesForHigh()
            || entities.concepts().size() >= thresholds.minConceptsForHigh())) {
      return Importance.HIGH;
    }
    if (!longContent && quotes.isEmpty() && entities.isEmpty()) {
      return Importance.LOW;
    }
    return Importance.MEDIUM;
  }
}
