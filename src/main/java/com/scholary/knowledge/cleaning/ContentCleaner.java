package com.scholary.knowledge.cleaning;

import com.scholary.knowledge.error.RecordValidationException;
import com.scholary.knowledge.reconstruct.Paragraph;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cleans reconstructed paragraphs.
 *
 * <p>Steps run in a fixed order: character normalization, transcription corrections, non-verbal
 * marker removal, filler removal, punctuation, whitespace. Optional steps are switched by {@link
 * CleaningOptions}.
 *
 * <p>A paragraph without text is skipped and counted rather than failing the transcript.
 */
public class ContentCleaner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContentCleaner.class);

  private final TranscriptionCorrector corrector;
  private final Pattern nonVerbalMarker;
  private final Pattern filler;

  public ContentCleaner(CleaningRules rules) {
    this.corrector = new TranscriptionCorrector(rules.corrections());
    this.nonVerbalMarker = markerPattern(rules.nonVerbalMarkers());
    this.filler = alternation(rules.fillerWords());
  }

  public CleaningResult clean(List<Paragraph> paragraphs, CleaningOptions options) {
    List<CleanedParagraph> cleaned = new ArrayList<>();
    List<CorrectionRecord> allCorrections = new ArrayList<>();
    int skipped = 0;

    for (Paragraph paragraph : paragraphs) {
      try {
        validate(paragraph);
      } catch (RecordValidationException e) {
        LOGGER.warn("Skipping paragraph: {}", e.getMessage());
        skipped++;
        continue;
      }
      CleanedParagraph result = cleanParagraph(paragraph, options);
      cleaned.add(result);
      allCorrections.addAll(result.corrections());
    }

    int corrected = (int) cleaned.stream().filter(CleanedParagraph::corrected).count();
    Set<String> unique =
        allCorrections.stream()
            .map(c -> c.original() + "→" + c.corrected())
            .collect(Collectors.toCollection(LinkedHashSet::new));

    LOGGER.info(
        "Cleaned {} paragraphs ({} corrected, {} skipped), {} corrections applied",
        cleaned.size(),
        corrected,
        skipped,
        allCorrections.size());

    return new CleaningResult(
        cleaned,
        new CleaningResult.Stats(
            cleaned.size(), corrected, skipped, allCorrections.size(), unique.size()),
        allCorrections);
  }

  /** Clean one passage of text; the corrections applied are discarded. */
  public String cleanText(String text, CleaningOptions options) {
    return apply(text, options).text();
  }

  private CleanedParagraph cleanParagraph(Paragraph paragraph, CleaningOptions options) {
    TranscriptionCorrector.Outcome outcome = apply(paragraph.fullText(), options);
    return new CleanedParagraph(
        paragraph.paragraphId(),
        paragraph.fullText(),
        outcome.text(),
        paragraph.startTime(),
        paragraph.endTime(),
        paragraph.segmentIds(),
        outcome.corrections(),
        options);
  }

  private TranscriptionCorrector.Outcome apply(String text, CleaningOptions options) {
    String current = text;
    if (options.normalizeCharacters()) {
      current = CharacterNormalizer.normalize(current);
    }

    List<CorrectionRecord> corrections = List.of();
    if (options.applyCorrections()) {
      TranscriptionCorrector.Outcome outcome = corrector.correct(current);
      current = outcome.text();
      corrections = outcome.corrections();
    }

    if (options.removeNonVerbal() && nonVerbalMarker != null) {
      current = nonVerbalMarker.matcher(current).replaceAll("");
    }
    if (options.removeFillers() && filler != null) {
      current = filler.matcher(current).replaceAll("");
    }

    current = PunctuationStandardizer.standardize(current);
    current = PunctuationStandardizer.cleanWhitespace(current);
    return new TranscriptionCorrector.Outcome(current, corrections);
  }

  private void validate(Paragraph paragraph) {
    if (paragraph == null) {
      throw new RecordValidationException("null paragraph record");
    }
    if (paragraph.fullText() == null) {
      throw new RecordValidationException(
          "paragraph " + paragraph.paragraphId() + " has no text");
    }
    if (paragraph.startTime() == null || paragraph.endTime() == null) {
      throw new RecordValidationException(
          "paragraph " + paragraph.paragraphId() + " has no start or end time");
    }
  }

  private static Pattern markerPattern(List<String> labels) {
    if (labels.isEmpty()) {
      return null;
    }
    String names = labels.stream().map(Pattern::quote).collect(Collectors.joining("|"));
    return Pattern.compile("[\\[［]\\s*(?:" + names + ")\\s*[\\]］]");
  }

  private static Pattern alternation(List<String> words) {
    if (words.isEmpty()) {
      return null;
    }
    return Pattern.compile(words.stream().map(Pattern::quote).collect(Collectors.joining("|")));
  }
}
