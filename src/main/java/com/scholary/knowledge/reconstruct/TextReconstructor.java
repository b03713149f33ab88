package com.scholary.knowledge.reconstruct;

import com.scholary.knowledge.error.RecordValidationException;
import com.scholary.knowledge.transcript.Segment;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds sentences from subtitle cues.
 *
 * <p>Subtitle tools cut speech at display-width boundaries, not grammar, so one sentence is
 * usually spread over several cues:
 *
 * <pre>
 * 人を | 変えようとする | ことはダメです。
 * </pre>
 *
 * <p>The merge is a two-state accumulator. While {@code COLLECTING}, each incoming segment is
 * appended to the buffer. When the boundary detector reports a split, the accumulator moves to
 * {@code FLUSH}: the buffer becomes a {@link Sentence} and collection restarts with the incoming
 * segment. There is no backtracking.
 */
public class TextReconstructor {

  private static final Logger LOGGER = LoggerFactory.getLogger(TextReconstructor.class);

  enum AccumulatorState {
    COLLECTING,
    FLUSH
  }

  private final SentenceBoundaryDetector boundaryDetector;

  public TextReconstructor(SentenceBoundaryDetector boundaryDetector) {
    this.boundaryDetector = boundaryDetector;
  }

  /**
   * Merge segments into sentences, then group sentences into paragraphs.
   *
   * @param segments parsed segments in source order
   * @param options silence threshold and paragraph size
   * @return sentences, paragraphs and counts
   */
  public ReconstructionResult reconstruct(List<Segment> segments, ReconstructionOptions options) {
    SplitTally tally = new SplitTally();
    List<Sentence> sentences = merge(segments, options.silenceGapMs(), tally);
    List<Paragraph> paragraphs = formParagraphs(sentences, options.maxSentencesPerParagraph());

    LOGGER.info(
        "Reconstructed {} sentences from {} segments ({} split at punctuation, {} at silence)",
        sentences.size(),
        segments.size(),
        tally.punctuation,
        tally.silence);
    LOGGER.info("Formed {} paragraphs", paragraphs.size());

    double average = paragraphs.isEmpty() ? 0.0 : (double) sentences.size() / paragraphs.size();
    return new ReconstructionResult(
        sentences,
        paragraphs,
        new ReconstructionResult.Stats(
            segments.size(),
            sentences.size(),
            paragraphs.size(),
            tally.punctuation,
            tally.silence,
            average));
  }

  /**
   * Merge segments into sentences.
   *
   * <p>Every input segment lands in exactly one sentence, in order.
   *
   * @param segments segments with strictly increasing ids
   * @param silenceGapMs pause threshold in milliseconds
   * @return sentences in source order
   */
  public List<Sentence> mergeSentences(List<Segment> segments, long silenceGapMs) {
    return merge(segments, silenceGapMs, new SplitTally());
  }

  private List<Sentence> merge(List<Segment> segments, long silenceGapMs, SplitTally tally) {
    validateOrder(segments);

    List<Sentence> sentences = new ArrayList<>();
    List<Segment> buffer = new ArrayList<>();
    AccumulatorState state = AccumulatorState.COLLECTING;

    for (Segment next : segments) {
      if (!buffer.isEmpty()) {
        Segment last = buffer.get(buffer.size() - 1);
        SplitReason reason = boundaryDetector.decide(last, next, silenceGapMs);
        tally.record(reason);
        state = reason == SplitReason.NONE ? AccumulatorState.COLLECTING : AccumulatorState.FLUSH;
      }

      if (state == AccumulatorState.FLUSH) {
        sentences.add(toSentence(buffer));
        buffer = new ArrayList<>();
        state = AccumulatorState.COLLECTING;
      }
      buffer.add(next);
    }

    if (!buffer.isEmpty()) {
      sentences.add(toSentence(buffer));
    }
    return List.copyOf(sentences);
  }

  /**
   * Group consecutive sentences into paragraphs of at most {@code maxSentencesPerParagraph}.
   *
   * @param sentences sentences in source order
   * @param maxSentencesPerParagraph paragraph size limit, at least 1
   * @return paragraphs numbered from 1
   */
  public List<Paragraph> formParagraphs(List<Sentence> sentences, int maxSentencesPerParagraph) {
    if (maxSentencesPerParagraph < 1) {
      throw new IllegalArgumentException("A paragraph holds at least one sentence");
    }

    List<Paragraph> paragraphs = new ArrayList<>();
    for (int start = 0; start < sentences.size(); start += maxSentencesPerParagraph) {
      List<Sentence> group =
          sentences.subList(start, Math.min(start + maxSentencesPerParagraph, sentences.size()));

      List<String> texts = group.stream().map(s -> s.text().trim()).toList();
      List<Integer> segmentIds = group.stream().flatMap(s -> s.segmentIds().stream()).toList();
      Sentence first =
          group.stream().min(Comparator.comparingLong(Sentence::startMs)).orElseThrow();
      Sentence last = group.stream().max(Comparator.comparingLong(Sentence::endMs)).orElseThrow();

      paragraphs.add(
          new Paragraph(
              paragraphs.size() + 1,
              texts,
              String.join("", texts),
              first.startTime(),
              last.endTime(),
              segmentIds));
    }
    return List.copyOf(paragraphs);
  }

  private Sentence toSentence(List<Segment> buffer) {
    StringBuilder text = new StringBuilder();
    List<Integer> ids = new ArrayList<>(buffer.size());
    for (Segment segment : buffer) {
      text.append(segment.text());
      ids.add(segment.id());
    }

    Segment first = buffer.stream().min(Comparator.comparingLong(Segment::startMs)).orElseThrow();
    Segment last = buffer.stream().max(Comparator.comparingLong(Segment::endMs)).orElseThrow();
    return new Sentence(
        text.toString(), ids, first.startTime(), last.endTime(), first.startMs(), last.endMs());
  }

  private void validateOrder(List<Segment> segments) {
    for (int i = 1; i < segments.size(); i++) {
      if (segments.get(i).id() <= segments.get(i - 1).id()) {
        throw new RecordValidationException(
            String.format(
                "Segment ids must be strictly increasing: %d follows %d",
                segments.get(i).id(), segments.get(i - 1).id()));
      }
    }
  }

  private static final class SplitTally {
    private int punctuation;
    private int silence;

    void record(SplitReason reason) {
      if (reason == SplitReason.SENTENCE_ENDING) {
        punctuation++;
      } else if (reason == SplitReason.SILENCE_GAP) {
        silence++;
      }
    }
  }
}
