package com.scholary.knowledge.pipeline;

import com.scholary.knowledge.cache.PipelineResultCache;
import com.scholary.knowledge.cache.RunKey;
import com.scholary.knowledge.chunking.ChunkingResult;
import com.scholary.knowledge.chunking.SemanticChunker;
import com.scholary.knowledge.cleaning.CleaningResult;
import com.scholary.knowledge.cleaning.ContentCleaner;
import com.scholary.knowledge.error.KnowledgePipelineException;
import com.scholary.knowledge.extraction.ExtractionResult;
import com.scholary.knowledge.extraction.KnowledgeExtractor;
import com.scholary.knowledge.logging.PipelineEventLogger;
import com.scholary.knowledge.output.PipelineResultWriter;
import com.scholary.knowledge.reconstruct.ReconstructionResult;
import com.scholary.knowledge.reconstruct.TextReconstructor;
import com.scholary.knowledge.transcript.Segment;
import com.scholary.knowledge.transcript.SegmentStatistics;
import com.scholary.knowledge.transcript.SubtitleParser;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a transcript through the five stages:
 *
 * <ol>
 *   <li>parse the SRT into segments
 *   <li>reconstruct sentences and paragraphs
 *   <li>clean the paragraphs
 *   <li>extract knowledge objects
 *   <li>group them into chunks
 * </ol>
 *
 * <p>Stages run synchronously on the calling thread. The orchestrator holds no per-run state, so
 * independent transcripts may be processed concurrently.
 *
 * <p>A failing stage is logged and its exception rethrown. {@link #processBatch} instead records
 * the failure and moves on to the next file.
 */
@Service
public class KnowledgePipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(KnowledgePipeline.class);
  private static final PipelineEventLogger EVENTS = new PipelineEventLogger(LOGGER);

  private final SubtitleParser parser;
  private final TextReconstructor reconstructor;
  private final ContentCleaner cleaner;
  private final KnowledgeExtractor extractor;
  private final SemanticChunker chunker;
  private final PipelineResultCache cache;
  private final PipelineResultWriter resultWriter;
  private final PipelineSettings settings;

  public KnowledgePipeline(
      SubtitleParser parser,
      TextReconstructor reconstructor,
      ContentCleaner cleaner,
      KnowledgeExtractor extractor,
      SemanticChunker chunker,
      PipelineResultCache cache,
      PipelineResultWriter resultWriter,
      PipelineSettings settings) {
    this.parser = parser;
    this.reconstructor = reconstructor;
    this.cleaner = cleaner;
    this.extractor = extractor;
    this.chunker = chunker;
    this.cache = cache;
    this.resultWriter = resultWriter;
    this.settings = settings;
  }

  public PipelineResult process(Path file) {
    return process(file, PipelineProgressListener.NONE);
  }

  /**
   * Process a subtitle file.
   *
   * @param file the SRT file
   * @param listener receives stage progress
   * @return every stage's output
   * @throws KnowledgePipelineException if the file is missing or a cue is malformed
   */
  public PipelineResult process(Path file, PipelineProgressListener listener) {
    return run(file, new ProgressTracker(listener, EVENTS));
  }

  /**
   * Process subtitle text already in memory.
   *
   * @param transcriptName name used for logging, caching and output
   * @param content the SRT content
   * @param listener receives stage progress
   * @return every stage's output
   */
  public PipelineResult process(
      String transcriptName, String content, PipelineProgressListener listener) {
    return run(transcriptName, content, new ProgressTracker(listener, EVENTS));
  }

  /**
   * Process files one after another. A failed file does not stop the batch.
   *
   * @param files SRT files
   * @return one result per file, in input order
   */
  public List<BatchItemResult> processBatch(List<Path> files) {
    List<BatchItemResult> results = new ArrayList<>(files.size());
    for (Path file : files) {
      ProgressTracker tracker = new ProgressTracker(PipelineProgressListener.NONE, EVENTS);
      try {
        results.add(BatchItemResult.succeeded(file, run(file, tracker)));
      } catch (KnowledgePipelineException e) {
        results.add(
            BatchItemResult.failed(file, tracker.currentStage(), e.getKind(), e.getMessage()));
      } catch (UncheckedIOException | IllegalArgumentException e) {
        results.add(BatchItemResult.failed(file, tracker.currentStage(), null, e.getMessage()));
      }
    }

    long failed = results.stream().filter(r -> !r.success()).count();
    LOGGER.info("Batch finished: {} files, {} failed", results.size(), failed);
    return results;
  }

  private PipelineResult run(Path file, ProgressTracker tracker) {
    String transcriptName = file.getFileName().toString();
    String content;
    try {
      content = parser.read(file);
    } catch (RuntimeException e) {
      EVENTS.logStageFailed(PipelineStage.PARSE, errorType(e), e.getMessage());
      throw e;
    }
    return run(transcriptName, content, tracker);
  }

  private PipelineResult run(String transcriptName, String content, ProgressTracker tracker) {
    String contentHash = ContentHashes.sha256(content);
    RunKey runKey =
        new RunKey(
            transcriptName, contentHash, settings.ruleSetVersion(), settings.options().hashCode());

    PipelineEventLogger.setTranscriptContext(transcriptName, contentHash);
    try {
      Optional<PipelineResult> cached = cache.lookup(runKey);
      if (cached.isPresent()) {
        EVENTS.logCacheHit(runKey.describe());
        return cached.get();
      }

      PipelineResult result = runStages(transcriptName, contentHash, content, tracker);
      cache.store(runKey, result);

      if (settings.saveIntermediateResults()) {
        Path directory = settings.outputDir().resolve(stripExtension(transcriptName));
        resultWriter.writeIntermediateResults(result, directory);
      }
      return result;
    } catch (RuntimeException e) {
      EVENTS.logStageFailed(tracker.currentStage(), errorType(e), e.getMessage());
      throw e;
    } finally {
      PipelineEventLogger.clearTranscriptContext();
    }
  }

  private PipelineResult runStages(
      String transcriptName, String contentHash, String content, ProgressTracker tracker) {
    PipelineOptions options = settings.options();

    tracker.start(PipelineStage.PARSE, "Parsing " + transcriptName);
    List<Segment> segments = parser.parse(content);
    SegmentStatistics segmentStatistics = SegmentStatistics.of(segments);
    tracker.complete(PipelineStage.PARSE, segments.size() + " segments", segments.size());

    tracker.start(PipelineStage.RECONSTRUCT, "Merging segments into sentences");
    ReconstructionResult reconstruction =
        reconstructor.reconstruct(segments, options.reconstruction());
    tracker.complete(
        PipelineStage.RECONSTRUCT,
        reconstruction.paragraphs().size() + " paragraphs",
        reconstruction.paragraphs().size());

    tracker.start(PipelineStage.CLEAN, "Cleaning paragraphs");
    CleaningResult cleaning = cleaner.clean(reconstruction.paragraphs(), options.cleaning());
    tracker.complete(
        PipelineStage.CLEAN,
        cleaning.stats().totalCorrections() + " corrections",
        cleaning.cleanedParagraphs().size());

    tracker.start(PipelineStage.EXTRACT, "Extracting knowledge");
    ExtractionResult extraction = extractor.extract(cleaning.cleanedParagraphs());
    tracker.complete(
        PipelineStage.EXTRACT,
        extraction.knowledge().size() + " knowledge objects",
        extraction.knowledge().size());

    tracker.start(PipelineStage.CHUNK, "Creating chunks");
    ChunkingResult chunking = chunker.chunk(extraction.knowledge(), options.maxChunkChars());
    tracker.complete(
        PipelineStage.CHUNK,
        chunking.chunks().size() + " chunks",
        chunking.chunks().size());

    EVENTS.logPipelineCompleted(
        segments.size(),
        reconstruction.paragraphs().size(),
        cleaning.stats().totalCorrections(),
        extraction.knowledge().size(),
        chunking.chunks().size(),
        tracker.elapsedMs());

    return new PipelineResult(
        transcriptName,
        contentHash,
        settings.ruleSetVersion(),
        segments,
        segmentStatistics,
        reconstruction,
        cleaning,
        extraction,
        chunking,
        tracker.elapsedMs());
  }

  private static String errorType(RuntimeException e) {
    if (e instanceof KnowledgePipelineException) {
      return ((KnowledgePipelineException) e).getKind().name();
    }
    return e.getClass().getSimpleName();
  }

  private static String stripExtension(String name) {
    return name.replaceAll("\\.[^.]+$", "");
  }
}
