package com.scholary.knowledge.logging;

import com.scholary.knowledge.pipeline.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured pipeline events with MDC (Mapped Diagnostic Context).
 *
 * <p>Event fields are set for the duration of one log call and removed afterwards. The transcript
 * context stays in place for a whole run.
 */
public class PipelineEventLogger {

  private final Logger logger;

  public PipelineEventLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(PipelineStage stage, String message) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage.name());
      MDC.put("stageNumber", String.valueOf(stage.number()));

      logger.debug(
          "Stage {}/{} started: {} - {}",
          stage.number(),
          PipelineStage.count(),
          stage.displayName(),
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage completed event. */
  public void logStageCompleted(PipelineStage stage, int outputCount, long elapsedMs) {
    try {
      MDC.put("event_type", "stage_completed");
      MDC.put("stage", stage.name());
      MDC.put("stageNumber", String.valueOf(stage.number()));
      MDC.put("outputCount", String.valueOf(outputCount));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Stage {}/{} completed: {}, output={}, elapsed={}ms",
          stage.number(),
          PipelineStage.count(),
          stage.displayName(),
          outputCount,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage failure event. */
  public void logStageFailed(PipelineStage stage, String errorType, String message) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage.name());
      MDC.put("stageNumber", String.valueOf(stage.number()));
      MDC.put("errorType", errorType);

      logger.error(
          "Stage {}/{} failed: {}, error={}, message={}",
          stage.number(),
          PipelineStage.count(),
          stage.displayName(),
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log pipeline completed event. */
  public void logPipelineCompleted(
      int segments, int paragraphs, int corrections, int knowledge, int chunks, long elapsedMs) {
    try {
      MDC.put("event_type", "pipeline_completed");
      MDC.put("segments", String.valueOf(segments));
      MDC.put("paragraphs", String.valueOf(paragraphs));
      MDC.put("corrections", String.valueOf(corrections));
      MDC.put("knowledge", String.valueOf(knowledge));
      MDC.put("chunks", String.valueOf(chunks));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Pipeline completed: segments={}, paragraphs={}, corrections={}, knowledge={}, "
              + "chunks={}, elapsed={}ms",
          segments,
          paragraphs,
          corrections,
          knowledge,
          chunks,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log cache hit event. */
  public void logCacheHit(String cacheKey) {
    try {
      MDC.put("event_type", "cache_hit");
      logger.info("Reusing cached result: key={}", cacheKey);
    } finally {
      clearEventFields();
    }
  }

  /** Set transcript context in MDC. */
  public static void setTranscriptContext(String transcriptName, String contentHash) {
    MDC.put("transcript", transcriptName);
    MDC.put("contentHash", contentHash);
  }

  /** Clear transcript context from MDC. */
  public static void clearTranscriptContext() {
    MDC.remove("transcript");
    MDC.remove("contentHash");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("stageNumber");
    MDC.remove("outputCount");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("segments");
    MDC.remove("paragraphs");
    MDC.remove("corrections");
    MDC.remove("knowledge");
    MDC.remove("chunks");
  }
}
