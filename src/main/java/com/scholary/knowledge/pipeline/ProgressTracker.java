package com.scholary.knowledge.pipeline;

import com.scholary.knowledge.logging.PipelineEventLogger;

/** Tracks one run: the current stage, elapsed time, and listener notifications. */
class ProgressTracker {

  private final PipelineProgressListener listener;
  private final PipelineEventLogger eventLogger;
  private final long startedAt;
  private PipelineStage currentStage = PipelineStage.PARSE;
  private long stageStartedAt;

  ProgressTracker(PipelineProgressListener listener, PipelineEventLogger eventLogger) {
    this.listener = listener;
    this.eventLogger = eventLogger;
    this.startedAt = System.currentTimeMillis();
    this.stageStartedAt = startedAt;
  }

  void start(PipelineStage stage, String message) {
    currentStage = stage;
    stageStartedAt = System.currentTimeMillis();
    eventLogger.logStageStarted(stage, message);
    listener.onProgress(
        new StageProgress(stage, false, message, percentage(stage.number() - 1), elapsedMs()));
  }

  void complete(PipelineStage stage, String message, int outputCount) {
    eventLogger.logStageCompleted(stage, outputCount, System.currentTimeMillis() - stageStartedAt);
    listener.onProgress(
        new StageProgress(stage, true, message, percentage(stage.number()), elapsedMs()));
  }

  PipelineStage currentStage() {
    return currentStage;
  }

  long elapsedMs() {
    return System.currentTimeMillis() - startedAt;
  }

  private static int percentage(int stagesDone) {
    return stagesDone * 100 / PipelineStage.count();
  }
}
