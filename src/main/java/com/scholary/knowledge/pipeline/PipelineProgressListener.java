package com.scholary.knowledge.pipeline;

/** Receives stage progress during a run. Called on the thread running the pipeline. */
@FunctionalInterface
public interface PipelineProgressListener {

  PipelineProgressListener NONE = progress -> {};

  void onProgress(StageProgress progress);
}
