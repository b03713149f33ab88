package com.scholary.knowledge.pipeline;

import com.scholary.knowledge.error.ErrorKind;
import java.nio.file.Path;

/**
 * Outcome of one file in a batch.
 *
 * <p>On failure {@code result} is null and {@code failedStage}, {@code errorKind} and {@code
 * error} describe what went wrong. {@code errorKind} is null for failures outside the pipeline's
 * own taxonomy, such as an unreadable file.
 */
public record BatchItemResult(
    Path file,
    boolean success,
    PipelineResult result,
    PipelineStage failedStage,
    ErrorKind errorKind,
    String error) {

  public static BatchItemResult succeeded(Path file, PipelineResult result) {
    return new BatchItemResult(file, true, result, null, null, null);
  }

  public static BatchItemResult failed(
      Path file, PipelineStage stage, ErrorKind errorKind, String error) {
    return new BatchItemResult(file, false, null, stage, errorKind, error);
  }
}
