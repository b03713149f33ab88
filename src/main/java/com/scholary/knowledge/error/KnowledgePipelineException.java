package com.scholary.knowledge.error;

/**
 * Base exception for pipeline failures.
 *
 * <p>Unchecked: a transcript that fails to parse cannot be repaired by the caller mid-run, so
 * callers that care (batch processing) catch it at the transcript boundary and record the {@link
 * ErrorKind}.
 */
public class KnowledgePipelineException extends RuntimeException {

  private final ErrorKind kind;

  public KnowledgePipelineException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public KnowledgePipelineException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }
}
