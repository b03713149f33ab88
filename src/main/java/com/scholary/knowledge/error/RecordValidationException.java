package com.scholary.knowledge.error;

/** Thrown when an intermediate record handed between stages is structurally invalid. */
public class RecordValidationException extends KnowledgePipelineException {

  public RecordValidationException(String message) {
    super(ErrorKind.VALIDATION_ERROR, message);
  }
}
