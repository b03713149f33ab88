package com.scholary.knowledge.error;

import java.nio.file.Path;

/** Thrown when the subtitle file to parse does not exist. */
public class TranscriptNotFoundException extends KnowledgePipelineException {

  private final Path path;

  public TranscriptNotFoundException(Path path) {
    super(ErrorKind.NOT_FOUND, "Transcript file not found: " + path);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
