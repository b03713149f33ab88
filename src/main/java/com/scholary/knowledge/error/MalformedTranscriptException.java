package com.scholary.knowledge.error;

/**
 * Thrown when a cue block cannot be parsed.
 *
 * <p>Carries the cue id (when one could be read) or the 1-based block number, plus the offending
 * line, so the defect can be located in the source file.
 */
public class MalformedTranscriptException extends KnowledgePipelineException {

  private final int blockNumber;
  private final Integer cueId;
  private final String line;

  public MalformedTranscriptException(String reason, int blockNumber, Integer cueId, String line) {
    super(ErrorKind.MALFORMED_INPUT, describe(reason, blockNumber, cueId, line));
    this.blockNumber = blockNumber;
    this.cueId = cueId;
    this.line = line;
  }

  public MalformedTranscriptException(
      String reason, int blockNumber, Integer cueId, String line, Throwable cause) {
    super(ErrorKind.MALFORMED_INPUT, describe(reason, blockNumber, cueId, line), cause);
    this.blockNumber = blockNumber;
    this.cueId = cueId;
    this.line = line;
  }

  public int getBlockNumber() {
    return blockNumber;
  }

  public Integer getCueId() {
    return cueId;
  }

  public String getLine() {
    return line;
  }

  private static String describe(String reason, int blockNumber, Integer cueId, String line) {
    String location = cueId != null ? "cue " + cueId : "block " + blockNumber;
    return String.format("Malformed subtitle %s: %s (line: '%s')", location, reason, line);
  }
}
