package com.scholary.knowledge.error;

/** Coarse classification of pipeline failures, surfaced to callers alongside the message. */
public enum ErrorKind {
  /** The transcript resource could not be located. */
  NOT_FOUND,

  /** A cue block could not be parsed: missing id, bad timestamp arrow, negative duration. */
  MALFORMED_INPUT,

  /** An intermediate record is structurally invalid. */
  VALIDATION_ERROR
}
