package com.scholary.knowledge.reconstruct;

/** Why the accumulator closed a sentence before the next segment. */
public enum SplitReason {
  NONE,
  SENTENCE_ENDING,
  SILENCE_GAP
}
