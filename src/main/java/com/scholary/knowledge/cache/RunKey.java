package com.scholary.knowledge.cache;

/**
 * Identity of one pipeline run: which transcript, what it contained, and which rules and options
 * processed it.
 *
 * @param transcriptName transcript name, usually its file name
 * @param contentHash SHA-256 of the transcript text
 * @param ruleSetVersion version of the rule set in use
 * @param optionsFingerprint hash of the stage options in use
 */
public record RunKey(
    String transcriptName, String contentHash, String ruleSetVersion, int optionsFingerprint) {

  public RunKey {
    if (transcriptName == null || transcriptName.isBlank()) {
      throw new IllegalArgumentException("Transcript name cannot be blank");
    }
  }

  /** Name the first input that differs from an earlier run of the same transcript. */
  public String changeFrom(RunKey earlier) {
    if (!contentHash.equals(earlier.contentHash)) {
      return "content";
    }
    if (!ruleSetVersion.equals(earlier.ruleSetVersion)) {
      return "rule set " + earlier.ruleSetVersion + " -> " + ruleSetVersion;
    }
    if (optionsFingerprint != earlier.optionsFingerprint) {
      return "options";
    }
    return "nothing";
  }

  public String describe() {
    return String.format(
        "%s:%s:%s:%08x", transcriptName, contentHash, ruleSetVersion, optionsFingerprint);
  }
}
