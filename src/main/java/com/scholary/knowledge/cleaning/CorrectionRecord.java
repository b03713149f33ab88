package com.scholary.knowledge.cleaning;

/**
 * One applied correction.
 *
 * @param original the matched text
 * @param corrected its replacement
 * @param position code-point offset of the match in the text being corrected
 */
public record CorrectionRecord(String original, String corrected, int position) {}
