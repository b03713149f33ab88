package com.scholary.knowledge.cleaning;

/**
 * Folds full-width Latin letters and digits to ASCII and the ideographic space to a plain space.
 * Everything else, including full-width punctuation, passes through unchanged.
 */
public final class CharacterNormalizer {

  private static final int FULL_WIDTH_OFFSET = 0xFEE0;

  private CharacterNormalizer() {}

  public static String normalize(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    StringBuilder result = new StringBuilder(text.length());
    text.codePoints().map(CharacterNormalizer::fold).forEach(result::appendCodePoint);
    return result.toString();
  }

  private static int fold(int codePoint) {
    if ((codePoint >= 'Ａ' && codePoint <= 'Ｚ')
        || (codePoint >= 'ａ' && codePoint <= 'ｚ')
        || (codePoint >= '０' && codePoint <= '９')) {
      return codePoint - FULL_WIDTH_OFFSET;
    }
    if (codePoint == '　') {
      return ' ';
    }
    return codePoint;
  }
}
