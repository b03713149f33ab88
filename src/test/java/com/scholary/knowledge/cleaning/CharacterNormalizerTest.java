package com.scholary.knowledge.cleaning;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CharacterNormalizerTest {

  @Test
  void normalize_shouldFoldFullWidthAlphanumerics() {
    assertThat(CharacterNormalizer.normalize("ＡＢＣｘｙｚ０１２３")).isEqualTo("ABCxyz0123");
  }

  @Test
  void normalize_shouldReplaceIdeographicSpace() {
    assertThat(CharacterNormalizer.normalize("青木さん　です")).isEqualTo("青木さん です");
  }

  @Test
  void normalize_shouldLeaveOtherCharactersAlone() {
    String text = "価値観は「誠実」！？、。ｶﾀｶﾅ";

    assertThat(CharacterNormalizer.normalize(text)).isEqualTo(text);
  }

  @Test
  void normalize_shouldBeIdempotent() {
    String once = CharacterNormalizer.normalize("２９歳でＢＩＢＬＥと　出会った");

    assertThat(CharacterNormalizer.normalize(once)).isEqualTo(once);
    assertThat(once).isEqualTo("29歳でBIBLEと 出会った");
  }
}
