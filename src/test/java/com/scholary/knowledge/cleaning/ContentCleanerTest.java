package com.scholary.knowledge.cleaning;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.knowledge.reconstruct.Paragraph;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContentCleanerTest {

  private ContentCleaner cleaner;

  @BeforeEach
  void setUp() {
    cleaner =
        new ContentCleaner(
            new CleaningRules(
                List.of(
                    new CorrectionRule("青木サン?", "青木さん"),
                    new CorrectionRule("警額", "経験")),
                List.of("音楽", "拍手", "笑い", "SE", "BGM"),
                List.of("ま、", "あの、", "えー、", "その、")));
  }

  @Test
  void clean_shouldCorrectStripMarkersAndStandardizePunctuation() {
    CleaningResult result =
        cleaner.clean(List.of(paragraph(1, "青木サの[音楽]話です。。。")), CleaningOptions.defaults());

    CleanedParagraph cleaned = result.cleanedParagraphs().get(0);
    assertThat(cleaned.cleanedText()).isEqualTo("青木さんの話です…");
    assertThat(cleaned.originalText()).isEqualTo("青木サの[音楽]話です。。。");
    assertThat(cleaned.corrections()).hasSize(1);
    assertThat(cleaned.corrections().get(0).original()).isEqualTo("青木サ");
    assertThat(cleaned.corrections().get(0).corrected()).isEqualTo("青木さん");
  }

  @Test
  void clean_shouldPreserveTimingAndSegmentIds() {
    Paragraph paragraph =
        new Paragraph(
            4,
            List.of("本当です。"),
            "本当です。",
            "00:00:10,000",
            "00:00:12,000",
            List.of(7, 8));

    CleanedParagraph cleaned =
        cleaner.clean(List.of(paragraph), CleaningOptions.defaults()).cleanedParagraphs().get(0);

    assertThat(cleaned.paragraphId()).isEqualTo(4);
    assertThat(cleaned.startTime()).isEqualTo("00:00:10,000");
    assertThat(cleaned.endTime()).isEqualTo("00:00:12,000");
    assertThat(cleaned.segmentIds()).containsExactly(7, 8);
  }

  @Test
  void clean_shouldRemoveFullWidthBracketMarkersAndTidyWhitespace() {
    String cleaned =
        cleaner.cleanText("［拍手］ 皆さん [ BGM ] こんにちは 。", CleaningOptions.defaults());

    assertThat(cleaned).isEqualTo("皆さん こんにちは。");
  }

  @Test
  void clean_shouldCollapseRepeatedMarksButLeaveMixedRuns() {
    CleaningOptions options = CleaningOptions.defaults();

    assertThat(cleaner.cleanText("本当！！！", options)).isEqualTo("本当！");
    assertThat(cleaner.cleanText("本当??", options)).isEqualTo("本当?");
    assertThat(cleaner.cleanText("ええ、、そう", options)).isEqualTo("ええ、そう");
    assertThat(cleaner.cleanText("wait...", options)).isEqualTo("wait…");
    assertThat(cleaner.cleanText("本当!?", options)).isEqualTo("本当!?");
    assertThat(cleaner.cleanText("本当!?!", options)).isEqualTo("本当!?!");
  }

  @Test
  void clean_shouldRemoveFillersOnlyWhenEnabled() {
    String text = "ま、あの、大事なことです。";

    assertThat(cleaner.cleanText(text, CleaningOptions.defaults())).isEqualTo(text);
    assertThat(cleaner.cleanText(text, new CleaningOptions(true, true, true, true)))
        .isEqualTo("大事なことです。");
  }

  @Test
  void clean_shouldHonorDisabledSteps() {
    CleaningOptions nothingOptional = new CleaningOptions(false, false, false, false);

    CleaningResult result =
        cleaner.clean(List.of(paragraph(1, "ＡＢ青木サ[音楽]")), nothingOptional);

    assertThat(result.cleanedParagraphs().get(0).cleanedText()).isEqualTo("ＡＢ青木サ[音楽]");
    assertThat(result.corrections()).isEmpty();
  }

  @Test
  void clean_shouldSkipAndCountParagraphsWithoutTextOrTiming() {
    List<Paragraph> paragraphs =
        List.of(
            paragraph(1, "警額を積む。"),
            new Paragraph(2, null, null, "00:00:00,000", "00:00:01,000", null),
            paragraph(3, "普通の文。"),
            new Paragraph(4, null, "本当です。", null, null, List.of(4)),
            new Paragraph(5, null, "本当です。", "00:00:02,000", null, List.of(5)));

    CleaningResult result = cleaner.clean(paragraphs, CleaningOptions.defaults());

    assertThat(result.cleanedParagraphs())
        .extracting(CleanedParagraph::paragraphId)
        .containsExactly(1, 3);
    assertThat(result.stats().paragraphsProcessed()).isEqualTo(2);
    assertThat(result.stats().paragraphsSkipped()).isEqualTo(3);
    assertThat(result.stats().paragraphsCorrected()).isEqualTo(1);
    assertThat(result.stats().totalCorrections()).isEqualTo(1);
  }

  @Test
  void clean_shouldCountUniqueCorrections() {
    CleaningResult result =
        cleaner.clean(
            List.of(paragraph(1, "警額と警額"), paragraph(2, "青木サン")),
            CleaningOptions.defaults());

    assertThat(result.stats().totalCorrections()).isEqualTo(3);
    assertThat(result.stats().uniqueCorrections()).isEqualTo(2);
    assertThat(result.corrections()).hasSize(3);
  }

  private static Paragraph paragraph(int id, String text) {
    return new Paragraph(id, List.of(text), text, "00:00:00,000", "00:00:01,000", List.of(id));
  }
}
