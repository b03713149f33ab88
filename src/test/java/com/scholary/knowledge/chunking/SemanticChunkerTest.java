package com.scholary.knowledge.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.knowledge.extraction.Entities;
import com.scholary.knowledge.extraction.Importance;
import com.scholary.knowledge.extraction.KnowledgeContent;
import com.scholary.knowledge.extraction.KnowledgeObject;
import com.scholary.knowledge.extraction.KnowledgeType;
import com.scholary.knowledge.transcript.SubtitleTimestamp;
import com.scholary.knowledge.transcript.TimestampRange;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SemanticChunkerTest {

  private SemanticChunker chunker;

  @BeforeEach
  void setUp() {
    chunker = new SemanticChunker(List.of("人生", "仕事"), "ja");
  }

  @Test
  void chunk_shouldAccumulateWhileWithinBudget() {
    List<KnowledgeObject> knowledge =
        List.of(knowledge(1, "aaaa"), knowledge(2, "bbbb"), knowledge(3, "cc"));

    ChunkingResult result = chunker.chunk(knowledge, 10);

    assertThat(result.chunks()).hasSize(2);
    assertThat(result.chunks().get(0).text()).isEqualTo("aaaa\nbbbb");
    assertThat(result.chunks().get(0).knowledgeIds()).containsExactly("k001", "k002");
    assertThat(result.chunks().get(1).text()).isEqualTo("cc");
    assertThat(result.chunks())
        .extracting(Chunk::chunkId)
        .containsExactly("chunk_001", "chunk_002");
  }

  @Test
  void chunk_shouldFillBudgetExactly() {
    List<KnowledgeObject> knowledge = List.of(knowledge(1, "aaaa"), knowledge(2, "bbbbb"));

    assertThat(chunker.chunk(knowledge, 10).chunks()).hasSize(1);
  }

  @Test
  void chunk_shouldKeepOversizedObjectWhole() {
    String longText = "x".repeat(25);
    List<KnowledgeObject> knowledge =
        List.of(knowledge(1, "aa"), knowledge(2, longText), knowledge(3, "bb"));

    ChunkingResult result = chunker.chunk(knowledge, 10);

    assertThat(result.chunks()).extracting(Chunk::text).containsExactly("aa", longText, "bb");
    assertThat(result.stats().oversizedChunks()).isEqualTo(1);
    assertThat(ChunkValidator.validate(result.chunks(), 10).valid()).isTrue();
  }

  @Test
  void chunk_shouldPlaceEveryObjectOnceInOrder() {
    List<KnowledgeObject> knowledge = new ArrayList<>();
    for (int i = 1; i <= 30; i++) {
      knowledge.add(knowledge(i, "文".repeat(i % 7 + 3)));
    }

    ChunkingResult result = chunker.chunk(knowledge, 20);

    List<KnowledgeObject> placed =
        result.chunks().stream().flatMap(c -> c.knowledge().stream()).toList();
    assertThat(placed).containsExactlyElementsOf(knowledge);
    for (Chunk chunk : result.chunks()) {
      int memberChars = chunk.knowledge().stream().mapToInt(k -> k.content().main().length()).sum();
      assertThat(chunk.text().length()).isEqualTo(memberChars + chunk.knowledge().size() - 1);
      assertThat(chunk.size()).isLessThanOrEqualTo(20);
    }
    assertThat(result.stats().totalKnowledge()).isEqualTo(30);
  }

  @Test
  void chunk_shouldPickMostFrequentConceptAsTopicWithFirstSeenTieBreak() {
    List<KnowledgeObject> knowledge =
        List.of(
            knowledge(1, "a", List.of("信用", "信用"), "General", Importance.LOW),
            knowledge(2, "b", List.of("誠実", "信用"), "General", Importance.LOW),
            knowledge(3, "c", List.of("誠実"), "General", Importance.LOW));

    Chunk chunk = chunker.chunk(knowledge, 1000).chunks().get(0);

    assertThat(chunk.metadata().topic()).isEqualTo("信用");
    assertThat(chunk.metadata().concepts()).containsExactly("信用", "誠実");
  }

  @Test
  void chunk_shouldFallBackToMemberTopicThenGeneral() {
    List<KnowledgeObject> withTopic =
        List.of(
            knowledge(1, "a", List.of(), "General", Importance.LOW),
            knowledge(2, "b", List.of(), "仕事", Importance.LOW));
    List<KnowledgeObject> withoutTopic =
        List.of(knowledge(1, "a", List.of(), "General", Importance.LOW));

    assertThat(chunker.chunk(withTopic, 1000).chunks().get(0).metadata().topic())
        .isEqualTo("仕事");
    assertThat(chunker.chunk(withoutTopic, 1000).chunks().get(0).metadata().topic())
        .isEqualTo("General");
  }

  @Test
  void chunk_shouldBuildMetadataFromMembersAndNeighbours() {
    List<KnowledgeObject> knowledge =
        List.of(
            knowledge(1, "人生の話", List.of("価値観"), "人生", Importance.LOW),
            knowledge(2, "仕事の話", List.of(), "仕事", Importance.HIGH),
            knowledge(3, "x".repeat(8), List.of("信用"), "General", Importance.MEDIUM));

    List<Chunk> chunks = chunker.chunk(knowledge, 10).chunks();

    assertThat(chunks).hasSize(2);
    ChunkMetadata first = chunks.get(0).metadata();
    assertThat(first.timestampRange())
        .isEqualTo(new TimestampRange("00:00:01,000", "00:00:02,900"));
    assertThat(first.importance()).isEqualTo(Importance.HIGH);
    assertThat(first.segmentIds()).containsExactly(1, 2);
    assertThat(first.keywords()).containsExactly("価値観", "人生", "仕事");
    assertThat(first.contextBefore()).isNull();
    assertThat(first.contextAfter()).isEqualTo("信用");
    assertThat(first.language()).isEqualTo("ja");
    assertThat(chunks.get(1).metadata().contextBefore()).isEqualTo("価値観");
  }

  @Test
  void chunk_shouldReportStats() {
    List<KnowledgeObject> knowledge =
        List.of(
            knowledge(1, "a".repeat(300), List.of(), "General", Importance.LOW),
            knowledge(2, "b".repeat(500), List.of(), "General", Importance.HIGH),
            knowledge(3, "c".repeat(800), List.of(), "General", Importance.HIGH));

    ChunkingResult.Stats stats = chunker.chunk(knowledge, 700).stats();

    assertThat(stats.totalChunks()).isEqualTo(3);
    assertThat(stats.oversizedChunks()).isEqualTo(1);
    assertThat(stats.sizeDistribution())
        .isEqualTo(new ChunkingResult.SizeDistribution(1, 1, 1));
    assertThat(stats.averageChunkSize()).isEqualTo(1600.0 / 3);
    assertThat(stats.byImportance()).containsEntry("high", 2).containsEntry("low", 1);
  }

  @Test
  void chunk_shouldReturnNothingForNoKnowledge() {
    ChunkingResult result = chunker.chunk(List.of(), 1000);

    assertThat(result.chunks()).isEmpty();
    assertThat(result.stats().averageChunkSize()).isZero();
  }

  @Test
  void chunk_shouldRejectNonPositiveBudget() {
    assertThatThrownBy(() -> chunker.chunk(List.of(), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void validate_shouldFlagEmptyAndOverBudgetChunks() {
    KnowledgeObject a = knowledge(1, "a".repeat(8));
    KnowledgeObject b = knowledge(2, "b".repeat(8));
    ChunkMetadata metadata =
        new ChunkMetadata(
            a.timestamp(), "", Importance.LOW, null, null, null, null, null, "ja");
    List<Chunk> chunks =
        List.of(
            new Chunk("chunk_001", List.of(a, b), "a".repeat(8) + "\n" + "b".repeat(8), metadata),
            new Chunk("chunk_002", List.of(), "", metadata));

    ChunkValidator.Validation validation = ChunkValidator.validate(chunks, 10);

    assertThat(validation.valid()).isFalse();
    assertThat(validation.issues())
        .anyMatch(issue -> issue.contains("chunk_001") && issue.contains("exceeds budget"))
        .anyMatch(issue -> issue.contains("chunk_002") && issue.contains("no knowledge"))
        .anyMatch(issue -> issue.contains("no topic"));
  }

  @Test
  void chunk_shouldSpanEarliestStartToLatestEndWhenMembersRunBackwards() {
    KnowledgeObject later =
        knowledge(1, "一つ。", List.of(), "General", Importance.LOW, 5000, 6000);
    KnowledgeObject earlier =
        knowledge(2, "二つ。", List.of(), "General", Importance.LOW, 1000, 2000);

    ChunkingResult result = chunker.chunk(List.of(later, earlier), 700);

    assertThat(result.chunks()).hasSize(1);
    assertThat(result.chunks().get(0).metadata().timestampRange())
        .isEqualTo(new TimestampRange("00:00:01,000", "00:00:06,000"));
  }

  private static KnowledgeObject knowledge(int id, String text) {
    return knowledge(id, text, List.of(), "General", Importance.LOW);
  }

  private static KnowledgeObject knowledge(
      int id, String text, List<String> concepts, String topic, Importance importance) {
    long start = id * 1000L;
    return knowledge(id, text, concepts, topic, importance, start, start + 900);
  }

  private static KnowledgeObject knowledge(
      int id,
      String text,
      List<String> concepts,
      String topic,
      Importance importance,
      long startMs,
      long endMs) {
    return new KnowledgeObject(
        String.format("k%03d", id),
        id,
        topic,
        KnowledgeType.GENERAL,
        new KnowledgeContent(text, List.of(), List.of(), text),
        new Entities(null, concepts, null, null, null),
        new TimestampRange(
            SubtitleTimestamp.format(startMs), SubtitleTimestamp.format(endMs)),
        importance,
        List.of(id));
  }
}
