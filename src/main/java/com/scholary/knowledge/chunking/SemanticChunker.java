package com.scholary.knowledge.chunking;

import com.scholary.knowledge.extraction.Importance;
import com.scholary.knowledge.extraction.KnowledgeObject;
import com.scholary.knowledge.transcript.CodePoints;
import com.scholary.knowledge.transcript.TimestampRange;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups consecutive knowledge objects into retrieval chunks.
 *
 * <p>Greedy and order-preserving: objects accumulate while the joined text stays within the
 * budget. An object that alone exceeds the budget becomes its own chunk and is never split.
 */
public class SemanticChunker {

  private static final Logger LOGGER = LoggerFactory.getLogger(SemanticChunker.class);

  public static final String SEPARATOR = "\n";
  public static final int DEFAULT_MAX_CHUNK_CHARS = 1000;

  static final String GENERAL_TOPIC = "General";
  private static final int SMALL_CHUNK_LIMIT = 400;
  private static final int MEDIUM_CHUNK_LIMIT = 700;

  private final List<String> keywordTerms;
  private final String language;

  public SemanticChunker(List<String> keywordTerms, String language) {
    this.keywordTerms = keywordTerms == null ? List.of() : List.copyOf(keywordTerms);
    this.language = language;
  }

  public ChunkingResult chunk(List<KnowledgeObject> knowledge, int maxChunkChars) {
    if (maxChunkChars <= 0) {
      throw new IllegalArgumentException("Chunk budget must be positive: " + maxChunkChars);
    }

    List<List<KnowledgeObject>> groups = group(knowledge, maxChunkChars);
    List<String> topics = groups.stream().map(SemanticChunker::topic).toList();

    List<Chunk> chunks = new ArrayList<>(groups.size());
    for (int i = 0; i < groups.size(); i++) {
      List<KnowledgeObject> members = groups.get(i);
      String text =
          members.stream().map(k -> k.content().main()).collect(Collectors.joining(SEPARATOR));
      String before = i > 0 ? topics.get(i - 1) : null;
      String after = i < groups.size() - 1 ? topics.get(i + 1) : null;
      chunks.add(
          new Chunk(
              String.format("chunk_%03d", i + 1),
              members,
              text,
              metadata(members, text, topics.get(i), before, after)));
    }

    ChunkingResult.Stats stats = stats(chunks, knowledge.size(), maxChunkChars);
    LOGGER.info(
        "Created {} chunks from {} knowledge objects ({} oversized)",
        stats.totalChunks(),
        stats.totalKnowledge(),
        stats.oversizedChunks());
    return new ChunkingResult(List.copyOf(chunks), stats);
  }

  private static List<List<KnowledgeObject>> group(
      List<KnowledgeObject> knowledge, int maxChunkChars) {
    int separatorLength = CodePoints.length(SEPARATOR);
    List<List<KnowledgeObject>> groups = new ArrayList<>();
    List<KnowledgeObject> current = new ArrayList<>();
    int currentLength = 0;

    for (KnowledgeObject object : knowledge) {
      int length = CodePoints.length(object.content().main());
      if (!current.isEmpty() && currentLength + separatorLength + length > maxChunkChars) {
        groups.add(current);
        current = new ArrayList<>();
        currentLength = 0;
      }
      currentLength = current.isEmpty() ? length : currentLength + separatorLength + length;
      current.add(object);
    }
    if (!current.isEmpty()) {
      groups.add(current);
    }
    return groups;
  }

  /**
   * Most frequent concept across members, each member counted once per concept, ties to the
   * concept seen first. Without concepts, the first specific member topic.
   */
  static String topic(List<KnowledgeObject> members) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (KnowledgeObject member : members) {
      for (String concept : new LinkedHashSet<>(member.entities().concepts())) {
        counts.merge(concept, 1, Integer::sum);
      }
    }

    String best = null;
    int bestCount = 0;
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > bestCount) {
        best = entry.getKey();
        bestCount = entry.getValue();
      }
    }
    if (best != null) {
      return best;
    }
    return members.stream()
        .map(KnowledgeObject::topic)
        .filter(t -> t != null && !GENERAL_TOPIC.equals(t))
        .findFirst()
        .orElse(GENERAL_TOPIC);
  }

  private ChunkMetadata metadata(
      List<KnowledgeObject> members, String text, String topic, String before, String after) {
    Importance importance = Importance.LOW;
    Set<String> concepts = new LinkedHashSet<>();
    Set<String> keywords = new LinkedHashSet<>();
    Set<Integer> segmentIds = new LinkedHashSet<>();
    for (KnowledgeObject member : members) {
      importance = Importance.max(importance, member.importance());
      concepts.addAll(member.entities().concepts());
      keywords.addAll(member.entities().people());
      keywords.addAll(member.entities().concepts());
      keywords.addAll(member.entities().organizations());
      segmentIds.addAll(member.segmentIds());
    }
    keywordTerms.stream().filter(text::contains).forEach(keywords::add);

    return new ChunkMetadata(
        members.stream()
            .map(KnowledgeObject::timestamp)
            .reduce(TimestampRange::spanning)
            .orElseThrow(),
        topic,
        importance,
        new ArrayList<>(concepts),
        new ArrayList<>(keywords),
        new ArrayList<>(segmentIds),
        before,
        after,
        language);
  }

  private static ChunkingResult.Stats stats(
      List<Chunk> chunks, int totalKnowledge, int maxChunkChars) {
    int small = 0;
    int medium = 0;
    int large = 0;
    int oversized = 0;
    long totalSize = 0;
    Map<String, Integer> byImportance = new LinkedHashMap<>();

    for (Chunk chunk : chunks) {
      int size = chunk.size();
      totalSize += size;
      if (size > maxChunkChars) {
        oversized++;
      }
      if (size < SMALL_CHUNK_LIMIT) {
        small++;
      } else if (size < MEDIUM_CHUNK_LIMIT) {
        medium++;
      } else {
        large++;
      }
      byImportance.merge(chunk.metadata().importance().label(), 1, Integer::sum);
    }

    double average = chunks.isEmpty() ? 0.0 : (double) totalSize / chunks.size();
    return new ChunkingResult.Stats(
        chunks.size(),
        totalKnowledge,
        average,
        oversized,
        new ChunkingResult.SizeDistribution(small, medium, large),
        byImportance);
  }
}
