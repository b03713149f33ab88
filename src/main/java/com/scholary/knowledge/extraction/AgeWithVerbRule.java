package com.scholary.knowledge.extraction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Matches a life event: an age and an experiential verb in the same sentence, as in {@code
 * 29歳でバイブルと出会いました。}.
 */
public final class AgeWithVerbRule implements ClassificationRule {

  private static final Pattern SENTENCE = Pattern.compile("[^。！？!?]+[。！？!?]?");

  private final KnowledgeType type;
  private final String counter;
  private final List<String> verbs;
  private final Pattern age;

  @JsonCreator
  public AgeWithVerbRule(
      @JsonProperty("type") KnowledgeType type,
      @JsonProperty("counter") String counter,
      @JsonProperty("verbs") List<String> verbs) {
    if (type == null) {
      throw new IllegalArgumentException("Rule type is required");
    }
    if (counter == null || counter.isBlank()) {
      throw new IllegalArgumentException("Age counter cannot be blank");
    }
    this.type = type;
    this.counter = counter;
    this.verbs = verbs == null ? List.of() : List.copyOf(verbs);
    this.age = Pattern.compile("(?<![0-9])[0-9]{1,3}" + Pattern.quote(counter));
  }

  @Override
  public KnowledgeType type() {
    return type;
  }

  @JsonProperty("counter")
  public String counter() {
    return counter;
  }

  @JsonProperty("verbs")
  public List<String> verbs() {
    return verbs;
  }

  @Override
  public boolean matches(String text, Entities entities) {
    if (entities.ages().isEmpty()) {
      return false;
    }
    return SENTENCE
        .matcher(text)
        .results()
        .map(m -> m.group())
        .anyMatch(s -> age.matcher(s).find() && verbs.stream().anyMatch(s::contains));
  }
}
