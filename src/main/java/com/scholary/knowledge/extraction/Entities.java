package com.scholary.knowledge.extraction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/** Named things found in a passage, each list deduplicated in order of first appearance. */
public record Entities(
    List<String> people,
    List<String> concepts,
    List<String> organizations,
    List<Integer> ages,
    List<String> numbers) {

  public Entities {
    people = people == null ? List.of() : List.copyOf(people);
    concepts = concepts == null ? List.of() : List.copyOf(concepts);
    organizations = organizations == null ? List.of() : List.copyOf(organizations);
    ages = ages == null ? List.of() : List.copyOf(ages);
    numbers = numbers == null ? List.of() : List.copyOf(numbers);
  }

  public static Entities empty() {
    return new Entities(List.of(), List.of(), List.of(), List.of(), List.of());
  }

  @JsonIgnore
  public boolean isEmpty() {
    return people.isEmpty()
        && concepts.isEmpty()
        && organizations.isEmpty()
        && ages.isEmpty()
        && numbers.isEmpty();
  }
}
