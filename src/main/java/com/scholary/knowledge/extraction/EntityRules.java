package com.scholary.knowledge.extraction;

import java.util.List;

/**
 * Vocabularies and tokens driving entity extraction.
 *
 * @param honorifics suffixes that mark the preceding token as a person's name
 * @param excludedPeople honorific forms that address groups rather than people, e.g. 皆さん
 * @param concepts fixed concept vocabulary
 * @param organizations fixed organization vocabulary
 * @param ageCounter counter that follows an age numeral
 * @param magnitudeTokens tokens that follow a large number, e.g. 万
 * @param currencyTokens tokens that follow an amount of money, e.g. 円
 */
public record EntityRules(
    List<String> honorifics,
    List<String> excludedPeople,
    List<String> concepts,
    List<String> organizations,
    String ageCounter,
    List<String> magnitudeTokens,
    List<String> currencyTokens) {

  public EntityRules {
    honorifics = honorifics == null ? List.of() : List.copyOf(honorifics);
    excludedPeople = excludedPeople == null ? List.of() : List.copyOf(excludedPeople);
    concepts = concepts == null ? List.of() : List.copyOf(concepts);
    organizations = organizations == null ? List.of() : List.copyOf(organizations);
    magnitudeTokens = magnitudeTokens == null ? List.of() : List.copyOf(magnitudeTokens);
    currencyTokens = currencyTokens == null ? List.of() : List.copyOf(currencyTokens);
    if (ageCounter == null || ageCounter.isBlank()) {
      throw new IllegalArgumentException("Age counter cannot be blank");
    }
  }
}
