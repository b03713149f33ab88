package com.scholary.knowledge.extraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Pattern and vocabulary driven entity extraction. */
public class EntityExtractor {

  private static final String NAME_TOKEN = "[\\p{IsHan}\\p{IsKatakana}ー]{1,6}";
  private static final String NUMERAL = "[0-9]+(?:,[0-9]{3})*";

  private final EntityRules rules;
  private final Pattern person;
  private final Pattern age;
  private final Pattern number;

  public EntityExtractor(EntityRules rules) {
    this.rules = rules;
    this.person =
        rules.honorifics().isEmpty()
            ? null
            : Pattern.compile(NAME_TOKEN + "(?:" + alternation(rules.honorifics()) + ")");
    this.age = Pattern.compile("(?<![0-9])([0-9]{1,3})" + Pattern.quote(rules.ageCounter()));
    this.number = numberPattern(rules.magnitudeTokens(), rules.currencyTokens());
  }

  public Entities extract(String text) {
    if (text == null || text.isEmpty()) {
      return Entities.empty();
    }
    return new Entities(
        people(text),
        vocabulary(text, rules.concepts()),
        vocabulary(text, rules.organizations()),
        ages(text),
        numbers(text));
  }

  private List<String> people(String text) {
    if (person == null) {
      return List.of();
    }
    Set<String> found = new LinkedHashSet<>();
    Matcher matcher = person.matcher(text);
    while (matcher.find()) {
      if (!excluded(text, matcher)) {
        found.add(matcher.group());
      }
    }
    return new ArrayList<>(found);
  }

  /**
   * An excluded form covers the match when it ends where the match ends and starts at or before
   * it, so {@code お客様} also rules out the {@code 客様} the name token picks up.
   */
  private boolean excluded(String text, Matcher matcher) {
    for (String name : rules.excludedPeople()) {
      int start = matcher.end() - name.length();
      if (start >= 0 && start <= matcher.start() && text.startsWith(name, start)) {
        return true;
      }
    }
    return false;
  }

  private static List<String> vocabulary(String text, List<String> terms) {
    // first index -> terms starting there, in vocabulary order
    Map<Integer, List<String>> byPosition = new TreeMap<>();
    for (String term : new LinkedHashSet<>(terms)) {
      int index = text.indexOf(term);
      if (index >= 0) {
        byPosition.computeIfAbsent(index, i -> new ArrayList<>()).add(term);
      }
    }
    return byPosition.values().stream().flatMap(List::stream).toList();
  }

  private List<Integer> ages(String text) {
    Set<Integer> found = new LinkedHashSet<>();
    Matcher matcher = age.matcher(text);
    while (matcher.find()) {
      found.add(Integer.parseInt(matcher.group(1)));
    }
    return new ArrayList<>(found);
  }

  private List<String> numbers(String text) {
    if (number == null) {
      return List.of();
    }
    Set<String> found = new LinkedHashSet<>();
    Matcher matcher = number.matcher(text);
    while (matcher.find()) {
      found.add(matcher.group());
    }
    return new ArrayList<>(found);
  }

  private static Pattern numberPattern(List<String> magnitudes, List<String> currencies) {
    List<String> branches = new ArrayList<>();
    if (!magnitudes.isEmpty()) {
      branches.add(NUMERAL + "(?:" + alternation(magnitudes) + ")");
    }
    if (!currencies.isEmpty()) {
      branches.add(NUMERAL + "(?:" + alternation(currencies) + ")");
    }
    return branches.isEmpty() ? null : Pattern.compile(String.join("|", branches));
  }

  private static String alternation(List<String> tokens) {
    return tokens.stream()
        .sorted(Comparator.comparingInt(String::length).reversed())
        .map(Pattern::quote)
        .collect(Collectors.joining("|"));
  }
}
