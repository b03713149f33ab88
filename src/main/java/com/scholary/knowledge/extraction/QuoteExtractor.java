package com.scholary.knowledge.extraction;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Pulls quoted speech and key statements out of a passage. */
public class QuoteExtractor {

  private final Pattern quote;
  private final List<Pattern> keyStatements;

  public QuoteExtractor(QuoteRules rules) {
    String open = escape(rules.open());
    String close = escape(rules.close());
    this.quote = Pattern.compile(open + "([^" + open + close + "]+)" + close);
    this.keyStatements = rules.keyStatementPatterns().stream().map(Pattern::compile).toList();
  }

  /** Quoted text, delimiters stripped, left to right. An opening mark with no close is ignored. */
  public List<String> extractQuotes(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    List<String> quotes = new ArrayList<>();
    Matcher matcher = quote.matcher(text);
    while (matcher.find()) {
      quotes.add(matcher.group(1));
    }
    return quotes;
  }

  public List<String> extractKeyStatements(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    Set<String> statements = new LinkedHashSet<>();
    for (Pattern pattern : keyStatements) {
      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        statements.add(matcher.group().trim());
      }
    }
    return new ArrayList<>(statements);
  }

  private static String escape(String mark) {
    return String.format("\\x{%x}", mark.codePointAt(0));
  }
}
