package com.scholary.knowledge.extraction;

import java.util.List;

/**
 * The text of a knowledge object and what was pulled out of it.
 *
 * @param main the cleaned passage
 * @param keyTakeaway first quote, else first key statement, else the opening of the passage
 */
public record KnowledgeContent(
    String main, List<String> quotes, List<String> keyStatements, String keyTakeaway) {

  public KnowledgeContent {
    main = main == null ? "" : main;
    quotes = quotes == null ? List.of() : List.copyOf(quotes);
    keyStatements = keyStatements == null ? List.of() : List.copyOf(keyStatements);
  }
}
