package com.flamingo.ai.regulation.service.parsing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Top-level numbered unit of a regulation ("조").
 *
 * @param articleNumber number with its article suffix, e.g. {@code 6조} or {@code 6조의2}; empty for
 *     the implicit article holding content seen before the first header
 * @param articleTitle parenthesized title from the header line, possibly empty
 * @param articleText body text not belonging to any paragraph
 * @param paragraphs paragraphs in source order
 */
public record Article(
    @JsonProperty("article_number") String articleNumber,
    @JsonProperty("article_title") String articleTitle,
    @JsonProperty("article_text") String articleText,
    @JsonProperty("paragraphs") List<Paragraph> paragraphs) {

  public Article {
    paragraphs = List.copyOf(paragraphs);
  }
}
