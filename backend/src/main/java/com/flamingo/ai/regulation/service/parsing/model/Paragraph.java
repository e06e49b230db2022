package com.flamingo.ai.regulation.service.parsing.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * First-level subdivision of an article ("항").
 *
 * @param paragraphSymbol circled numeral glyph, or empty for a virtual paragraph
 * @param paragraphText body text
 * @param items items in source order
 */
public record Paragraph(
    @JsonProperty("paragraph_symbol") String paragraphSymbol,
    @JsonProperty("paragraph_text") String paragraphText,
    @JsonProperty("items") List<Item> items) {

  public Paragraph {
    items = List.copyOf(items);
  }

  /** Returns {@code true} if this paragraph was synthesized to hold items without a glyph. */
  @JsonIgnore
  public boolean isVirtual() {
    return paragraphSymbol.isEmpty();
  }
}
