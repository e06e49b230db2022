package com.flamingo.ai.regulation.service.parsing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Subdivision of a paragraph ("호"), enumerated {@code 1.}, {@code 2.}, ... */
public record Item(
    @JsonProperty("item_symbol") String itemSymbol,
    @JsonProperty("item_text") String itemText,
    @JsonProperty("subitems") List<Subitem> subitems) {

  public Item {
    subitems = List.copyOf(subitems);
  }
}
