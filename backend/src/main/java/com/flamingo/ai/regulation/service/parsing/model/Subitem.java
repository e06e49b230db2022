package com.flamingo.ai.regulation.service.parsing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Subdivision of an item ("목"), enumerated {@code 가.}, {@code 나.}, ... */
public record Subitem(
    @JsonProperty("subitem_symbol") String subitemSymbol,
    @JsonProperty("subitem_text") String subitemText,
    @JsonProperty("subsubitems") List<SubSubitem> subsubitems) {

  public Subitem {
    subsubitems = List.copyOf(subsubitems);
  }
}
