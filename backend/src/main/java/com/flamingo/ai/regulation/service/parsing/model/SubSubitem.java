package com.flamingo.ai.regulation.service.parsing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Leaf subdivision of a subitem, enumerated {@code 1)}, {@code 2)}, ... */
public record SubSubitem(
    @JsonProperty("subsubitem_symbol") String subsubitemSymbol,
    @JsonProperty("subsubitem_text") String subsubitemText) {}
