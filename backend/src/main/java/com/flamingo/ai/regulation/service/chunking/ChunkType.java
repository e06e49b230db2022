package com.flamingo.ai.regulation.service.chunking;

import com.fasterxml.jackson.annotation.JsonValue;

/** Granularity of a {@link RegulationChunk}. */
public enum ChunkType {
  ARTICLE("article"),
  PARAGRAPH("paragraph");

  private final String value;

  ChunkType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
