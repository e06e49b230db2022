package com.flamingo.ai.regulation.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkIdentifiers Tests")
class ChunkIdentifiersTest {

  @Test
  @DisplayName("should reduce article numbers to their digit runs")
  void shouldReduceArticleNumbers() {
    assertThat(ChunkIdentifiers.articleNumberDigits("6조")).isEqualTo("6");
    assertThat(ChunkIdentifiers.articleNumberDigits("6조의2")).isEqualTo("6-2");
    assertThat(ChunkIdentifiers.articleNumberDigits("6조의2의3")).isEqualTo("6-2-3");
    assertThat(ChunkIdentifiers.articleNumberDigits("123조의45")).isEqualTo("123-45");
  }

  @Test
  @DisplayName("should use 0 for the implicit leading article")
  void shouldUseZeroForImplicitArticle() {
    assertThat(ChunkIdentifiers.articleNumberDigits("")).isEqualTo("0");
    assertThat(ChunkIdentifiers.articleNumberDigits(null)).isEqualTo("0");
  }

  @Test
  @DisplayName("should number paragraphs by glyph position")
  void shouldNumberParagraphs() {
    assertThat(ChunkIdentifiers.paragraphOrdinal("①")).isEqualTo(1);
    assertThat(ChunkIdentifiers.paragraphOrdinal("⑳")).isEqualTo(20);
    assertThat(ChunkIdentifiers.paragraphOrdinal("㉑")).isEqualTo(21);
    assertThat(ChunkIdentifiers.paragraphOrdinal("")).isZero();
  }

  @Test
  @DisplayName("should build article and paragraph chunk ids")
  void shouldBuildChunkIds() {
    assertThat(ChunkIdentifiers.articleChunkId("1", "6조")).isEqualTo("1.6");
    assertThat(ChunkIdentifiers.paragraphChunkId("1", "6조", "②")).isEqualTo("1.6.2");
    assertThat(ChunkIdentifiers.paragraphChunkId("3", "6조의2", "")).isEqualTo("3.6-2.0");
  }
}
