package com.flamingo.ai.regulation.service.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EnumeratorSymbols Tests")
class EnumeratorSymbolsTest {

  @Nested
  @DisplayName("paragraph glyphs")
  class ParagraphGlyphs {

    @Test
    @DisplayName("should list 35 glyphs from ① to ㉟ in order")
    void shouldListThirtyFiveGlyphs() {
      List<String> symbols = EnumeratorSymbols.paragraphSymbols();

      assertThat(symbols).hasSize(35);
      assertThat(symbols.get(0)).isEqualTo("①");
      assertThat(symbols.get(19)).isEqualTo("⑳");
      assertThat(symbols.get(20)).isEqualTo("㉑");
      assertThat(symbols.get(34)).isEqualTo("㉟");
    }

    @Test
    @DisplayName("should map every glyph to its position")
    void shouldMapEveryGlyphToItsPosition() {
      List<String> symbols = EnumeratorSymbols.paragraphSymbols();

      for (int i = 0; i < symbols.size(); i++) {
        assertThat(EnumeratorSymbols.paragraphOrdinal(symbols.get(i))).isEqualTo(i + 1);
        assertThat(EnumeratorSymbols.isParagraphGlyph(symbols.get(i).charAt(0))).isTrue();
      }
    }

    @Test
    @DisplayName("should map the empty symbol of a virtual paragraph to 0")
    void shouldMapEmptySymbolToZero() {
      assertThat(EnumeratorSymbols.paragraphOrdinal("")).isZero();
      assertThat(EnumeratorSymbols.paragraphOrdinal(null)).isZero();
    }

    @Test
    @DisplayName("should not treat the interpunct or digits as paragraph glyphs")
    void shouldRejectInterpunct() {
      assertThat(EnumeratorSymbols.isParagraphGlyph('ㆍ')).isFalse();
      assertThat(EnumeratorSymbols.isParagraphGlyph('1')).isFalse();
      assertThat(EnumeratorSymbols.paragraphOrdinal("ㆍ")).isZero();
      assertThat(EnumeratorSymbols.paragraphOrdinal("1")).isZero();
    }
  }

  @Nested
  @DisplayName("subitem tokens")
  class SubitemTokens {

    @Test
    @DisplayName("should list ten tokens from 가. to 차.")
    void shouldListTenTokens() {
      assertThat(EnumeratorSymbols.subitemTokens())
          .containsExactly("가.", "나.", "다.", "라.", "마.", "바.", "사.", "아.", "자.", "차.");
    }

    @Test
    @DisplayName("should find a leading token only at the start of a line")
    void shouldFindLeadingToken() {
      assertThat(EnumeratorSymbols.leadingSubitemToken("가. 예외없음")).isEqualTo("가.");
      assertThat(EnumeratorSymbols.leadingSubitemToken("차.기타")).isEqualTo("차.");
      assertThat(EnumeratorSymbols.leadingSubitemToken("카. 기타")).isNull();
      assertThat(EnumeratorSymbols.leadingSubitemToken("가 나.")).isNull();
    }

    @Test
    @DisplayName("should number tokens with or without the trailing period")
    void shouldNumberTokens() {
      assertThat(EnumeratorSymbols.subitemOrdinal("가")).isEqualTo(1);
      assertThat(EnumeratorSymbols.subitemOrdinal("다.")).isEqualTo(3);
      assertThat(EnumeratorSymbols.subitemOrdinal("차.")).isEqualTo(10);
      assertThat(EnumeratorSymbols.subitemOrdinal("카")).isZero();
    }
  }
}
