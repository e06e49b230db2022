package com.flamingo.ai.regulation.service.parsing;

import java.util.List;

/**
 * Closed inventories of the paragraph and subitem enumerators used in Korean statutes.
 *
 * <p>Paragraphs are numbered with the circled numerals ① to ⑳ (U+2460..U+2473) and ㉑ to ㉟
 * (U+3251..U+325F); subitems with the syllables 가 to 차 followed by a period. Position in each
 * table is the canonical ordinal. The interpunct ㆍ appears inside running text and is not a
 * paragraph glyph.
 */
public final class EnumeratorSymbols {

  private static final String PARAGRAPH_GLYPHS =
      "①②③④⑤⑥⑦⑧⑨⑩⑪⑫⑬⑭⑮⑯⑰⑱⑲⑳㉑㉒㉓㉔㉕㉖㉗㉘㉙㉚㉛㉜㉝㉞㉟";

  private static final List<String> SUBITEM_TOKENS =
      List.of("가.", "나.", "다.", "라.", "마.", "바.", "사.", "아.", "자.", "차.");

  private EnumeratorSymbols() {}

  /** Paragraph glyphs in ordinal order. */
  public static List<String> paragraphSymbols() {
    return PARAGRAPH_GLYPHS.chars().mapToObj(c -> String.valueOf((char) c)).toList();
  }

  /** Subitem tokens (syllable plus period) in ordinal order. */
  public static List<String> subitemTokens() {
    return SUBITEM_TOKENS;
  }

  public static boolean isParagraphGlyph(char c) {
    return PARAGRAPH_GLYPHS.indexOf(c) >= 0;
  }

  /**
   * Maps a paragraph symbol to its 1-based ordinal.
   *
   * @param symbol a single circled numeral, or the empty symbol of a virtual paragraph
   * @return 1..35 for a known glyph; 0 for anything else, including the virtual paragraph
   */
  public static int paragraphOrdinal(String symbol) {
    if (symbol == null || symbol.length() != 1) {
      return 0;
    }
    return PARAGRAPH_GLYPHS.indexOf(symbol.charAt(0)) + 1;
  }

  /**
   * Returns the subitem token the line starts with, or {@code null}.
   *
   * @param line trimmed line
   */
  public static String leadingSubitemToken(String line) {
    for (String token : SUBITEM_TOKENS) {
      if (line.startsWith(token)) {
        return token;
      }
    }
    return null;
  }

  /**
   * Maps a subitem symbol ({@code 가} or {@code 가.}) to its 1-based ordinal, 0 if unknown.
   */
  public static int subitemOrdinal(String symbol) {
    if (symbol == null || symbol.isEmpty()) {
      return 0;
    }
    String token = symbol.endsWith(".") ? symbol : symbol + ".";
    return SUBITEM_TOKENS.indexOf(token) + 1;
  }
}
