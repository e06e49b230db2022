package com.flamingo.ai.regulation.service.chunking;

import com.flamingo.ai.regulation.service.parsing.EnumeratorSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stable chunk identifiers derived from the document tree.
 *
 * <p>Both the chunker and the ground-truth tooling key on these ids, so the derivation lives in
 * one place and is pure.
 */
public final class ChunkIdentifiers {

  private static final Pattern DIGITS = Pattern.compile("[0-9]+");

  private ChunkIdentifiers() {}

  /**
   * Numeric part of an article number: {@code 6조 -> 6}, {@code 6조의2 -> 6-2}, {@code 6조의2의3 ->
   * 6-2-3}. An article number without digits (the implicit leading article) yields {@code 0}.
   */
  public static String articleNumberDigits(String articleNumber) {
    List<String> runs = new ArrayList<>();
    Matcher matcher = DIGITS.matcher(articleNumber == null ? "" : articleNumber);
    while (matcher.find()) {
      runs.add(matcher.group());
    }
    return runs.isEmpty() ? "0" : String.join("-", runs);
  }

  /**
   * Canonical numeral of a paragraph symbol: 1..35 for ① .. ㉟, 0 for the empty symbol of a
   * virtual paragraph.
   */
  public static int paragraphOrdinal(String paragraphSymbol) {
    return EnumeratorSymbols.paragraphOrdinal(paragraphSymbol);
  }

  /** {@code {documentId}.{articleDigits}} */
  public static String articleChunkId(String documentId, String articleNumber) {
    return documentId + "." + articleNumberDigits(articleNumber);
  }

  /** {@code {documentId}.{articleDigits}.{paragraphOrdinal}} */
  public static String paragraphChunkId(
      String documentId, String articleNumber, String paragraphSymbol) {
    return articleChunkId(documentId, articleNumber) + "." + paragraphOrdinal(paragraphSymbol);
  }
}
