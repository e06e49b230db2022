package com.flamingo.ai.regulation.service.parsing;

/**
 * Tagged result of {@link EnumeratorClassifier#classify(String)}.
 *
 * @param kind which rule matched
 * @param symbol enumerator as it should appear in the tree ({@code ①}, {@code 1}, {@code 가},
 *     {@code 1}); empty for free text
 * @param content remaining text after the enumerator, trimmed; the whole segment for free text
 */
public record LineClassification(LineKind kind, String symbol, String content) {

  public static LineClassification freeText(String content) {
    return new LineClassification(LineKind.FREE_TEXT, "", content);
  }

  public boolean isEnumerator() {
    return kind != LineKind.FREE_TEXT;
  }
}
