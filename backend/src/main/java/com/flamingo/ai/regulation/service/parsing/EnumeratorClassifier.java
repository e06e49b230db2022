package com.flamingo.ai.regulation.service.parsing;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Decides whether a line segment opens a paragraph, item, subitem or sub-subitem.
 *
 * <p>Rules are tried in fixed order and the first match wins:
 *
 * <ol>
 *   <li>paragraph: first character is one of the 35 circled numerals
 *   <li>item: ASCII digits immediately followed by {@code .}
 *   <li>subitem: one of the ten tokens {@code 가.} .. {@code 차.}
 *   <li>sub-subitem: ASCII digits immediately followed by {@code )}
 * </ol>
 *
 * <p>Stateless; safe to share.
 */
@Component
public class EnumeratorClassifier {

  private static final Pattern ITEM = Pattern.compile("^([0-9]+)\\.\\s*(.*)$");
  private static final Pattern SUB_SUBITEM = Pattern.compile("^([0-9]+)\\)\\s*(.*)$");

  /**
   * Classifies a trimmed segment.
   *
   * @param segment trimmed, non-null text
   * @return the matched enumerator, or {@link LineKind#FREE_TEXT}
   */
  public LineClassification classify(String segment) {
    if (segment.isEmpty()) {
      return LineClassification.freeText(segment);
    }

    char first = segment.charAt(0);
    if (EnumeratorSymbols.isParagraphGlyph(first)) {
      return new LineClassification(
          LineKind.PARAGRAPH, String.valueOf(first), segment.substring(1).trim());
    }

    Matcher item = ITEM.matcher(segment);
    if (item.matches()) {
      return new LineClassification(LineKind.ITEM, item.group(1), item.group(2).trim());
    }

    String subitemToken = EnumeratorSymbols.leadingSubitemToken(segment);
    if (subitemToken != null) {
      return new LineClassification(
          LineKind.SUBITEM,
          subitemToken.substring(0, subitemToken.length() - 1),
          segment.substring(subitemToken.length()).trim());
    }

    Matcher subSubitem = SUB_SUBITEM.matcher(segment);
    if (subSubitem.matches()) {
      return new LineClassification(
          LineKind.SUB_SUBITEM, subSubitem.group(1), subSubitem.group(2).trim());
    }

    return LineClassification.freeText(segment);
  }
}
