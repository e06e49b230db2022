package com.flamingo.ai.regulation.service.parsing;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Splits a line at enumerators that follow whitespace inside it, so that layouts such as {@code
 * ①의무 1. 전파금지 가. 예외없음} yield one segment per enumerator.
 *
 * <p>A boundary is whitespace followed by a circled numeral, or by a subitem token followed by
 * whitespace, or by an item/sub-subitem token of at most three digits followed by whitespace. A
 * numeric token directly after another numeric token is not a boundary, which keeps dates such as
 * {@code 2024. 7. 11.} in one piece. Digits glued to what follows ({@code 3.5%}) never split.
 */
@Component
public class InlineEnumeratorSplitter {

  private static final Pattern BOUNDARY =
      Pattern.compile(
          "(?<!\\s)\\s+(?=[\\u2460-\\u2473\\u3251-\\u325F]|[가나다라마바사아자차]\\.\\s)"
              + "|(?<![0-9][.)])(?<!\\s)\\s+(?=[0-9]{1,3}[.)]\\s)");

  /**
   * Splits a trimmed line into trimmed, non-empty segments in source order.
   *
   * @param line trimmed line
   * @return segments; a single element when no boundary is present
   */
  public List<String> split(String line) {
    List<String> segments = new ArrayList<>();
    Matcher matcher = BOUNDARY.matcher(line);
    int start = 0;
    while (matcher.find()) {
      addSegment(segments, line.substring(start, matcher.start()));
      start = matcher.end();
    }
    addSegment(segments, line.substring(start));
    return segments;
  }

  private void addSegment(List<String> segments, String segment) {
    String trimmed = segment.trim();
    if (!trimmed.isEmpty()) {
      segments.add(trimmed);
    }
  }
}
