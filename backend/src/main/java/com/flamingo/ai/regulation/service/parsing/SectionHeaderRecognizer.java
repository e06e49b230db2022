package com.flamingo.ai.regulation.service.parsing;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Detects article headers of the form {@code 제6조(목적)}, {@code 제6조의2(보안과제) ...}.
 *
 * <p>The title may not contain parentheses; a header whose title does is not recognized and the
 * line falls through to enumerator classification.
 */
@Component
public class SectionHeaderRecognizer {

  private static final Pattern HEADER =
      Pattern.compile("^제\\s*([0-9]+)조((?:의[0-9]+)*)\\s*\\(([^()]*)\\)(.*)$");

  /**
   * Recognizes a header at the start of a trimmed line.
   *
   * @param line trimmed line
   * @return the header, or empty if the line does not start with one
   */
  public Optional<SectionHeader> recognize(String line) {
    Matcher matcher = HEADER.matcher(line);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    String number = matcher.group(1) + "조" + matcher.group(2);
    return Optional.of(
        new SectionHeader(number, matcher.group(3).trim(), matcher.group(4).trim()));
  }
}
