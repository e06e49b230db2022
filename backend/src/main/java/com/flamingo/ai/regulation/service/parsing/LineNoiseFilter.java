package com.flamingo.ai.regulation.service.parsing;

import com.flamingo.ai.regulation.config.RegulationConfig;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Drops extraction artifacts before any classification: lines carrying the publisher's running
 * header/footer stamp, and lines that are nothing but a page number.
 */
@Component
public class LineNoiseFilter {

  private final List<String> markers;

  public LineNoiseFilter(RegulationConfig config) {
    this.markers = List.copyOf(config.getParser().getNoiseMarkers());
  }

  /**
   * Returns {@code true} if the raw line should be kept.
   *
   * @param line raw line, untrimmed
   */
  public boolean keep(String line) {
    for (String marker : markers) {
      if (line.contains(marker)) {
        return false;
      }
    }
    return !isPageNumber(line.trim());
  }

  private boolean isPageNumber(String trimmed) {
    if (trimmed.isEmpty()) {
      return false;
    }
    for (int i = 0; i < trimmed.length(); i++) {
      if (!Character.isDigit(trimmed.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
