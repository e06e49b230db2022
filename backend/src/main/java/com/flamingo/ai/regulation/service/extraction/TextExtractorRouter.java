package com.flamingo.ai.regulation.service.extraction;

import com.flamingo.ai.regulation.exception.TextExtractionException;
import java.io.InputStream;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a file to the highest-priority {@link TextExtractor} that supports its name.
 *
 * <p>Extractors are injected by Spring in {@code @Order} order (ascending); the first one whose
 * {@code supports(fileName)} returns {@code true} wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextExtractorRouter {

  private final List<TextExtractor> extractors;

  /**
   * Returns the extractor for the given file name.
   *
   * @throws TextExtractionException if no extractor supports the file
   */
  public TextExtractor route(String fileName) {
    return extractors.stream()
        .filter(e -> e.supports(fileName))
        .findFirst()
        .orElseThrow(
            () -> new TextExtractionException(fileName, "Unsupported file type: " + fileName));
  }

  /** Extracts the text of a file with the extractor chosen by {@link #route(String)}. */
  public String extract(InputStream inputStream, String fileName) {
    TextExtractor extractor = route(fileName);
    log.debug("Extracting {} with {}", fileName, extractor.getClass().getSimpleName());
    return extractor.extract(inputStream, fileName);
  }

  /** Returns {@code true} if some extractor supports the file name. */
  public boolean supports(String fileName) {
    return extractors.stream().anyMatch(e -> e.supports(fileName));
  }
}
