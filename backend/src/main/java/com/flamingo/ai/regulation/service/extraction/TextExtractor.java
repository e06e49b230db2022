package com.flamingo.ai.regulation.service.extraction;

import java.io.InputStream;

/**
 * Turns a source file into line-oriented plain text for the regulation parser.
 *
 * <p>Implementations are format-specific and must be stateless so one instance can serve
 * concurrent batch conversions. The caller retains ownership of the stream.
 */
public interface TextExtractor {

  /**
   * Extracts the full text, preserving line breaks.
   *
   * @param inputStream raw file bytes
   * @param fileName original file name, used for format hints and error messages
   * @return extracted text, possibly empty
   * @throws com.flamingo.ai.regulation.exception.TextExtractionException if the file cannot be
   *     read
   */
  String extract(InputStream inputStream, String fileName);

  /**
   * Returns {@code true} if this extractor handles the given file name.
   *
   * @param fileName file name including extension
   */
  boolean supports(String fileName);
}
