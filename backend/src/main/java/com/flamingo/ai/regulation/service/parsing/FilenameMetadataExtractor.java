package com.flamingo.ai.regulation.service.parsing;

import com.flamingo.ai.regulation.service.parsing.model.DocumentMetadata;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts document metadata from regulation file names.
 *
 * <p>Expected layout: {@code 제목(종류)(공포번호)(YYYYMMDD).ext}, i.e. the title followed directly
 * by three parenthesized groups holding the regulation type, the promulgation number and an
 * eight-digit enforcement date. Any other name yields the bare name as title and empty strings
 * for the rest.
 */
@Service
@Slf4j
public class FilenameMetadataExtractor {

  private static final Pattern EXTENSION = Pattern.compile("\\.[^.()]+$");
  private static final Pattern STRUCTURED_NAME =
      Pattern.compile("^(.+?)\\(([^()]*)\\)\\(([^()]*)\\)\\(([0-9]{8})\\)$");

  /**
   * Parses a file name.
   *
   * @param fileName file name with or without extension; may be {@code null}
   * @return extracted metadata, never {@code null}
   */
  public DocumentMetadata extract(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      return DocumentMetadata.titleOnly("");
    }

    String baseName = EXTENSION.matcher(fileName.trim()).replaceFirst("");
    Matcher matcher = STRUCTURED_NAME.matcher(baseName);
    if (!matcher.matches()) {
      log.warn(
          "File name '{}' does not follow title(type)(number)(date); using it as title", fileName);
      return DocumentMetadata.titleOnly(baseName);
    }

    return new DocumentMetadata(
        matcher.group(1).trim(),
        matcher.group(2).trim(),
        matcher.group(3).trim(),
        matcher.group(4));
  }
}
