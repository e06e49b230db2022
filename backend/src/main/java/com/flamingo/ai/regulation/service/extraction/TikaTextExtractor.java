package com.flamingo.ai.regulation.service.extraction;

import com.flamingo.ai.regulation.exception.TextExtractionException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

/**
 * {@link TextExtractor} for word-processor and plain-text files using Apache Tika's {@link
 * AutoDetectParser}.
 */
@Service
@Order(10)
@Slf4j
public class TikaTextExtractor implements TextExtractor {

  private static final Set<String> SUPPORTED_EXTENSIONS =
      Set.of("docx", "doc", "odt", "rtf", "txt");

  @Override
  public String extract(InputStream inputStream, String fileName) {
    AutoDetectParser parser = new AutoDetectParser();
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    if (fileName != null) {
      metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
    }
    try {
      parser.parse(inputStream, handler, metadata, new ParseContext());
    } catch (IOException | SAXException | TikaException e) {
      log.error("Tika extraction failed for {}: {}", fileName, e.getMessage());
      throw new TextExtractionException(fileName, "Failed to read document: " + e.getMessage(), e);
    }
    return handler.toString().strip();
  }

  @Override
  public boolean supports(String fileName) {
    if (fileName == null) {
      return false;
    }
    int dot = fileName.lastIndexOf('.');
    return dot >= 0
        && SUPPORTED_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
  }
}
