package com.flamingo.ai.regulation.service.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.flamingo.ai.regulation.config.RegulationConfig;
import com.flamingo.ai.regulation.exception.DocumentProcessingException;
import com.flamingo.ai.regulation.service.chunking.RegulationChunk;
import com.flamingo.ai.regulation.service.parsing.model.RegulationDocument;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Serializes document trees and chunk lists to the JSON files consumed by the downstream
 * translation and embedding stages.
 *
 * <p>Output is UTF-8 with non-ASCII characters written as-is. Collections are wrapped the way the
 * downstream stages read them: {@code {"documents": [...]}} and {@code {"chunks": [...]}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegulationTreeEmitter {

  private final ObjectMapper objectMapper;
  private final RegulationConfig config;

  /** Serializes a single document tree. */
  public String toJson(RegulationDocument document) {
    try {
      return writer().writeValueAsString(document);
    } catch (JsonProcessingException e) {
      throw new DocumentProcessingException(
          document.documentId(), "Failed to serialize document: " + e.getMessage(), e);
    }
  }

  /**
   * Writes {@code {"documents": [...]}} to the given file, replacing it if present.
   *
   * @param documents documents in output order
   * @param target output file
   */
  public void writeDocuments(List<RegulationDocument> documents, Path target) {
    write(Map.of("documents", documents), target);
    log.info("Wrote {} document(s) to {}", documents.size(), target);
  }

  /**
   * Writes {@code {"chunks": [...]}} to the given file, replacing it if present. Library entry
   * point for handing chunks to an offline embedding run.
   *
   * @param chunks chunks in output order
   * @param target output file
   */
  public void writeChunks(List<RegulationChunk> chunks, Path target) {
    write(Map.of("chunks", chunks), target);
    log.info("Wrote {} chunk(s) to {}", chunks.size(), target);
  }

  private void write(Object value, Path target) {
    try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
      writer().writeValue(out, value);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          null, "Failed to write " + target + ": " + e.getMessage(), e);
    }
  }

  private ObjectWriter writer() {
    return config.getOutput().isPrettyPrint()
        ? objectMapper.writerWithDefaultPrettyPrinter()
        : objectMapper.writer();
  }
}
