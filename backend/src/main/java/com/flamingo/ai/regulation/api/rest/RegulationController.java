package com.flamingo.ai.regulation.api.rest;

import com.flamingo.ai.regulation.api.dto.request.ParseRequest;
import com.flamingo.ai.regulation.api.dto.response.ChunkResponse;
import com.flamingo.ai.regulation.api.dto.response.ParseResponse;
import com.flamingo.ai.regulation.exception.DocumentProcessingException;
import com.flamingo.ai.regulation.service.chunking.RegulationChunker;
import com.flamingo.ai.regulation.service.conversion.RegulationConversionService;
import com.flamingo.ai.regulation.service.parsing.model.ParsedRegulation;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.InputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for structuring regulation text. */
@RestController
@RequestMapping("/api/regulations")
@RequiredArgsConstructor
@Slf4j
public class RegulationController {

  private static final String DEFAULT_DOCUMENT_ID = "1";

  private final RegulationConversionService conversionService;
  private final RegulationChunker chunker;

  /** Structures already-extracted text. */
  @PostMapping(value = "/parse", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ParseResponse> parse(@Valid @RequestBody ParseRequest request) {
    ParsedRegulation result =
        conversionService.convert(
            documentIdOrDefault(request.getDocumentId()), request.getFileName(), request.getText());
    return ResponseEntity.ok(ParseResponse.fromResult(result));
  }

  /** Extracts and structures an uploaded PDF, DOCX or text file. */
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ParseResponse> upload(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "documentId", required = false) String documentId) {
    String id = documentIdOrDefault(documentId);
    log.info("Received upload {} ({} bytes)", file.getOriginalFilename(), file.getSize());
    try (InputStream in = file.getInputStream()) {
      ParsedRegulation result = conversionService.convert(id, file.getOriginalFilename(), in);
      return ResponseEntity.ok(ParseResponse.fromResult(result));
    } catch (IOException e) {
      throw new DocumentProcessingException(
          id, "Failed to read upload: " + e.getMessage(), "Failed to read uploaded file");
    }
  }

  /** Structures text and returns its article and paragraph chunks. */
  @PostMapping(value = "/chunks", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ChunkResponse> chunks(@Valid @RequestBody ParseRequest request) {
    ParsedRegulation result =
        conversionService.convert(
            documentIdOrDefault(request.getDocumentId()), request.getFileName(), request.getText());
    return ResponseEntity.ok(
        ChunkResponse.builder().chunks(chunker.chunk(result.document())).build());
  }

  private String documentIdOrDefault(String documentId) {
    return documentId == null || documentId.isBlank() ? DEFAULT_DOCUMENT_ID : documentId;
  }
}
