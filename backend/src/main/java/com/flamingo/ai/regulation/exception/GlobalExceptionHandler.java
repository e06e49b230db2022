package com.flamingo.ai.regulation.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(TextExtractionException.class)
  public ResponseEntity<ApiError> handleTextExtraction(
      TextExtractionException ex, HttpServletRequest request) {

    incrementErrorCounter("text_extraction");
    String errorId = generateErrorId();
    log.error(
        "Text extraction error [{}] for {}: {}", errorId, ex.getFileName(), ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DOCUMENT_PARSE_ERROR)
                .message("Could not extract text from " + ex.getFileName())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("document_processing");
    String errorId = generateErrorId();
    log.error("Document processing error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DOCUMENT_PROCESSING_ERROR)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
