package com.flamingo.ai.regulation.exception;

/** Exception thrown when a regulation document cannot be converted. */
public class DocumentProcessingException extends RuntimeException {

  private final String documentId;
  private final String userMessage;

  public DocumentProcessingException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(String documentId, String message, String userMessage) {
    super(message);
    this.documentId = documentId;
    this.userMessage = userMessage;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
