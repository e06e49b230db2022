package com.flamingo.ai.regulation.exception;

/** Exception thrown when plain text cannot be extracted from a source file. */
public class TextExtractionException extends RuntimeException {

  private final String fileName;

  public TextExtractionException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
  }

  public TextExtractionException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
