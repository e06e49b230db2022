package com.flamingo.ai.regulation.service.parsing.model;

/**
 * Metadata parsed from a regulation file name such as {@code 규정(훈령)(제864호)(20240711).pdf}.
 *
 * <p>When the file name does not follow that layout, {@code title} is the bare file name and the
 * other fields are empty strings.
 */
public record DocumentMetadata(
    String title, String documentType, String promulgationNumber, String enforcementDate) {

  public static DocumentMetadata titleOnly(String title) {
    return new DocumentMetadata(title, "", "", "");
  }
}
