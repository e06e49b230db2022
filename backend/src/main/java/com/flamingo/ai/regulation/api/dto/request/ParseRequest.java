package com.flamingo.ai.regulation.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO carrying already-extracted regulation text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseRequest {

  /** Optional document id. If null, {@code "1"} is used. */
  @Size(max = 64, message = "Document id must not exceed 64 characters")
  private String documentId;

  @NotBlank(message = "File name is required")
  private String fileName;

  @NotNull(message = "Text is required")
  private String text;
}
