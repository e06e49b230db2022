package com.flamingo.ai.regulation.api.dto.response;

import com.flamingo.ai.regulation.service.parsing.model.ParseStatistics;
import com.flamingo.ai.regulation.service.parsing.model.ParsedRegulation;
import com.flamingo.ai.regulation.service.parsing.model.RegulationDocument;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a structured regulation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseResponse {

  private RegulationDocument document;
  private ParseStatistics statistics;

  /** Creates a ParseResponse from a parse result. */
  public static ParseResponse fromResult(ParsedRegulation result) {
    return ParseResponse.builder()
        .document(result.document())
        .statistics(result.statistics())
        .build();
  }
}
