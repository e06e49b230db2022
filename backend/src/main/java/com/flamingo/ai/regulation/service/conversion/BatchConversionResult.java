package com.flamingo.ai.regulation.service.conversion;

import com.flamingo.ai.regulation.service.parsing.model.RegulationDocument;
import java.util.List;

/**
 * Outcome of converting a directory of regulation files.
 *
 * @param documents successfully converted documents, in input file order
 * @param failedFiles names of the files that could not be converted
 */
public record BatchConversionResult(List<RegulationDocument> documents, List<String> failedFiles) {

  public BatchConversionResult {
    documents = List.copyOf(documents);
    failedFiles = List.copyOf(failedFiles);
  }
}
