package com.flamingo.ai.regulation.service.parsing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Root of the structured tree recovered from one regulation file.
 *
 * <p>Serialized field names are the contract consumed by the chunking and embedding stages, so
 * they are fixed with {@link JsonProperty} rather than derived from the component names.
 *
 * @param documentId caller-assigned identifier, used as the prefix of every chunk id
 * @param documentTitle regulation title, taken from the file name
 * @param documentType kind of regulation (e.g. directive, rule), taken from the file name
 * @param promulgationNumber promulgation number, taken from the file name
 * @param enforcementDate eight-digit enforcement date, taken from the file name
 * @param mainBody articles in source order
 */
public record RegulationDocument(
    @JsonProperty("document_id") String documentId,
    @JsonProperty("document_title") String documentTitle,
    @JsonProperty("document_type") String documentType,
    @JsonProperty("promulgation_number") String promulgationNumber,
    @JsonProperty("enforcement_date") String enforcementDate,
    @JsonProperty("main_body") List<Article> mainBody) {

  public RegulationDocument {
    mainBody = List.copyOf(mainBody);
  }
}
