package com.flamingo.ai.regulation.service.parsing.model;

/** A structured document together with the statistics of the parse that produced it. */
public record ParsedRegulation(RegulationDocument document, ParseStatistics statistics) {}
