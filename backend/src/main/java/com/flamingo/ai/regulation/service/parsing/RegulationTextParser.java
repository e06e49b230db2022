package com.flamingo.ai.regulation.service.parsing;

import com.flamingo.ai.regulation.config.RegulationConfig;
import com.flamingo.ai.regulation.service.parsing.model.Article;
import com.flamingo.ai.regulation.service.parsing.model.DocumentMetadata;
import com.flamingo.ai.regulation.service.parsing.model.ParseStatistics;
import com.flamingo.ai.regulation.service.parsing.model.ParsedRegulation;
import com.flamingo.ai.regulation.service.parsing.model.RegulationDocument;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Recovers the article hierarchy of a regulation from its extracted plain text.
 *
 * <p>Each raw line passes the {@link LineNoiseFilter}, is trimmed, and is checked for an article
 * header. Header lines open a new article; their trailing text and all other lines are split at
 * in-line enumerators and every segment is dispatched to a fresh {@link HierarchyStateMachine}
 * according to {@link EnumeratorClassifier}.
 *
 * <p>Stateless; one instance may parse many documents concurrently.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegulationTextParser {

  private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n|\\r");

  private final RegulationConfig config;
  private final LineNoiseFilter noiseFilter;
  private final SectionHeaderRecognizer headerRecognizer;
  private final EnumeratorClassifier classifier;
  private final InlineEnumeratorSplitter splitter;
  private final MeterRegistry meterRegistry;

  /**
   * Parses the extracted text of one document.
   *
   * @param documentId identifier written to the tree and used in log messages
   * @param metadata file name metadata for the document root
   * @param text full extracted text with line breaks preserved; {@code null} is treated as empty
   * @return the document tree and parse statistics
   */
  public ParsedRegulation parse(String documentId, DocumentMetadata metadata, String text) {
    RegulationConfig.Parser parserConfig = config.getParser();
    HierarchyStateMachine machine =
        new HierarchyStateMachine(documentId, parserConfig.getOrphanPolicy());

    int linesRead = 0;
    int noiseDropped = 0;
    for (String rawLine : LINE_BREAK.split(text == null ? "" : text, -1)) {
      if (rawLine.isBlank()) {
        continue;
      }
      linesRead++;
      if (!noiseFilter.keep(rawLine)) {
        noiseDropped++;
        continue;
      }
      processLine(rawLine.trim(), machine, parserConfig.isInlineSplitEnabled());
    }

    List<Article> articles = machine.finish();
    ParseStatistics statistics = machine.statistics(linesRead, noiseDropped);
    recordMetrics(statistics);
    log.debug("Parsed document {}: {}", documentId, statistics);

    RegulationDocument document =
        new RegulationDocument(
            documentId,
            metadata.title(),
            metadata.documentType(),
            metadata.promulgationNumber(),
            metadata.enforcementDate(),
            articles);
    return new ParsedRegulation(document, statistics);
  }

  private void processLine(String line, HierarchyStateMachine machine, boolean inlineSplit) {
    Optional<SectionHeader> header = headerRecognizer.recognize(line);
    if (header.isPresent()) {
      SectionHeader h = header.get();
      machine.openArticle(h.articleNumber(), h.articleTitle());
      processTrailingContent(h.trailingContent(), machine, inlineSplit);
      return;
    }

    if (!inlineSplit) {
      dispatch(line, machine, true);
      return;
    }
    List<String> segments = splitter.split(line);
    for (int i = 0; i < segments.size(); i++) {
      dispatch(segments.get(i), machine, i == 0);
    }
  }

  /**
   * Text after an article header. A leading paragraph glyph is handled as if it started a line of
   * its own; other text becomes the article body.
   */
  private void processTrailingContent(
      String trailing, HierarchyStateMachine machine, boolean inlineSplit) {
    if (trailing.isEmpty()) {
      return;
    }
    if (inlineSplit) {
      splitter.split(trailing).forEach(segment -> dispatch(segment, machine, false));
    } else if (classifier.classify(trailing).kind() == LineKind.PARAGRAPH) {
      dispatch(trailing, machine, false);
    } else {
      machine.appendText(trailing);
    }
  }

  /**
   * Routes one segment to the state machine.
   *
   * @param lineStart whether the segment starts its physical line. A subitem or sub-subitem
   *     enumerator found mid-line without an open parent is kept as running text.
   */
  private void dispatch(String segment, HierarchyStateMachine machine, boolean lineStart) {
    LineClassification classification = classifier.classify(segment);
    switch (classification.kind()) {
      case PARAGRAPH -> machine.openParagraph(classification.symbol(), classification.content());
      case ITEM -> machine.openItem(classification.symbol(), classification.content());
      case SUBITEM -> {
        if (lineStart || machine.hasOpenItem()) {
          machine.openSubitem(classification.symbol(), classification.content());
        } else {
          machine.appendText(segment);
        }
      }
      case SUB_SUBITEM -> {
        if (lineStart || machine.hasOpenSubitem()) {
          machine.openSubSubitem(classification.symbol(), classification.content());
        } else {
          machine.appendText(segment);
        }
      }
      default -> machine.appendText(segment);
    }
  }

  private void recordMetrics(ParseStatistics statistics) {
    meterRegistry.counter("regulation.documents.parsed").increment();
    int orphans = statistics.orphansDropped() + statistics.orphansSynthesized();
    if (orphans > 0) {
      String policy = config.getParser().getOrphanPolicy().name().toLowerCase(Locale.ROOT);
      meterRegistry.counter("regulation.parser.orphans", "policy", policy).increment(orphans);
    }
  }
}
