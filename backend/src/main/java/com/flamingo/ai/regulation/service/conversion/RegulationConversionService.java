package com.flamingo.ai.regulation.service.conversion;

import com.flamingo.ai.regulation.config.RegulationConfig;
import com.flamingo.ai.regulation.exception.DocumentProcessingException;
import com.flamingo.ai.regulation.service.extraction.TextExtractorRouter;
import com.flamingo.ai.regulation.service.parsing.FilenameMetadataExtractor;
import com.flamingo.ai.regulation.service.parsing.RegulationTextParser;
import com.flamingo.ai.regulation.service.parsing.RegulationTreeEmitter;
import com.flamingo.ai.regulation.service.parsing.model.DocumentMetadata;
import com.flamingo.ai.regulation.service.parsing.model.ParsedRegulation;
import com.flamingo.ai.regulation.service.parsing.model.RegulationDocument;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Orchestrates conversion of regulation files: extract text, read file name metadata, parse.
 *
 * <p>Directory conversion runs one task per file on {@code documentProcessingExecutor}. Documents
 * share no state, so they convert in parallel; a failure is logged, counted and reported in the
 * result without affecting the other files.
 */
@Service
@Slf4j
public class RegulationConversionService {

  private final TextExtractorRouter extractorRouter;
  private final FilenameMetadataExtractor metadataExtractor;
  private final RegulationTextParser parser;
  private final RegulationTreeEmitter emitter;
  private final RegulationConfig config;
  private final MeterRegistry meterRegistry;
  private final Executor executor;

  public RegulationConversionService(
      TextExtractorRouter extractorRouter,
      FilenameMetadataExtractor metadataExtractor,
      RegulationTextParser parser,
      RegulationTreeEmitter emitter,
      RegulationConfig config,
      MeterRegistry meterRegistry,
      @Qualifier("documentProcessingExecutor") Executor executor) {
    this.extractorRouter = extractorRouter;
    this.metadataExtractor = metadataExtractor;
    this.parser = parser;
    this.emitter = emitter;
    this.config = config;
    this.meterRegistry = meterRegistry;
    this.executor = executor;
  }

  /**
   * Structures already-extracted text.
   *
   * @param documentId identifier for the document root
   * @param fileName original file name, source of the document metadata
   * @param text extracted text
   */
  @Timed(value = "regulation.convert", description = "Time to structure one regulation")
  public ParsedRegulation convert(String documentId, String fileName, String text) {
    DocumentMetadata metadata = metadataExtractor.extract(fileName);
    ParsedRegulation result = parser.parse(documentId, metadata, text);
    log.info(
        "Document {} ({}) structured into {} article(s)",
        documentId,
        fileName,
        result.document().mainBody().size());
    return result;
  }

  /**
   * Extracts the text of a source file and structures it.
   *
   * @param documentId identifier for the document root
   * @param fileName original file name, used to pick the extractor and for metadata
   * @param content raw file bytes; not closed
   */
  public ParsedRegulation convert(String documentId, String fileName, InputStream content) {
    String text = extractorRouter.extract(content, fileName);
    return convert(documentId, fileName, text);
  }

  /**
   * Converts every supported file in a directory. Files are taken in file-name order and receive
   * ids {@code "1"}, {@code "2"}, ... in that order.
   *
   * @param folder directory holding the source files (not searched recursively)
   * @return converted documents in input order and the names of files that failed
   * @throws DocumentProcessingException if the directory cannot be listed
   */
  @Timed(value = "regulation.convert.batch", description = "Time to convert a directory")
  public BatchConversionResult convertDirectory(Path folder) {
    List<Path> files = listInputFiles(folder);
    log.info("Converting {} file(s) from {}", files.size(), folder);

    List<CompletableFuture<Optional<RegulationDocument>>> futures = new ArrayList<>();
    for (int i = 0; i < files.size(); i++) {
      String documentId = String.valueOf(i + 1);
      Path file = files.get(i);
      futures.add(submit(documentId, file));
    }

    List<RegulationDocument> documents = new ArrayList<>();
    List<String> failed = new ArrayList<>();
    for (int i = 0; i < futures.size(); i++) {
      Optional<RegulationDocument> document = futures.get(i).join();
      if (document.isPresent()) {
        documents.add(document.get());
      } else {
        failed.add(files.get(i).getFileName().toString());
      }
    }

    log.info(
        "Converted {} of {} file(s) from {}; failed: {}",
        documents.size(),
        files.size(),
        folder,
        failed);
    return new BatchConversionResult(documents, failed);
  }

  /**
   * Converts a directory and writes {@code {"documents": [...]}} to the configured output file
   * inside {@code outputFolder}.
   *
   * <p>Library entry point for offline batch runs; the REST API only structures single documents.
   *
   * @return the batch result; the output file holds only the successful documents
   */
  public BatchConversionResult convertDirectory(Path inputFolder, Path outputFolder) {
    BatchConversionResult result = convertDirectory(inputFolder);
    try {
      Files.createDirectories(outputFolder);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          null, "Cannot create output folder " + outputFolder + ": " + e.getMessage(), e);
    }
    emitter.writeDocuments(
        result.documents(), outputFolder.resolve(config.getBatch().getOutputFileName()));
    return result;
  }

  private CompletableFuture<Optional<RegulationDocument>> submit(String documentId, Path file) {
    try {
      return CompletableFuture.supplyAsync(() -> convertFile(documentId, file), executor);
    } catch (RejectedExecutionException e) {
      log.debug("Executor rejected {}; converting on the calling thread", file.getFileName());
      return CompletableFuture.completedFuture(convertFile(documentId, file));
    }
  }

  private Optional<RegulationDocument> convertFile(String documentId, Path file) {
    String fileName = file.getFileName().toString();
    try (InputStream in = Files.newInputStream(file)) {
      return Optional.of(convert(documentId, fileName, in).document());
    } catch (IOException | RuntimeException e) {
      meterRegistry.counter("regulation.documents.failed").increment();
      log.warn("Skipping {} (document {}): {}", fileName, documentId, e.getMessage(), e);
      return Optional.empty();
    }
  }

  private List<Path> listInputFiles(Path folder) {
    List<String> extensions = config.getBatch().getInputExtensions();
    try (Stream<Path> entries = Files.list(folder)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(p -> extensions.contains(extensionOf(p)))
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .toList();
    } catch (IOException e) {
      throw new DocumentProcessingException(
          null, "Cannot list input folder " + folder + ": " + e.getMessage(), e);
    }
  }

  private static String extensionOf(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
