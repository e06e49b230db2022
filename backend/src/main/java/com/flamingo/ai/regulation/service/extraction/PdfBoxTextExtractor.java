package com.flamingo.ai.regulation.service.extraction;

import com.flamingo.ai.regulation.exception.TextExtractionException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * {@link TextExtractor} for PDF files using Apache PDFBox 3.x.
 *
 * <p>Pages are stripped one at a time and joined with a line break, so a page's trailing
 * footer and the next page's running header end up on lines of their own for the noise filter.
 */
@Service
@Order(1)
@Slf4j
public class PdfBoxTextExtractor implements TextExtractor {

  @Override
  public String extract(InputStream inputStream, String fileName) {
    try {
      byte[] bytes = inputStream.readAllBytes();
      try (PDDocument pdfDoc = Loader.loadPDF(bytes)) {
        return stripPages(pdfDoc);
      }
    } catch (IOException e) {
      log.error("PDFBox extraction failed for {}: {}", fileName, e.getMessage());
      throw new TextExtractionException(fileName, "Failed to read PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String fileName) {
    return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
  }

  private String stripPages(PDDocument pdfDoc) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    StringBuilder text = new StringBuilder();
    int pageCount = pdfDoc.getNumberOfPages();
    for (int page = 1; page <= pageCount; page++) {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      String pageText = stripper.getText(pdfDoc);
      if (!pageText.isEmpty()) {
        text.append(pageText).append('\n');
      }
    }
    log.debug("Extracted {} characters from {} PDF pages", text.length(), pageCount);
    return text.toString().strip();
  }
}
