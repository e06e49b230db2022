package com.flamingo.ai.regulation.service.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.regulation.service.parsing.model.DocumentMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FilenameMetadataExtractor Tests")
class FilenameMetadataExtractorTest {

  private final FilenameMetadataExtractor extractor = new FilenameMetadataExtractor();

  @Test
  @DisplayName("should extract all four fields from a structured file name")
  void shouldExtractStructuredName() {
    DocumentMetadata metadata = extractor.extract("Regulation(Directive)(No.864)(20240711).pdf");

    assertThat(metadata)
        .isEqualTo(new DocumentMetadata("Regulation", "Directive", "No.864", "20240711"));
  }

  @Test
  @DisplayName("should extract Korean file names")
  void shouldExtractKoreanName() {
    DocumentMetadata metadata = extractor.extract("방위사업관리규정(훈령)(제864호)(20240711).docx");

    assertThat(metadata)
        .isEqualTo(new DocumentMetadata("방위사업관리규정", "훈령", "제864호", "20240711"));
  }

  @Test
  @DisplayName("should accept a name without extension")
  void shouldAcceptNameWithoutExtension() {
    DocumentMetadata metadata = extractor.extract("Rule(Type)(No.1)(20200101)");

    assertThat(metadata).isEqualTo(new DocumentMetadata("Rule", "Type", "No.1", "20200101"));
  }

  @Test
  @DisplayName("should fall back to the base name for an unstructured name")
  void shouldFallBackToBaseName() {
    assertThat(extractor.extract("malformed.pdf"))
        .isEqualTo(DocumentMetadata.titleOnly("malformed"));
  }

  @Test
  @DisplayName("should fall back when the date is not eight digits")
  void shouldFallBackOnShortDate() {
    DocumentMetadata metadata = extractor.extract("Title(A)(B)(2024071).pdf");

    assertThat(metadata.title()).isEqualTo("Title(A)(B)(2024071)");
    assertThat(metadata.documentType()).isEmpty();
    assertThat(metadata.enforcementDate()).isEmpty();
  }

  @Test
  @DisplayName("should fall back when the groups are separated")
  void shouldFallBackOnSeparatedGroups() {
    assertThat(extractor.extract("Reg(A) (B)(20240711).pdf").title())
        .isEqualTo("Reg(A) (B)(20240711)");
  }

  @Test
  @DisplayName("should return an empty title for a missing name")
  void shouldHandleMissingName() {
    assertThat(extractor.extract(null)).isEqualTo(DocumentMetadata.titleOnly(""));
    assertThat(extractor.extract("  ")).isEqualTo(DocumentMetadata.titleOnly(""));
  }
}
