package com.flamingo.ai.regulation.service.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.regulation.config.RegulationConfig;
import com.flamingo.ai.regulation.exception.DocumentProcessingException;
import com.flamingo.ai.regulation.service.chunking.ChunkType;
import com.flamingo.ai.regulation.service.chunking.RegulationChunk;
import com.flamingo.ai.regulation.service.parsing.model.Article;
import com.flamingo.ai.regulation.service.parsing.model.Item;
import com.flamingo.ai.regulation.service.parsing.model.Paragraph;
import com.flamingo.ai.regulation.service.parsing.model.RegulationDocument;
import com.flamingo.ai.regulation.service.parsing.model.SubSubitem;
import com.flamingo.ai.regulation.service.parsing.model.Subitem;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("RegulationTreeEmitter Tests")
class RegulationTreeEmitterTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private RegulationConfig config;
  private RegulationTreeEmitter emitter;

  @TempDir Path tempDir;

  @BeforeEach
  void setUp() {
    config = new RegulationConfig();
    emitter = new RegulationTreeEmitter(objectMapper, config);
  }

  private static RegulationDocument sampleDocument() {
    SubSubitem subSubitem = new SubSubitem("1", "세부");
    Subitem subitem = new Subitem("가", "예외없음", List.of(subSubitem));
    Item item = new Item("1", "전파금지", List.of(subitem));
    Paragraph paragraph = new Paragraph("①", "비밀 준수 의무", List.of(item));
    Article article = new Article("6조", "보안과제", "", List.of(paragraph));
    return new RegulationDocument("1", "규정", "훈령", "제864호", "20240711", List.of(article));
  }

  @Test
  @DisplayName("should write snake_case keys at every level")
  void shouldWriteSnakeCaseKeys() throws IOException {
    JsonNode root = objectMapper.readTree(emitter.toJson(sampleDocument()));

    assertThat(root.fieldNames())
        .toIterable()
        .containsExactlyInAnyOrder(
            "document_id",
            "document_title",
            "document_type",
            "promulgation_number",
            "enforcement_date",
            "main_body");
    JsonNode article = root.path("main_body").get(0);
    assertThat(article.path("article_number").asText()).isEqualTo("6조");
    assertThat(article.path("article_text").asText()).isEmpty();
    JsonNode paragraph = article.path("paragraphs").get(0);
    assertThat(paragraph.fieldNames())
        .toIterable()
        .containsExactlyInAnyOrder("paragraph_symbol", "paragraph_text", "items");
    JsonNode subitem = paragraph.path("items").get(0).path("subitems").get(0);
    assertThat(subitem.path("subitem_symbol").asText()).isEqualTo("가");
    assertThat(subitem.path("subsubitems").get(0).path("subsubitem_text").asText())
        .isEqualTo("세부");
  }

  @Test
  @DisplayName("should write Korean text without escaping")
  void shouldNotEscapeKorean() {
    String json = emitter.toJson(sampleDocument());

    assertThat(json).contains("보안과제").contains("①").doesNotContain("\\u");
  }

  @Test
  @DisplayName("should follow the pretty-print setting")
  void shouldFollowPrettyPrintSetting() {
    config.getOutput().setPrettyPrint(false);

    assertThat(emitter.toJson(sampleDocument())).doesNotContain("\n");
  }

  @Test
  @DisplayName("should wrap documents in a documents array")
  void shouldWriteDocumentsFile() throws IOException {
    Path target = tempDir.resolve("output.json");

    emitter.writeDocuments(List.of(sampleDocument()), target);

    JsonNode root = objectMapper.readTree(Files.readString(target, StandardCharsets.UTF_8));
    assertThat(root.path("documents").size()).isEqualTo(1);
    assertThat(root.path("documents").get(0).path("document_title").asText()).isEqualTo("규정");
  }

  @Test
  @DisplayName("should wrap chunks in a chunks array with lower-case types")
  void shouldWriteChunksFile() throws IOException {
    Path target = tempDir.resolve("chunks.json");
    RegulationChunk chunk =
        new RegulationChunk("1.6", ChunkType.ARTICLE, "「규정」 6조 (보안과제)", "비밀 준수 의무");

    emitter.writeChunks(List.of(chunk), target);

    JsonNode written = objectMapper.readTree(target.toFile()).path("chunks").get(0);
    assertThat(written.path("chunk_id").asText()).isEqualTo("1.6");
    assertThat(written.path("chunk_type").asText()).isEqualTo("article");
    assertThat(written.path("metadata_text").asText()).isEqualTo("「규정」 6조 (보안과제)");
  }

  @Test
  @DisplayName("should report an unwritable target as a processing failure")
  void shouldFailOnUnwritableTarget() {
    Path target = tempDir.resolve("missing").resolve("output.json");

    assertThatThrownBy(() -> emitter.writeDocuments(List.of(sampleDocument()), target))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageContaining("output.json");
  }
}
