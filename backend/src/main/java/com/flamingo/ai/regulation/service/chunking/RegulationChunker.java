package com.flamingo.ai.regulation.service.chunking;

import com.flamingo.ai.regulation.service.parsing.model.Article;
import com.flamingo.ai.regulation.service.parsing.model.Item;
import com.flamingo.ai.regulation.service.parsing.model.Paragraph;
import com.flamingo.ai.regulation.service.parsing.model.RegulationDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Cuts a regulation tree into article- and paragraph-level chunks for embedding.
 *
 * <p>For every article, the article chunk comes first and is followed by one chunk per paragraph,
 * so the output follows document order. Article content is the article text plus every
 * paragraph's text and item texts; paragraph content is the paragraph text plus its item texts.
 * Subitems are not folded into either.
 */
@Service
@Slf4j
public class RegulationChunker {

  /**
   * Produces chunks from one document.
   *
   * @param document parsed regulation
   * @return ordered chunks; empty when the document has no articles
   */
  public List<RegulationChunk> chunk(RegulationDocument document) {
    List<RegulationChunk> chunks = new ArrayList<>();
    String documentId = document.documentId();
    String title = document.documentTitle();

    for (Article article : document.mainBody()) {
      String articleDigits = ChunkIdentifiers.articleNumberDigits(article.articleNumber());

      String articleContent =
          joinNonBlank(
              Stream.concat(
                  Stream.of(article.articleText()),
                  article.paragraphs().stream().map(this::paragraphContent)));
      chunks.add(
          new RegulationChunk(
              ChunkIdentifiers.articleChunkId(documentId, article.articleNumber()),
              ChunkType.ARTICLE,
              "「" + title + "」 " + article.articleNumber() + " (" + article.articleTitle() + ")",
              articleContent));

      for (Paragraph paragraph : article.paragraphs()) {
        int ordinal = ChunkIdentifiers.paragraphOrdinal(paragraph.paragraphSymbol());
        String location = "「" + title + "」 " + articleDigits + "조";
        if (ordinal > 0) {
          location += ordinal + "항";
        }
        chunks.add(
            new RegulationChunk(
                ChunkIdentifiers.paragraphChunkId(
                    documentId, article.articleNumber(), paragraph.paragraphSymbol()),
                ChunkType.PARAGRAPH,
                location,
                paragraphContent(paragraph)));
      }
    }

    log.debug("Document {} produced {} chunks", documentId, chunks.size());
    return chunks;
  }

  private String paragraphContent(Paragraph paragraph) {
    return joinNonBlank(
        Stream.concat(
            Stream.of(paragraph.paragraphText()), paragraph.items().stream().map(Item::itemText)));
  }

  private String joinNonBlank(Stream<String> parts) {
    return parts.filter(part -> !part.isBlank()).collect(Collectors.joining(" "));
  }
}
