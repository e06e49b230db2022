package com.flamingo.ai.regulation.service.parsing;

import com.flamingo.ai.regulation.config.RegulationConfig.OrphanPolicy;
import com.flamingo.ai.regulation.service.parsing.model.Article;
import com.flamingo.ai.regulation.service.parsing.model.Item;
import com.flamingo.ai.regulation.service.parsing.model.Paragraph;
import com.flamingo.ai.regulation.service.parsing.model.ParseStatistics;
import com.flamingo.ai.regulation.service.parsing.model.SubSubitem;
import com.flamingo.ai.regulation.service.parsing.model.Subitem;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Accumulates the article/paragraph/item/subitem/sub-subitem tree of one document from a stream
 * of classified segments.
 *
 * <p>At most one node per level is open. Opening a node at level N closes every open node at
 * level N and below; ancestors stay open. A new node is attached to its parent as soon as it is
 * opened, so children always keep source order. Free text goes to the deepest open node. Nothing
 * here throws for any input: every segment lands in exactly one transition.
 *
 * <p>Not thread-safe. Create one instance per document and discard it after {@link #finish()}.
 */
@Slf4j
public class HierarchyStateMachine {

  private static final int ARTICLE = 0;
  private static final int PARAGRAPH = 1;
  private static final int ITEM = 2;
  private static final int SUBITEM = 3;
  private static final int SUB_SUBITEM = 4;

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final String documentId;
  private final OrphanPolicy orphanPolicy;

  private final OpenNode[] open = new OpenNode[SUB_SUBITEM + 1];
  private final List<Article> articles = new ArrayList<>();
  private boolean finished;

  private int paragraphs;
  private int virtualParagraphs;
  private int items;
  private int subitems;
  private int subSubitems;
  private int orphansDropped;
  private int orphansSynthesized;

  public HierarchyStateMachine(String documentId, OrphanPolicy orphanPolicy) {
    this.documentId = documentId;
    this.orphanPolicy = orphanPolicy;
  }

  /** Closes the open article with all its descendants and opens a new one. */
  public void openArticle(String articleNumber, String articleTitle) {
    checkNotFinished();
    closeArticle();
    open[ARTICLE] = new OpenNode(articleNumber, articleTitle, "");
  }

  /** Opens a paragraph under the current article, creating an implicit article if needed. */
  public void openParagraph(String symbol, String text) {
    checkNotFinished();
    ensureArticle();
    attach(PARAGRAPH, new OpenNode(symbol, "", text));
    paragraphs++;
  }

  /** Opens an item, synthesizing an empty-symbol paragraph when none is open. */
  public void openItem(String symbol, String text) {
    checkNotFinished();
    ensureParagraph();
    attach(ITEM, new OpenNode(symbol, "", text));
    items++;
  }

  /** Opens a subitem under the open item; without one, applies the orphan policy. */
  public void openSubitem(String symbol, String text) {
    checkNotFinished();
    if (open[ITEM] == null && !resolveOrphan(SUBITEM, symbol, text)) {
      return;
    }
    attach(SUBITEM, new OpenNode(symbol, "", text));
    subitems++;
  }

  /** Opens a sub-subitem under the open subitem; without one, applies the orphan policy. */
  public void openSubSubitem(String symbol, String text) {
    checkNotFinished();
    if (open[SUBITEM] == null && !resolveOrphan(SUB_SUBITEM, symbol, text)) {
      return;
    }
    attach(SUB_SUBITEM, new OpenNode(symbol, "", text));
    subSubitems++;
  }

  public boolean hasOpenItem() {
    return open[ITEM] != null;
  }

  public boolean hasOpenSubitem() {
    return open[SUBITEM] != null;
  }

  /** Appends free text to the deepest open node, opening an implicit article if none is. */
  public void appendText(String text) {
    checkNotFinished();
    ensureArticle();
    for (int level = SUB_SUBITEM; level >= ARTICLE; level--) {
      if (open[level] != null) {
        open[level].append(text);
        return;
      }
    }
  }

  /**
   * Flushes every open node and returns the articles in source order. The machine accepts no
   * further input afterwards.
   */
  public List<Article> finish() {
    if (!finished) {
      closeArticle();
      finished = true;
    }
    return List.copyOf(articles);
  }

  /**
   * Counters for the segments consumed so far.
   *
   * @param linesRead non-empty lines read before noise filtering
   * @param noiseLinesDropped lines removed by the noise filter
   */
  public ParseStatistics statistics(int linesRead, int noiseLinesDropped) {
    return new ParseStatistics(
        linesRead,
        noiseLinesDropped,
        articles.size() + (open[ARTICLE] != null ? 1 : 0),
        paragraphs,
        virtualParagraphs,
        items,
        subitems,
        subSubitems,
        orphansDropped,
        orphansSynthesized);
  }

  // ---- transitions ----

  private void attach(int level, OpenNode node) {
    closeFrom(level);
    open[level - 1].children.add(node);
    open[level] = node;
  }

  private void closeFrom(int level) {
    for (int l = SUB_SUBITEM; l >= level; l--) {
      open[l] = null;
    }
  }

  private void ensureArticle() {
    if (open[ARTICLE] == null) {
      log.debug("Document {}: content before the first article header", documentId);
      open[ARTICLE] = new OpenNode("", "", "");
    }
  }

  private void ensureParagraph() {
    ensureArticle();
    if (open[PARAGRAPH] == null) {
      attach(PARAGRAPH, new OpenNode("", "", ""));
      paragraphs++;
      virtualParagraphs++;
    }
  }

  /**
   * Handles a subitem or sub-subitem whose parent level is not open.
   *
   * @return {@code true} if the parent chain now exists and the node should be opened
   */
  private boolean resolveOrphan(int level, String symbol, String text) {
    String label = level == SUBITEM ? "subitem" : "sub-subitem";
    if (orphanPolicy == OrphanPolicy.DISCARD) {
      orphansDropped++;
      log.warn(
          "Document {}: dropped {} '{}' with no open parent (text: '{}')",
          documentId,
          label,
          symbol,
          text);
      return false;
    }

    ensureParagraph();
    if (open[ITEM] == null) {
      attach(ITEM, new OpenNode("", "", ""));
      items++;
      orphansSynthesized++;
    }
    if (level == SUB_SUBITEM && open[SUBITEM] == null) {
      attach(SUBITEM, new OpenNode("", "", ""));
      subitems++;
      orphansSynthesized++;
    }
    log.debug("Document {}: synthesized parent for {} '{}'", documentId, label, symbol);
    return true;
  }

  private void closeArticle() {
    OpenNode article = open[ARTICLE];
    closeFrom(ARTICLE);
    if (article != null) {
      articles.add(toArticle(article));
    }
  }

  private void checkNotFinished() {
    if (finished) {
      throw new IllegalStateException("Document " + documentId + " is already finished");
    }
  }

  // ---- conversion to the immutable tree ----

  private Article toArticle(OpenNode node) {
    return new Article(
        node.symbol,
        node.title,
        normalize(node.text),
        node.children.stream().map(this::toParagraph).toList());
  }

  private Paragraph toParagraph(OpenNode node) {
    return new Paragraph(
        node.symbol, normalize(node.text), node.children.stream().map(this::toItem).toList());
  }

  private Item toItem(OpenNode node) {
    return new Item(
        node.symbol, normalize(node.text), node.children.stream().map(this::toSubitem).toList());
  }

  private Subitem toSubitem(OpenNode node) {
    return new Subitem(
        node.symbol,
        normalize(node.text),
        node.children.stream().map(this::toSubSubitem).toList());
  }

  private SubSubitem toSubSubitem(OpenNode node) {
    return new SubSubitem(node.symbol, normalize(node.text));
  }

  private static String normalize(StringBuilder text) {
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  /** A node under construction. For articles {@code symbol} holds the article number. */
  private static final class OpenNode {
    private final String symbol;
    private final String title;
    private final StringBuilder text;
    private final List<OpenNode> children = new ArrayList<>();

    private OpenNode(String symbol, String title, String text) {
      this.symbol = symbol;
      this.title = title;
      this.text = new StringBuilder(text);
    }

    private void append(String more) {
      text.append(' ').append(more);
    }
  }
}
