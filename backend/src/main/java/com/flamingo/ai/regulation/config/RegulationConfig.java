package com.flamingo.ai.regulation.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the regulation structuring pipeline. */
@Configuration
@ConfigurationProperties(prefix = "regulation")
@Getter
@Setter
public class RegulationConfig {

  private Parser parser = new Parser();
  private Batch batch = new Batch();
  private Output output = new Output();

  @Getter
  @Setter
  public static class Parser {
    /**
     * Substrings identifying running headers and footers stamped by the publishing authority. A
     * line containing any of them is dropped before classification.
     */
    private List<String> noiseMarkers = new ArrayList<>(List.of("법제처", "국가법령정보센터"));

    /** What to do with a subitem or sub-subitem enumerator that has no open parent. */
    private OrphanPolicy orphanPolicy = OrphanPolicy.DISCARD;

    /** Split a line at enumerators that appear after whitespace inside it. */
    private boolean inlineSplitEnabled = true;
  }

  @Getter
  @Setter
  public static class Batch {
    /** File extensions (without dot, lower case) picked up by directory conversion. */
    private List<String> inputExtensions = new ArrayList<>(List.of("pdf", "docx", "txt"));

    private String outputFileName = "output.json";
  }

  @Getter
  @Setter
  public static class Output {
    private boolean prettyPrint = true;
  }

  /** Handling of level-3/4 enumerators seen while no node of the parent level is open. */
  public enum OrphanPolicy {
    /** Drop the enumerator and its same-line text; log a warning. */
    DISCARD,
    /** Open an empty-symbol parent first, mirroring the virtual paragraph of items. */
    SYNTHESIZE
  }
}
