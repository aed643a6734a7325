package com.flamingo.ai.doclinker.config;

import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import com.flamingo.ai.doclinker.domain.enums.LayoutType;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the document structure linker. */
@Configuration
@ConfigurationProperties(prefix = "linker")
@Getter
@Setter
public class LinkerConfig {

  private Caption caption = new Caption();
  private Grouping grouping = new Grouping();
  private Reference reference = new Reference();
  private Mapping mapping = new Mapping();
  private Vocabulary vocabulary = new Vocabulary();
  private Execution execution = new Execution();
  private Cli cli = new Cli();

  @Getter
  @Setter
  public static class Caption {
    /** Caption search distance as a multiple of the page's median text line height. */
    private double searchFactor = 1.5;

    /** Line height assumed for pages without any text blocks. */
    private double defaultLineHeight = 12.0;
  }

  @Getter
  @Setter
  public static class Grouping {
    /** Maximum gap, in page units, for folding a sub-element into a nearby figure. */
    private double proximityMergeDistance = 25.0;
  }

  @Getter
  @Setter
  public static class Reference {
    /** Confidence of a pattern match before the span classifier factor is applied. */
    private double baselineConfidence = 0.7;

    /** Skip text blocks that sit inside figure regions (axis labels, diagram annotations). */
    private boolean excludeTextInsideFigures = true;

    /** Fraction of a block's area that must fall inside a figure region to count as inside. */
    private double insideFigureOverlap = 0.5;
  }

  @Getter
  @Setter
  public static class Mapping {
    /** Minimum edge weight for accepting a reference-to-figure assignment. */
    private double matchThreshold = 0.5;

    private double exactIdWeight = 0.6;
    private double prefixIdWeight = 0.2;
    private double samePageWeight = 0.1;

    /** Awarded when the document holds exactly one figure of the reference's type. */
    private double soleFigureWeight = 0.1;
  }

  /**
   * Open vocabularies. Keys are matched case-insensitively; entries supplied through configuration
   * are added to the defaults below.
   */
  @Getter
  @Setter
  public static class Vocabulary {
    private Map<String, CanonicalType> keywords = defaultKeywords();
    private Map<String, LayoutType> layoutLabels = defaultLayoutLabels();

    private static Map<String, CanonicalType> defaultKeywords() {
      Map<String, CanonicalType> keywords = new LinkedHashMap<>();
      for (String keyword :
          new String[] {
            "fig", "figs", "figure", "figures", "chart", "graph", "diagram", "image", "picture",
            "그림"
          }) {
        keywords.put(keyword, CanonicalType.FIGURE);
      }
      for (String keyword : new String[] {"tab", "tabs", "table", "tables", "표"}) {
        keywords.put(keyword, CanonicalType.TABLE);
      }
      for (String keyword :
          new String[] {"eq", "eqs", "eqn", "equation", "equations", "formula", "식", "수식"}) {
        keywords.put(keyword, CanonicalType.EQUATION);
      }
      for (String keyword : new String[] {"alg", "algo", "algorithm", "algorithms", "알고리즘"}) {
        keywords.put(keyword, CanonicalType.ALGORITHM);
      }
      for (String keyword : new String[] {"ex", "example", "examples", "예제"}) {
        keywords.put(keyword, CanonicalType.EXAMPLE);
      }
      return keywords;
    }

    private static Map<String, LayoutType> defaultLayoutLabels() {
      Map<String, LayoutType> labels = new LinkedHashMap<>();
      for (String label : new String[] {"figure", "picture", "image", "chart", "graph", "diagram"}) {
        labels.put(label, LayoutType.FIGURE);
      }
      labels.put("table", LayoutType.TABLE);
      for (String label : new String[] {"equation", "formula", "isolate_formula"}) {
        labels.put(label, LayoutType.EQUATION);
      }
      labels.put("algorithm", LayoutType.ALGORITHM);
      for (String label :
          new String[] {
            "caption",
            "figure_caption",
            "figure_title",
            "table_caption",
            "table_title",
            "chart_title",
            "formula_caption",
            "number"
          }) {
        labels.put(label, LayoutType.CAPTION);
      }
      for (String label : new String[] {"title", "doc_title", "paragraph_title", "header"}) {
        labels.put(label, LayoutType.TITLE);
      }
      labels.put("text", LayoutType.TEXT);
      return labels;
    }
  }

  @Getter
  @Setter
  public static class Execution {
    /** Run the page-local stages concurrently on the page linking executor. */
    private boolean parallelPages = true;

    private int corePoolSize = 2;
    private int maxPoolSize = 4;
  }

  /** One-shot linking of a JSON input file at startup. */
  @Getter
  @Setter
  public static class Cli {
    /** Path of a document input JSON file; the runner is inactive when unset. */
    private String input;

    /** Path the linked document is written to; logged only when unset. */
    private String output;
  }
}
