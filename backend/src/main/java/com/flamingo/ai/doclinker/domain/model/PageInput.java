package com.flamingo.ai.doclinker.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the upstream collaborators produced for one page.
 *
 * @param index 0-based page index
 * @param pageSize rendered page size
 * @param blocks OCR text blocks, possibly with duplicates or null entries
 * @param layoutElements layout detector regions, possibly with null entries
 * @param spanScores optional classifier output: span text to probability that it is a reference;
 *     entries with a null key or value are dropped
 */
public record PageInput(
    int index,
    @JsonProperty("page_size") PageSize pageSize,
    List<TextBlock> blocks,
    @JsonProperty("layout_elements") List<LayoutElement> layoutElements,
    @JsonProperty("span_scores") Map<String, Double> spanScores) {

  public PageInput {
    // Null entries are kept so the sanitizer can skip and count them.
    blocks = blocks == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(blocks));
    layoutElements =
        layoutElements == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(layoutElements));
    spanScores = spanScores == null ? Map.of() : scoresWithoutNulls(spanScores);
  }

  public PageInput(
      int index, PageSize pageSize, List<TextBlock> blocks, List<LayoutElement> layoutElements) {
    this(index, pageSize, blocks, layoutElements, Map.of());
  }

  private static Map<String, Double> scoresWithoutNulls(Map<String, Double> scores) {
    Map<String, Double> copy = new LinkedHashMap<>();
    scores.forEach(
        (span, score) -> {
          if (span != null && score != null) {
            copy.put(span, score);
          }
        });
    return Collections.unmodifiableMap(copy);
  }
}
