package com.flamingo.ai.doclinker.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import lombok.Getter;

/**
 * An in-text phrase pointing at a figure-like object, e.g. {@code "Fig. 2.6"} or {@code "(1.4)"}.
 *
 * <p>Created unresolved by the reference extractor and resolved exactly once by the structure
 * mapper.
 */
@Getter
@JsonPropertyOrder({
  "text",
  "bbox",
  "page_idx",
  "reference_type",
  "declared_id",
  "matched_figure_id",
  "confidence",
  "match_score",
  "not_matched"
})
public class ReferenceMention {

  private final String text;

  private final BoundingBox bbox;

  @JsonProperty("page_idx")
  private final int pageIdx;

  @JsonProperty("reference_type")
  private final CanonicalType referenceType;

  @JsonProperty("declared_id")
  private final String declaredId;

  private final double confidence;

  @JsonProperty("matched_figure_id")
  private String matchedFigureId;

  @JsonProperty("match_score")
  private double matchScore;

  @JsonProperty("not_matched")
  private boolean notMatched;

  @JsonIgnore private boolean resolved;

  public ReferenceMention(
      String text,
      BoundingBox bbox,
      int pageIdx,
      CanonicalType referenceType,
      String declaredId,
      double confidence) {
    this.text = text;
    this.bbox = bbox;
    this.pageIdx = pageIdx;
    this.referenceType = referenceType;
    this.declaredId = declaredId;
    this.confidence = confidence;
  }

  /** Links this mention to a figure. */
  public void resolveTo(String figureId, double score) {
    ensureUnresolved();
    this.matchedFigureId = figureId;
    this.matchScore = score;
    this.notMatched = false;
    this.resolved = true;
  }

  /** Leaves this mention visibly unmatched; {@code bestScore} is the best rejected edge, or 0. */
  public void markUnmatched(double bestScore) {
    ensureUnresolved();
    this.matchedFigureId = null;
    this.matchScore = bestScore;
    this.notMatched = true;
    this.resolved = true;
  }

  private void ensureUnresolved() {
    if (resolved) {
      throw new IllegalStateException("Reference '" + text + "' has already been resolved");
    }
  }
}
