package com.flamingo.ai.doclinker.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Reference resolution counts for a single canonical type. */
public record TypeStatistics(
    @JsonProperty("total_references") int totalReferences,
    @JsonProperty("matched_references") int matchedReferences,
    @JsonProperty("match_rate") double matchRate,
    @JsonProperty("figure_count") int figureCount) {

  public static TypeStatistics of(int total, int matched, int figures) {
    return new TypeStatistics(
        total, matched, total == 0 ? 0.0 : (double) matched / total, figures);
  }
}
