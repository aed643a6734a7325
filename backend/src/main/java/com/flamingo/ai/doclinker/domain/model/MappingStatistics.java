package com.flamingo.ai.doclinker.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Document-wide reference resolution counts. */
public record MappingStatistics(
    @JsonProperty("total_references") int totalReferences,
    @JsonProperty("matched_references") int matchedReferences,
    @JsonProperty("match_rate") double matchRate) {

  public static MappingStatistics of(int total, int matched) {
    return new MappingStatistics(total, matched, total == 0 ? 0.0 : (double) matched / total);
  }
}
