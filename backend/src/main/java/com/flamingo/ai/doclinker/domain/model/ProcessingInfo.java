package com.flamingo.ai.doclinker.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Data-quality and pipeline counters reported alongside the linked document. */
public record ProcessingInfo(
    @JsonProperty("total_layout_elements") int totalLayoutElements,
    @JsonProperty("malformed_elements") int malformedElements,
    @JsonProperty("grouped_figures") int groupedFigures,
    @JsonProperty("unlabeled_figures") int unlabeledFigures,
    @JsonProperty("matched_references") int matchedReferences,
    @JsonProperty("unmatched_references") int unmatchedReferences) {}
