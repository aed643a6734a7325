package com.flamingo.ai.doclinker.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Linked output for one page.
 *
 * @param index 0-based page index
 * @param pageSize rendered page size
 * @param blocks de-duplicated OCR text blocks
 * @param references reference mentions found on this page, each resolved or marked unmatched
 */
public record Page(
    int index,
    @JsonProperty("page_size") PageSize pageSize,
    List<TextBlock> blocks,
    List<ReferenceMention> references) {}
