package com.flamingo.ai.doclinker.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line or paragraph of OCR output.
 *
 * @param text recognized text
 * @param bbox position on the page; {@code null} marks malformed input
 * @param confidence recognizer confidence in [0, 1]
 * @param pageIdx 0-based page index
 */
public record TextBlock(
    String text, BoundingBox bbox, double confidence, @JsonProperty("page_idx") int pageIdx) {}
