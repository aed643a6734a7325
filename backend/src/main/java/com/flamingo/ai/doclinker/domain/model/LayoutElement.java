package com.flamingo.ai.doclinker.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A region reported by the layout detector.
 *
 * @param elementId identifier unique within the document; derived from page and position when the
 *     detector does not supply one
 * @param type detector label from an open vocabulary, e.g. {@code Figure}, {@code Picture}, {@code
 *     Formula}
 * @param bbox position on the page; {@code null} marks malformed input
 * @param pageIdx 0-based page index
 * @param rawText text recognized inside the region, if any
 * @param confidence detector confidence in [0, 1]
 */
public record LayoutElement(
    @JsonProperty("element_id") String elementId,
    String type,
    BoundingBox bbox,
    @JsonProperty("page_idx") int pageIdx,
    @JsonProperty("raw_text") String rawText,
    double confidence) {

  public LayoutElement withElementId(String id) {
    return new LayoutElement(id, type, bbox, pageIdx, rawText, confidence);
  }

  public LayoutElement withRawText(String text) {
    return new LayoutElement(elementId, type, bbox, pageIdx, text, confidence);
  }

  public boolean hasText() {
    return rawText != null && !rawText.isBlank();
  }
}
