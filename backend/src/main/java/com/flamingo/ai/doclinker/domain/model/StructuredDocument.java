package com.flamingo.ai.doclinker.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * The linked document: pages with their resolved references, every figure-like object, and match
 * statistics.
 *
 * @param metadata descriptive metadata
 * @param pages pages in index order
 * @param figures figure records ordered by page, then top-to-bottom
 * @param mappingStatistics document-wide resolution counts
 * @param typeStatistics resolution counts keyed by canonical type label
 * @param processingInfo pipeline and data-quality counters
 */
public record StructuredDocument(
    DocumentMetadata metadata,
    List<Page> pages,
    List<FigureRecord> figures,
    @JsonProperty("mapping_statistics") MappingStatistics mappingStatistics,
    @JsonProperty("type_statistics") Map<String, TypeStatistics> typeStatistics,
    @JsonProperty("processing_info") ProcessingInfo processingInfo) {

  /** All references across pages, in page order. */
  public List<ReferenceMention> allReferences() {
    return pages.stream().flatMap(page -> page.references().stream()).toList();
  }
}
