package com.flamingo.ai.doclinker.service.grouping;

import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import com.flamingo.ai.doclinker.domain.model.LayoutElement;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * Working set the grouping strategies operate on: the figure records in scope and the layout
 * elements not yet attached to any record. Strategies mutate both lists in place.
 */
@Getter
public class GroupingContext {

  /** Scope marker for the document-wide pass. */
  public static final int DOCUMENT_SCOPE = -1;

  private final int pageIdx;
  private final List<FigureRecord> records;
  private final List<LayoutElement> unattachedElements;
  private final double captionSearchDistance;

  private GroupingContext(
      int pageIdx,
      List<FigureRecord> records,
      List<LayoutElement> unattachedElements,
      double captionSearchDistance) {
    this.pageIdx = pageIdx;
    this.records = new ArrayList<>(records);
    this.unattachedElements = new ArrayList<>(unattachedElements);
    this.captionSearchDistance = captionSearchDistance;
  }

  public static GroupingContext forPage(
      int pageIdx,
      List<FigureRecord> records,
      List<LayoutElement> unattachedElements,
      double captionSearchDistance) {
    return new GroupingContext(pageIdx, records, unattachedElements, captionSearchDistance);
  }

  /** Context for the cross-page identifier pass; no free-standing elements take part. */
  public static GroupingContext forDocument(List<FigureRecord> records) {
    return new GroupingContext(DOCUMENT_SCOPE, records, List.of(), 0.0);
  }

  public void attach(LayoutElement element) {
    unattachedElements.remove(element);
  }

  public void remove(FigureRecord record) {
    records.remove(record);
  }

  public boolean isDocumentScope() {
    return pageIdx == DOCUMENT_SCOPE;
  }
}
