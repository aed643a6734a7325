package com.flamingo.ai.doclinker.service.grouping;

import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Merges layout elements that represent the same logical figure.
 *
 * <p>On a page the strategies run in a fixed order: identifier match, pattern match, proximity
 * fallback. After every page has been processed the identifier strategy runs once more over the
 * whole document, which is the only cross-page merge.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ElementGrouper {

  private final IdentifierMatchStrategy identifierMatchStrategy;
  private final PatternMatchStrategy patternMatchStrategy;
  private final ProximityMergeStrategy proximityMergeStrategy;

  /**
   * Groups the records and free-standing elements of one page.
   *
   * @param context page records and unattached elements; mutated in place
   * @return the grouped records of the page
   */
  public List<FigureRecord> groupPage(GroupingContext context) {
    int before = context.getRecords().size();
    for (GroupingStrategy strategy : pageStrategies()) {
      strategy.group(context);
    }
    log.debug(
        "Page {}: {} records grouped into {}, {} elements left unattached",
        context.getPageIdx(),
        before,
        context.getRecords().size(),
        context.getUnattachedElements().size());
    return context.getRecords();
  }

  /**
   * Merges records across pages that declare the same identifier and type. Must only run after
   * every page has finished its page-local grouping.
   *
   * @param records all records of the document
   * @return the merged records
   */
  public List<FigureRecord> groupDocument(List<FigureRecord> records) {
    GroupingContext context = GroupingContext.forDocument(records);
    identifierMatchStrategy.group(context);
    return context.getRecords();
  }

  private List<GroupingStrategy> pageStrategies() {
    return List.of(identifierMatchStrategy, patternMatchStrategy, proximityMergeStrategy);
  }
}
