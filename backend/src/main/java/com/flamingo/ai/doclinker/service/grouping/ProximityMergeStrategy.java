package com.flamingo.ai.doclinker.service.grouping;

import com.flamingo.ai.doclinker.config.LinkerConfig;
import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import com.flamingo.ai.doclinker.domain.enums.GroupingMethod;
import com.flamingo.ai.doclinker.domain.enums.LayoutType;
import com.flamingo.ai.doclinker.domain.model.BoundingBox;
import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import com.flamingo.ai.doclinker.domain.model.LayoutElement;
import com.flamingo.ai.doclinker.service.vocabulary.TypeVocabulary;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Folds left-over sub-elements into a nearby figure record of a compatible type.
 *
 * <p>Two kinds of left-overs are handled: unlabeled figure records (sub-panels that never found a
 * caption) and free-standing elements the locator did not turn into records. Sub-panels only join
 * figure records; uncaptioned tables, equations and algorithms are separate objects and keep their
 * own records. The host keeps its identifier and type. Merging repeats until nothing changes,
 * because a grown box can bring further elements within reach.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProximityMergeStrategy implements GroupingStrategy {

  private final LinkerConfig linkerConfig;
  private final TypeVocabulary vocabulary;

  @Override
  public void group(GroupingContext context) {
    double threshold = linkerConfig.getGrouping().getProximityMergeDistance();
    int folded = 0;
    while (foldUnlabeledRecord(context, threshold) || foldUnattachedElement(context, threshold)) {
      folded++;
    }
    if (folded > 0) {
      log.debug(
          "{} folded {} sub-elements on page {} (threshold={})",
          getStrategyName(),
          folded,
          context.getPageIdx(),
          threshold);
    }
  }

  /** Folds one unlabeled figure panel into its nearest figure; false when none qualifies. */
  private boolean foldUnlabeledRecord(GroupingContext context, double threshold) {
    List<FigureRecord> records = context.getRecords();
    for (int i = 0; i < records.size(); i++) {
      FigureRecord candidate = records.get(i);
      if (candidate.getFigureId() != null || candidate.getType() != CanonicalType.FIGURE) {
        continue;
      }
      int hostIndex = nearest(candidate.getBbox(), CanonicalType.FIGURE, records, i, threshold);
      if (hostIndex < 0) {
        continue;
      }
      FigureRecord host = records.get(hostIndex);
      // Between two unlabeled panels the earlier one hosts, so repeated runs pick the same host.
      if (host.getFigureId() == null && hostIndex > i) {
        candidate.absorb(host, GroupingMethod.PROXIMITY);
        context.remove(host);
      } else {
        host.absorb(candidate, GroupingMethod.PROXIMITY);
        context.remove(candidate);
      }
      return true;
    }
    return false;
  }

  private boolean foldUnattachedElement(GroupingContext context, double threshold) {
    for (LayoutElement element : context.getUnattachedElements()) {
      LayoutType layoutType = vocabulary.layoutTypeOf(element);
      if (layoutType != LayoutType.CAPTION && !layoutType.isFigureLike()) {
        continue;
      }
      CanonicalType required = layoutType.canonicalType().orElse(null);
      int hostIndex = nearest(element.bbox(), required, context.getRecords(), -1, threshold);
      if (hostIndex < 0) {
        continue;
      }
      context.getRecords().get(hostIndex).addMember(element, GroupingMethod.PROXIMITY);
      context.attach(element);
      return true;
    }
    return false;
  }

  /**
   * Index of the record nearest to {@code box} within the threshold, or -1.
   *
   * @param requiredType canonical type the host must have; {@code null} accepts any type
   * @param skip record index to ignore
   */
  private int nearest(
      BoundingBox box,
      CanonicalType requiredType,
      List<FigureRecord> records,
      int skip,
      double threshold) {
    int best = -1;
    double bestGap = Double.MAX_VALUE;
    double bestCenter = Double.MAX_VALUE;
    for (int j = 0; j < records.size(); j++) {
      FigureRecord record = records.get(j);
      if (j == skip || (requiredType != null && record.getType() != requiredType)) {
        continue;
      }
      double gap = box.gapDistance(record.getBbox());
      if (gap > threshold) {
        continue;
      }
      double center = box.centerDistance(record.getBbox());
      if (gap < bestGap || (gap == bestGap && center < bestCenter)) {
        best = j;
        bestGap = gap;
        bestCenter = center;
      }
    }
    return best;
  }

  @Override
  public String getStrategyName() {
    return "ProximityMergeStrategy";
  }
}
