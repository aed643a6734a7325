package com.flamingo.ai.doclinker.service.grouping;

import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import com.flamingo.ai.doclinker.domain.enums.GroupingMethod;
import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Merges records that declare the same identifier for the same canonical type, e.g. two image
 * panels that both picked up the caption "Figure 3".
 *
 * <p>The earliest record (page, then top-to-bottom, then left-to-right) survives and absorbs the
 * others.
 */
@Slf4j
@Component
public class IdentifierMatchStrategy implements GroupingStrategy {

  private record Key(CanonicalType type, String figureId) {}

  @Override
  public void group(GroupingContext context) {
    Map<Key, List<FigureRecord>> byIdentifier = new LinkedHashMap<>();
    for (FigureRecord record : context.getRecords()) {
      if (record.isLabeled()) {
        byIdentifier
            .computeIfAbsent(new Key(record.getType(), record.getFigureId()), k -> new ArrayList<>())
            .add(record);
      }
    }

    int merged = 0;
    for (Map.Entry<Key, List<FigureRecord>> entry : byIdentifier.entrySet()) {
      List<FigureRecord> sameId = entry.getValue();
      if (sameId.size() < 2) {
        continue;
      }
      FigureRecord survivor = sameId.stream().min(FigureRecord.READING_ORDER).orElseThrow();
      for (FigureRecord other : sameId) {
        if (other != survivor) {
          survivor.absorb(other, GroupingMethod.IDENTIFIER);
          context.remove(other);
          merged++;
        }
      }
      log.debug(
          "Merged {} records declaring {} {}",
          sameId.size(),
          entry.getKey().type().label(),
          entry.getKey().figureId());
    }

    if (merged > 0) {
      log.debug(
          "{} merged {} records ({})",
          getStrategyName(),
          merged,
          context.isDocumentScope() ? "document" : "page " + context.getPageIdx());
    }
  }

  @Override
  public String getStrategyName() {
    return "IdentifierMatchStrategy";
  }
}
