package com.flamingo.ai.doclinker.service.grouping;

import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import com.flamingo.ai.doclinker.domain.enums.GroupingMethod;
import com.flamingo.ai.doclinker.domain.enums.LayoutType;
import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import com.flamingo.ai.doclinker.domain.model.LayoutElement;
import com.flamingo.ai.doclinker.service.vocabulary.DeclaredIdentifier;
import com.flamingo.ai.doclinker.service.vocabulary.TypeVocabulary;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Labels unlabeled figure records from free-standing caption elements.
 *
 * <p>A caption element is attached to its nearest record (by bounding-box center distance) only
 * when that record has no identifier yet and lies within the caption search distance. Captions
 * whose nearest record is already labeled are left for the proximity pass.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PatternMatchStrategy implements GroupingStrategy {

  private final TypeVocabulary vocabulary;

  @Override
  public void group(GroupingContext context) {
    List<LayoutElement> captions =
        context.getUnattachedElements().stream()
            .filter(element -> vocabulary.layoutTypeOf(element) == LayoutType.CAPTION)
            .filter(LayoutElement::hasText)
            .toList();

    for (LayoutElement caption : captions) {
      Optional<FigureRecord> nearest = nearestRecord(caption, context.getRecords());
      if (nearest.isEmpty()) {
        continue;
      }
      FigureRecord record = nearest.get();
      if (record.getFigureId() != null
          || caption.bbox().gapDistance(record.getBbox()) > context.getCaptionSearchDistance()) {
        continue;
      }

      Optional<DeclaredIdentifier> identifier = vocabulary.matchCaption(caption.rawText());
      if (identifier.isEmpty() && record.getType() == CanonicalType.EQUATION) {
        identifier = vocabulary.matchEquationNumber(caption.rawText());
      }
      if (identifier.isEmpty()) {
        continue;
      }

      record.applyCaption(
          identifier.get().id(), identifier.get().type(), caption.rawText().trim());
      record.addMember(caption, GroupingMethod.PATTERN);
      record.markContribution(GroupingMethod.PATTERN);
      context.attach(caption);
      log.debug(
          "Caption element {} labeled record {} as {} {}",
          caption.elementId(),
          record.getPrimaryElementId(),
          record.getType().label(),
          record.getFigureId());
    }
  }

  private Optional<FigureRecord> nearestRecord(LayoutElement caption, List<FigureRecord> records) {
    FigureRecord best = null;
    double bestDistance = Double.MAX_VALUE;
    for (FigureRecord record : records) {
      double distance = caption.bbox().centerDistance(record.getBbox());
      if (distance < bestDistance) {
        best = record;
        bestDistance = distance;
      }
    }
    return Optional.ofNullable(best);
  }

  @Override
  public String getStrategyName() {
    return "PatternMatchStrategy";
  }
}
