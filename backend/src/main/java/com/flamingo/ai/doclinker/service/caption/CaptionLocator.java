package com.flamingo.ai.doclinker.service.caption;

import com.flamingo.ai.doclinker.config.LinkerConfig;
import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import com.flamingo.ai.doclinker.domain.model.BoundingBox;
import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import com.flamingo.ai.doclinker.domain.model.LayoutElement;
import com.flamingo.ai.doclinker.domain.model.TextBlock;
import com.flamingo.ai.doclinker.service.vocabulary.DeclaredIdentifier;
import com.flamingo.ai.doclinker.service.vocabulary.TypeVocabulary;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds the caption of a figure-like layout element and reads its declared identifier.
 *
 * <p>The neighbourhood is searched in priority order: directly below the element, then above,
 * then in the same horizontal band to the right. Within one band the candidate with the smallest
 * vertical gap wins, then the one with the smallest horizontal offset.
 *
 * <p>A caption block is shared only by elements of the same detector type, such as the panels of
 * one figure. When elements of different types reach the same block, the best placed one keeps it
 * and the others fall back to their next candidate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaptionLocator {

  private static final Comparator<CaptionMatch> BEST_FIRST =
      Comparator.comparing(CaptionMatch::position)
          .thenComparingDouble(CaptionMatch::verticalGap)
          .thenComparingDouble(CaptionMatch::horizontalOffset);

  private final TypeVocabulary vocabulary;
  private final LinkerConfig linkerConfig;

  /**
   * Caption search distance for a page: the configured factor times the median text line height.
   *
   * @param pageBlocks all text blocks on the page
   * @return search distance in page units
   */
  public double captionSearchDistance(List<TextBlock> pageBlocks) {
    double[] heights =
        pageBlocks.stream()
            .map(TextBlock::bbox)
            .mapToDouble(BoundingBox::height)
            .filter(height -> height > 0)
            .sorted()
            .toArray();
    double lineHeight;
    if (heights.length == 0) {
      lineHeight = linkerConfig.getCaption().getDefaultLineHeight();
    } else if (heights.length % 2 == 1) {
      lineHeight = heights[heights.length / 2];
    } else {
      lineHeight = (heights[heights.length / 2 - 1] + heights[heights.length / 2]) / 2.0;
    }
    return lineHeight * linkerConfig.getCaption().getSearchFactor();
  }

  /**
   * Searches the element's neighbourhood for caption text.
   *
   * @param element a figure-like layout element
   * @param pageBlocks all text blocks on the element's page
   * @param searchDistance maximum gap between element and caption
   * @return the best caption, or empty when none qualifies
   */
  public Optional<CaptionMatch> locate(
      LayoutElement element, List<TextBlock> pageBlocks, double searchDistance) {
    Optional<CaptionMatch> best =
        candidates(element, pageBlocks, searchDistance).stream().findFirst();
    best.ifPresent(match -> logMatch(element, match));
    return best;
  }

  /**
   * Locates captions for all figure-like elements of a page at once.
   *
   * @param elements figure-like layout elements of one page
   * @param pageBlocks all text blocks on the page
   * @param searchDistance maximum gap between element and caption
   * @return one entry per element, in the order given
   */
  public List<Optional<CaptionMatch>> locateAll(
      List<LayoutElement> elements, List<TextBlock> pageBlocks, double searchDistance) {
    List<List<CaptionMatch>> ranked = new ArrayList<>(elements.size());
    List<CanonicalType> detectorTypes = new ArrayList<>(elements.size());
    for (LayoutElement element : elements) {
      ranked.add(candidates(element, pageBlocks, searchDistance));
      detectorTypes.add(vocabulary.layoutTypeOf(element).canonicalType().orElse(null));
    }
    int[] choice = new int[elements.size()];

    boolean changed = true;
    while (changed) {
      changed = false;
      Map<TextBlock, Integer> owners = new HashMap<>();
      for (int i = 0; i < elements.size(); i++) {
        CaptionMatch match = current(ranked, choice, i);
        if (match == null) {
          continue;
        }
        Integer owner = owners.get(match.block());
        if (owner == null || BEST_FIRST.compare(match, current(ranked, choice, owner)) < 0) {
          owners.put(match.block(), i);
        }
      }
      for (int i = 0; i < elements.size(); i++) {
        CaptionMatch match = current(ranked, choice, i);
        if (match == null) {
          continue;
        }
        int owner = owners.get(match.block());
        if (owner != i && detectorTypes.get(owner) != detectorTypes.get(i)) {
          log.debug(
              "Caption '{}' already taken by element {}, skipping it for element {}",
              match.block().text(),
              elements.get(owner).elementId(),
              elements.get(i).elementId());
          choice[i]++;
          changed = true;
        }
      }
    }

    List<Optional<CaptionMatch>> result = new ArrayList<>(elements.size());
    for (int i = 0; i < elements.size(); i++) {
      CaptionMatch match = current(ranked, choice, i);
      if (match != null) {
        logMatch(elements.get(i), match);
      }
      result.add(Optional.ofNullable(match));
    }
    return result;
  }

  /**
   * Creates the figure record for a layout element. A caption, when present, overrides the type
   * reported by the detector; without one the record keeps the detector type and no identifier,
   * leaving it to fallback numbering.
   */
  public FigureRecord createRecord(LayoutElement element, Optional<CaptionMatch> caption) {
    CanonicalType detectorType =
        vocabulary
            .layoutTypeOf(element)
            .canonicalType()
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "Element " + element.elementId() + " is not figure-like"));
    FigureRecord record = new FigureRecord(element, detectorType);
    caption.ifPresent(
        match ->
            record.applyCaption(
                match.identifier().id(), match.identifier().type(), match.block().text().trim()));
    return record;
  }

  private List<CaptionMatch> candidates(
      LayoutElement element, List<TextBlock> pageBlocks, double searchDistance) {
    boolean equation =
        vocabulary.layoutTypeOf(element).canonicalType().orElse(null) == CanonicalType.EQUATION;
    List<CaptionMatch> matches = new ArrayList<>();
    for (CaptionPosition position : CaptionPosition.values()) {
      for (TextBlock block : pageBlocks) {
        candidate(element.bbox(), block, position, searchDistance, equation)
            .ifPresent(matches::add);
      }
    }
    matches.sort(BEST_FIRST);
    return matches;
  }

  private static CaptionMatch current(List<List<CaptionMatch>> ranked, int[] choice, int index) {
    List<CaptionMatch> matches = ranked.get(index);
    return choice[index] < matches.size() ? matches.get(choice[index]) : null;
  }

  private static void logMatch(LayoutElement element, CaptionMatch match) {
    log.debug(
        "Caption '{}' found {} element {}",
        match.block().text(),
        match.position().name().toLowerCase(Locale.ROOT),
        element.elementId());
  }

  private Optional<CaptionMatch> candidate(
      BoundingBox figure,
      TextBlock block,
      CaptionPosition position,
      double searchDistance,
      boolean equation) {
    BoundingBox box = block.bbox();
    double verticalGap;
    double horizontalOffset;
    switch (position) {
      case BELOW -> {
        if (box.centerY() <= figure.bottom()
            || !box.overlapsHorizontally(figure)
            || box.y() - figure.bottom() > searchDistance) {
          return Optional.empty();
        }
        verticalGap = Math.max(0.0, box.y() - figure.bottom());
        horizontalOffset = Math.abs(box.centerX() - figure.centerX());
      }
      case ABOVE -> {
        if (box.centerY() >= figure.y()
            || !box.overlapsHorizontally(figure)
            || figure.y() - box.bottom() > searchDistance) {
          return Optional.empty();
        }
        verticalGap = Math.max(0.0, figure.y() - box.bottom());
        horizontalOffset = Math.abs(box.centerX() - figure.centerX());
      }
      default -> {
        if (box.centerX() <= figure.right()
            || !box.overlapsVertically(figure)
            || box.x() - figure.right() > searchDistance) {
          return Optional.empty();
        }
        verticalGap = Math.abs(box.centerY() - figure.centerY());
        horizontalOffset = Math.max(0.0, box.x() - figure.right());
      }
    }

    Optional<DeclaredIdentifier> identifier = vocabulary.matchCaption(block.text());
    if (identifier.isEmpty() && equation && position == CaptionPosition.RIGHT) {
      identifier = vocabulary.matchEquationNumber(block.text());
    }
    return identifier.map(
        id -> new CaptionMatch(block, id, position, verticalGap, horizontalOffset));
  }
}
