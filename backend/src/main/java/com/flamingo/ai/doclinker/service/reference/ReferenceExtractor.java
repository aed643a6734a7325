package com.flamingo.ai.doclinker.service.reference;

import com.flamingo.ai.doclinker.config.LinkerConfig;
import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import com.flamingo.ai.doclinker.domain.enums.LayoutType;
import com.flamingo.ai.doclinker.domain.model.BoundingBox;
import com.flamingo.ai.doclinker.domain.model.LayoutElement;
import com.flamingo.ai.doclinker.domain.model.ReferenceMention;
import com.flamingo.ai.doclinker.domain.model.TextBlock;
import com.flamingo.ai.doclinker.service.vocabulary.TypeVocabulary;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds reference mentions such as {@code "Fig. 2.6"}, {@code "Tables 3 and 4"} or {@code
 * "(1.4)"} in body text.
 *
 * <p>Keyword references take their type from the keyword table. A bare parenthesized number is an
 * equation reference, but only when it follows the equation numbering convention and no keyword
 * precedes it. Where matches overlap, the longest span wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceExtractor {

  private final TypeVocabulary vocabulary;
  private final LinkerConfig linkerConfig;

  /** One matched span; enumerations carry several identifiers. */
  private record Span(int start, int end, CanonicalType type, List<IdSegment> ids) {
    int length() {
      return end - start;
    }

    boolean overlaps(Span other) {
      return start < other.end && other.start < end;
    }
  }

  private record IdSegment(String id, int start, int end) {}

  /**
   * Selects the blocks that count as body text: blocks used as captions, blocks inside caption or
   * title regions and, when configured, blocks lying inside figure regions are left out.
   *
   * @param blocks all text blocks on the page
   * @param elements layout elements on the page
   * @param captionBlocks blocks the caption locator consumed as captions
   * @return body text blocks in their original order
   */
  public List<TextBlock> bodyBlocks(
      List<TextBlock> blocks, List<LayoutElement> elements, Set<TextBlock> captionBlocks) {
    LinkerConfig.Reference settings = linkerConfig.getReference();
    List<BoundingBox> captionRegions = new ArrayList<>();
    List<BoundingBox> figureRegions = new ArrayList<>();
    for (LayoutElement element : elements) {
      LayoutType type = vocabulary.layoutTypeOf(element);
      if (type == LayoutType.CAPTION || type == LayoutType.TITLE) {
        captionRegions.add(element.bbox());
      } else if (type.isFigureLike()) {
        figureRegions.add(element.bbox());
      }
    }

    List<TextBlock> body = new ArrayList<>();
    for (TextBlock block : blocks) {
      BoundingBox box = block.bbox();
      if (captionBlocks.contains(block)) {
        continue;
      }
      if (captionRegions.stream().anyMatch(r -> r.containsPoint(box.centerX(), box.centerY()))) {
        continue;
      }
      if (settings.isExcludeTextInsideFigures()
          && box.area() > 0
          && figureRegions.stream()
              .anyMatch(
                  r -> r.intersectionArea(box) / box.area() >= settings.getInsideFigureOverlap())) {
        continue;
      }
      body.add(block);
    }
    return body;
  }

  /**
   * Extracts reference mentions from body text blocks.
   *
   * @param bodyBlocks blocks selected by {@link #bodyBlocks}
   * @param pageIdx page the blocks belong to
   * @param classifier span classifier, {@link ReferenceSpanClassifier#NONE} when absent
   * @return unresolved mentions in reading order of the blocks
   */
  public List<ReferenceMention> extract(
      List<TextBlock> bodyBlocks, int pageIdx, ReferenceSpanClassifier classifier) {
    List<ReferenceMention> mentions = new ArrayList<>();
    for (TextBlock block : bodyBlocks) {
      if (block.text() == null || block.text().isBlank()) {
        continue;
      }
      for (Span span : selectLongest(findSpans(block.text()))) {
        mentions.addAll(toMentions(block, span, pageIdx, classifier));
      }
    }
    log.debug("Page {}: extracted {} reference mentions", pageIdx, mentions.size());
    return mentions;
  }

  private List<Span> findSpans(String text) {
    List<Span> spans = new ArrayList<>();

    Matcher keyword = vocabulary.keywordReferencePattern().matcher(text);
    while (keyword.find()) {
      CanonicalType type = vocabulary.canonicalTypeOf(keyword.group("kw")).orElse(null);
      if (type == null) {
        continue;
      }
      List<IdSegment> ids = new ArrayList<>();
      Matcher id = TypeVocabulary.identifierPattern().matcher(text);
      id.region(keyword.start("ids"), keyword.end("ids"));
      while (id.find()) {
        ids.add(new IdSegment(TypeVocabulary.normalizeIdentifier(id.group()), id.start(), id.end()));
      }
      if (!ids.isEmpty()) {
        spans.add(new Span(keyword.start(), keyword.end(), type, ids));
      }
    }

    Matcher bare = vocabulary.bareEquationPattern().matcher(text);
    while (bare.find()) {
      spans.add(
          new Span(
              bare.start(),
              bare.end(),
              CanonicalType.EQUATION,
              List.of(
                  new IdSegment(
                      TypeVocabulary.normalizeIdentifier(bare.group("id")),
                      bare.start("id"),
                      bare.end("id")))));
    }
    return spans;
  }

  /** Keeps non-overlapping spans, longest first, earliest start breaking ties. */
  private List<Span> selectLongest(List<Span> spans) {
    List<Span> ordered = new ArrayList<>(spans);
    ordered.sort(Comparator.comparingInt(Span::length).reversed().thenComparingInt(Span::start));
    List<Span> kept = new ArrayList<>();
    for (Span span : ordered) {
      if (kept.stream().noneMatch(span::overlaps)) {
        kept.add(span);
      }
    }
    kept.sort(Comparator.comparingInt(Span::start));
    return kept;
  }

  private List<ReferenceMention> toMentions(
      TextBlock block, Span span, int pageIdx, ReferenceSpanClassifier classifier) {
    String spanText = block.text().substring(span.start(), span.end());
    double factor = classifier.probability(spanText, block).orElse(1.0);
    double confidence =
        linkerConfig.getReference().getBaselineConfidence() * Math.max(0.0, Math.min(1.0, factor));

    List<ReferenceMention> mentions = new ArrayList<>();
    for (int i = 0; i < span.ids().size(); i++) {
      IdSegment segment = span.ids().get(i);
      int from = i == 0 ? span.start() : segment.start();
      int to = span.ids().size() == 1 ? span.end() : segment.end();
      mentions.add(
          new ReferenceMention(
              spanText,
              estimateBox(block, from, to),
              pageIdx,
              span.type(),
              segment.id(),
              confidence));
    }
    return mentions;
  }

  /** Approximates the box of a character range assuming uniform character width. */
  private BoundingBox estimateBox(TextBlock block, int start, int end) {
    BoundingBox box = block.bbox();
    int length = block.text().length();
    if (length == 0 || box.width() == 0) {
      return box;
    }
    double charWidth = box.width() / length;
    double x = box.x() + start * charWidth;
    double width = Math.min((end - start) * charWidth, box.right() - x);
    return new BoundingBox(x, box.y(), Math.max(0.0, width), box.height());
  }
}
