package com.flamingo.ai.doclinker.service.linker;

import com.flamingo.ai.doclinker.domain.enums.LayoutType;
import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import com.flamingo.ai.doclinker.domain.model.LayoutElement;
import com.flamingo.ai.doclinker.domain.model.ReferenceMention;
import com.flamingo.ai.doclinker.domain.model.TextBlock;
import com.flamingo.ai.doclinker.service.caption.CaptionLocator;
import com.flamingo.ai.doclinker.service.caption.CaptionMatch;
import com.flamingo.ai.doclinker.service.grouping.ElementGrouper;
import com.flamingo.ai.doclinker.service.grouping.GroupingContext;
import com.flamingo.ai.doclinker.service.reference.ReferenceExtractor;
import com.flamingo.ai.doclinker.service.reference.ReferenceSpanClassifier;
import com.flamingo.ai.doclinker.service.reference.SpanScoreTable;
import com.flamingo.ai.doclinker.service.vocabulary.TypeVocabulary;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs the page-local stages for one page: caption location, page-local grouping and reference
 * extraction. Only touches the records and blocks of its own page, so pages can run concurrently.
 */
@Slf4j
@Component
public class PageLinker {

  private final TypeVocabulary vocabulary;
  private final CaptionLocator captionLocator;
  private final ElementGrouper elementGrouper;
  private final ReferenceExtractor referenceExtractor;
  private final ReferenceSpanClassifier spanClassifier;

  public PageLinker(
      TypeVocabulary vocabulary,
      CaptionLocator captionLocator,
      ElementGrouper elementGrouper,
      ReferenceExtractor referenceExtractor,
      Optional<ReferenceSpanClassifier> spanClassifier) {
    this.vocabulary = vocabulary;
    this.captionLocator = captionLocator;
    this.elementGrouper = elementGrouper;
    this.referenceExtractor = referenceExtractor;
    this.spanClassifier = spanClassifier.orElse(ReferenceSpanClassifier.NONE);
  }

  public PageLinkResult link(SanitizedPage page) {
    List<TextBlock> blocks = page.blocks();
    List<LayoutElement> elements = withCaptionText(page.elements(), blocks);
    double searchDistance = captionLocator.captionSearchDistance(blocks);

    List<LayoutElement> figureLike = new ArrayList<>();
    List<LayoutElement> unattached = new ArrayList<>();
    for (LayoutElement element : elements) {
      if (vocabulary.layoutTypeOf(element).isFigureLike()) {
        figureLike.add(element);
      } else {
        unattached.add(element);
      }
    }

    List<Optional<CaptionMatch>> captions =
        captionLocator.locateAll(figureLike, blocks, searchDistance);
    List<FigureRecord> records = new ArrayList<>(figureLike.size());
    Set<TextBlock> captionBlocks = new HashSet<>();
    for (int i = 0; i < figureLike.size(); i++) {
      Optional<CaptionMatch> caption = captions.get(i);
      caption.ifPresent(match -> captionBlocks.add(match.block()));
      records.add(captionLocator.createRecord(figureLike.get(i), caption));
    }

    List<FigureRecord> grouped =
        elementGrouper.groupPage(
            GroupingContext.forPage(page.index(), records, unattached, searchDistance));

    List<TextBlock> body = referenceExtractor.bodyBlocks(blocks, elements, captionBlocks);
    List<ReferenceMention> references =
        referenceExtractor.extract(body, page.index(), classifierFor(page));

    log.debug(
        "Page {}: {} elements, {} figure records, {} references",
        page.index(),
        elements.size(),
        grouped.size(),
        references.size());
    return new PageLinkResult(page, List.copyOf(grouped), references);
  }

  /** Page-supplied span scores take precedence; the injected classifier covers the rest. */
  private ReferenceSpanClassifier classifierFor(SanitizedPage page) {
    if (page.spanScores().isEmpty()) {
      return spanClassifier;
    }
    SpanScoreTable table = new SpanScoreTable(page.spanScores());
    return (span, block) -> {
      OptionalDouble score = table.probability(span, block);
      return score.isPresent() ? score : spanClassifier.probability(span, block);
    };
  }

  /** Caption elements without recognized text take the text of the blocks inside them. */
  private List<LayoutElement> withCaptionText(
      List<LayoutElement> elements, List<TextBlock> blocks) {
    List<LayoutElement> result = new ArrayList<>(elements.size());
    for (LayoutElement element : elements) {
      if (element.hasText() || vocabulary.layoutTypeOf(element) != LayoutType.CAPTION) {
        result.add(element);
        continue;
      }
      String text =
          blocks.stream()
              .filter(b -> element.bbox().containsPoint(b.bbox().centerX(), b.bbox().centerY()))
              .map(TextBlock::text)
              .map(String::trim)
              .filter(t -> !t.isEmpty())
              .collect(Collectors.joining(" "));
      result.add(text.isEmpty() ? element : element.withRawText(text));
    }
    return result;
  }
}
