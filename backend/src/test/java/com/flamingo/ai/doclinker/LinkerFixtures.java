package com.flamingo.ai.doclinker;

import com.flamingo.ai.doclinker.config.LinkerConfig;
import com.flamingo.ai.doclinker.domain.model.BoundingBox;
import com.flamingo.ai.doclinker.domain.model.LayoutElement;
import com.flamingo.ai.doclinker.domain.model.TextBlock;
import com.flamingo.ai.doclinker.service.aggregation.DocumentAggregator;
import com.flamingo.ai.doclinker.service.caption.CaptionLocator;
import com.flamingo.ai.doclinker.service.grouping.ElementGrouper;
import com.flamingo.ai.doclinker.service.grouping.IdentifierMatchStrategy;
import com.flamingo.ai.doclinker.service.grouping.PatternMatchStrategy;
import com.flamingo.ai.doclinker.service.grouping.ProximityMergeStrategy;
import com.flamingo.ai.doclinker.service.linker.DocumentStructureLinker;
import com.flamingo.ai.doclinker.service.linker.InputSanitizer;
import com.flamingo.ai.doclinker.service.linker.PageLinker;
import com.flamingo.ai.doclinker.service.mapping.StructureMapper;
import com.flamingo.ai.doclinker.service.reference.ReferenceExtractor;
import com.flamingo.ai.doclinker.service.vocabulary.TypeVocabulary;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.concurrent.Executor;

/** Builders for text blocks, layout elements and a fully wired linker. */
public final class LinkerFixtures {

  private LinkerFixtures() {}

  public static TextBlock block(String text, double x, double y, double width, double height) {
    return blockOn(0, text, x, y, width, height);
  }

  public static TextBlock blockOn(
      int page, String text, double x, double y, double width, double height) {
    return new TextBlock(text, new BoundingBox(x, y, width, height), 0.95, page);
  }

  public static LayoutElement element(
      String id, String type, double x, double y, double width, double height) {
    return elementOn(0, id, type, x, y, width, height);
  }

  public static LayoutElement elementOn(
      int page, String id, String type, double x, double y, double width, double height) {
    return new LayoutElement(id, type, new BoundingBox(x, y, width, height), page, null, 0.9);
  }

  public static ElementGrouper grouper(LinkerConfig config, TypeVocabulary vocabulary) {
    return new ElementGrouper(
        new IdentifierMatchStrategy(),
        new PatternMatchStrategy(vocabulary),
        new ProximityMergeStrategy(config, vocabulary));
  }

  /** A linker wired from real components; {@code executor} runs the page tasks. */
  public static DocumentStructureLinker linker(
      LinkerConfig config, MeterRegistry registry, Executor executor) {
    TypeVocabulary vocabulary = new TypeVocabulary(config);
    ElementGrouper grouper = grouper(config, vocabulary);
    PageLinker pageLinker =
        new PageLinker(
            vocabulary,
            new CaptionLocator(vocabulary, config),
            grouper,
            new ReferenceExtractor(vocabulary, config),
            Optional.empty());
    return new DocumentStructureLinker(
        new InputSanitizer(registry),
        pageLinker,
        grouper,
        new DocumentAggregator(),
        new StructureMapper(config),
        config,
        registry,
        executor);
  }
}
