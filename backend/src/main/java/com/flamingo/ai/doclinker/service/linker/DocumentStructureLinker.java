package com.flamingo.ai.doclinker.service.linker;

import com.flamingo.ai.doclinker.config.LinkerConfig;
import com.flamingo.ai.doclinker.domain.model.DocumentInput;
import com.flamingo.ai.doclinker.domain.model.DocumentMetadata;
import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import com.flamingo.ai.doclinker.domain.model.Page;
import com.flamingo.ai.doclinker.domain.model.PageInput;
import com.flamingo.ai.doclinker.domain.model.ReferenceMention;
import com.flamingo.ai.doclinker.domain.model.StructuredDocument;
import com.flamingo.ai.doclinker.exception.DocumentStructureException;
import com.flamingo.ai.doclinker.service.aggregation.DocumentAggregator;
import com.flamingo.ai.doclinker.service.grouping.ElementGrouper;
import com.flamingo.ai.doclinker.service.mapping.StructureMapper;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Links the figure-like objects of a document with the in-text references that point at them.
 *
 * <p>Input is sanitized page by page on the calling thread, so element ids are unique across the
 * document. Page-local stages then run concurrently, one task per page. All of them must finish
 * before the document-wide identifier merge, fallback numbering and reference mapping run on the
 * calling thread. A failure on any page fails the whole document.
 */
@Slf4j
@Service
public class DocumentStructureLinker {

  private final InputSanitizer inputSanitizer;
  private final PageLinker pageLinker;
  private final ElementGrouper elementGrouper;
  private final DocumentAggregator documentAggregator;
  private final StructureMapper structureMapper;
  private final LinkerConfig linkerConfig;
  private final MeterRegistry meterRegistry;
  private final Executor pageLinkingExecutor;

  public DocumentStructureLinker(
      InputSanitizer inputSanitizer,
      PageLinker pageLinker,
      ElementGrouper elementGrouper,
      DocumentAggregator documentAggregator,
      StructureMapper structureMapper,
      LinkerConfig linkerConfig,
      MeterRegistry meterRegistry,
      @Qualifier("pageLinkingExecutor") Executor pageLinkingExecutor) {
    this.inputSanitizer = inputSanitizer;
    this.pageLinker = pageLinker;
    this.elementGrouper = elementGrouper;
    this.documentAggregator = documentAggregator;
    this.structureMapper = structureMapper;
    this.linkerConfig = linkerConfig;
    this.meterRegistry = meterRegistry;
    this.pageLinkingExecutor = pageLinkingExecutor;
  }

  /**
   * Links one document.
   *
   * @param input per-page collaborator output
   * @return the structured document with every reference resolved or marked unmatched
   * @throws DocumentStructureException if the linked document would violate identifier uniqueness
   */
  @Timed(value = "linker.document", description = "Time to link one document")
  public StructuredDocument link(DocumentInput input) {
    DocumentMetadata metadata =
        input.metadata() != null ? input.metadata() : DocumentMetadata.untitled(0);
    String title = metadata.title();
    long start = System.currentTimeMillis();

    List<PageInput> pageInputs = new ArrayList<>(input.pages());
    pageInputs.sort(Comparator.comparingInt(PageInput::index));
    Set<String> elementIds = new HashSet<>();
    List<SanitizedPage> sanitized =
        pageInputs.stream().map(page -> inputSanitizer.sanitize(page, elementIds)).toList();
    List<PageLinkResult> results = linkPages(title, sanitized);

    List<FigureRecord> records =
        elementGrouper.groupDocument(
            results.stream().flatMap(result -> result.records().stream()).toList());
    int unlabeled = documentAggregator.assignFallbackIdentifiers(records);
    try {
      documentAggregator.verifyUniqueIdentifiers(title, records);
    } catch (DocumentStructureException e) {
      meterRegistry
          .counter("linker_errors_total", "error_type", "duplicate_identifier")
          .increment();
      log.error("Document '{}' failed the identifier check: {}", title, e.getMessage());
      throw e;
    }
    documentAggregator.assignSequenceInPage(records);

    List<ReferenceMention> references =
        results.stream().flatMap(result -> result.references().stream()).toList();
    int matched = structureMapper.resolve(references, records);

    List<Page> pages =
        results.stream()
            .map(
                result ->
                    new Page(
                        result.page().index(),
                        result.page().pageSize(),
                        result.page().blocks(),
                        result.references()))
            .toList();
    StructuredDocument document =
        documentAggregator.compose(
            metadata,
            pages,
            records,
            results.stream().mapToInt(result -> result.page().receivedElements()).sum(),
            results.stream().mapToInt(result -> result.page().malformedItems()).sum());

    recordMetrics(document, matched, references.size() - matched);
    log.info(
        "Linked '{}': {} pages, {} figures ({} unlabeled), {}/{} references matched in {}ms",
        title,
        pages.size(),
        records.size(),
        unlabeled,
        matched,
        references.size(),
        System.currentTimeMillis() - start);
    return document;
  }

  private List<PageLinkResult> linkPages(String title, List<SanitizedPage> pages) {
    if (!linkerConfig.getExecution().isParallelPages()) {
      return pages.stream().map(pageLinker::link).toList();
    }

    List<CompletableFuture<PageLinkResult>> futures =
        pages.stream()
            .map(
                page ->
                    CompletableFuture.supplyAsync(() -> pageLinker.link(page), pageLinkingExecutor))
            .toList();
    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    } catch (CompletionException e) {
      meterRegistry.counter("linker_errors_total", "error_type", "page_failure").increment();
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.error("Page linking failed for document '{}': {}", title, cause.getMessage(), cause);
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new DocumentStructureException(title, "Page linking failed", cause);
    }
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private void recordMetrics(StructuredDocument document, int matched, int unmatched) {
    meterRegistry.counter("linker_references_total", "outcome", "matched").increment(matched);
    meterRegistry.counter("linker_references_total", "outcome", "unmatched").increment(unmatched);
    for (FigureRecord figure : document.figures()) {
      meterRegistry.counter("linker_figures_total", "type", figure.getType().label()).increment();
    }
  }
}
