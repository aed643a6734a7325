package com.flamingo.ai.doclinker.service.linker;

import com.flamingo.ai.doclinker.domain.model.BoundingBox;
import com.flamingo.ai.doclinker.domain.model.LayoutElement;
import com.flamingo.ai.doclinker.domain.model.PageInput;
import com.flamingo.ai.doclinker.domain.model.TextBlock;
import com.flamingo.ai.doclinker.exception.MalformedInputException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates collaborator output before linking. Items without usable geometry are skipped with a
 * warning; the rest of the page is still processed. Element ids are kept unique across all pages
 * sanitized with the same id set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InputSanitizer {

  private final MeterRegistry meterRegistry;

  private record BlockKey(String text, BoundingBox bbox) {}

  public SanitizedPage sanitize(PageInput input) {
    return sanitize(input, new HashSet<>());
  }

  /**
   * Sanitizes one page of a document.
   *
   * @param input collaborator output for the page
   * @param documentElementIds element ids already used by earlier pages; updated with this page's
   * @return the page with malformed items removed
   */
  public SanitizedPage sanitize(PageInput input, Set<String> documentElementIds) {
    int pageIdx = input.index();
    int malformed = 0;

    Map<BlockKey, TextBlock> distinctBlocks = new LinkedHashMap<>();
    for (TextBlock block : input.blocks()) {
      try {
        validateBlock(pageIdx, block);
        TextBlock onPage =
            block.pageIdx() == pageIdx
                ? block
                : new TextBlock(block.text(), block.bbox(), block.confidence(), pageIdx);
        distinctBlocks.putIfAbsent(new BlockKey(onPage.text(), onPage.bbox()), onPage);
      } catch (MalformedInputException e) {
        reportMalformed(e);
        malformed++;
      }
    }
    int duplicates = input.blocks().size() - malformed - distinctBlocks.size();
    if (duplicates > 0) {
      log.debug("Page {}: dropped {} duplicate text blocks", pageIdx, duplicates);
    }

    List<LayoutElement> elements = new ArrayList<>();
    for (int i = 0; i < input.layoutElements().size(); i++) {
      LayoutElement element = input.layoutElements().get(i);
      try {
        validateElement(pageIdx, i, element);
        elements.add(normalizeElement(pageIdx, i, element, documentElementIds));
      } catch (MalformedInputException e) {
        reportMalformed(e);
        malformed++;
      }
    }

    return new SanitizedPage(
        pageIdx,
        input.pageSize(),
        List.copyOf(distinctBlocks.values()),
        elements,
        input.spanScores(),
        input.layoutElements().size(),
        malformed);
  }

  private void validateBlock(int pageIdx, TextBlock block) {
    if (block == null) {
      throw new MalformedInputException(pageIdx, "text block", "null text block");
    }
    if (block.text() == null) {
      throw new MalformedInputException(pageIdx, "text block", "text block without text");
    }
    checkGeometry(pageIdx, "text block '" + abbreviate(block.text()) + "'", block.bbox());
  }

  private void validateElement(int pageIdx, int position, LayoutElement element) {
    if (element == null) {
      throw new MalformedInputException(
          pageIdx, "layout element #" + position, "null layout element");
    }
    String item = "layout element #" + position + " (" + element.type() + ")";
    checkGeometry(pageIdx, item, element.bbox());
  }

  private void checkGeometry(int pageIdx, String item, BoundingBox bbox) {
    if (bbox == null) {
      throw new MalformedInputException(pageIdx, item, "missing bounding box");
    }
    if (!bbox.wellFormed()) {
      throw new MalformedInputException(pageIdx, item, "invalid bounding box " + bbox);
    }
  }

  /** Pins the element to its page and derives an identifier when absent or already used. */
  private LayoutElement normalizeElement(
      int pageIdx, int position, LayoutElement element, Set<String> usedIds) {
    LayoutElement normalized =
        element.pageIdx() == pageIdx
            ? element
            : new LayoutElement(
                element.elementId(),
                element.type(),
                element.bbox(),
                pageIdx,
                element.rawText(),
                element.confidence());
    String id = normalized.elementId();
    if (id == null || id.isBlank() || usedIds.contains(id)) {
      String derived = "p" + pageIdx + "-e" + position;
      id = derived;
      for (int suffix = 2; usedIds.contains(id); suffix++) {
        id = derived + "-" + suffix;
      }
      log.debug(
          "Page {}: element #{} id '{}' replaced by '{}'",
          pageIdx,
          position,
          normalized.elementId(),
          id);
      normalized = normalized.withElementId(id);
    }
    usedIds.add(id);
    return normalized;
  }

  private void reportMalformed(MalformedInputException e) {
    log.warn(
        "Skipping malformed input on page {}: {}: {}",
        e.getPageIdx(),
        e.getItemDescription(),
        e.getMessage());
    meterRegistry.counter("linker_malformed_input_total").increment();
  }

  private static String abbreviate(String text) {
    return text.length() <= 40 ? text : text.substring(0, 40) + "...";
  }
}
