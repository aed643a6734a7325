package com.flamingo.ai.doclinker.service.aggregation;

import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import com.flamingo.ai.doclinker.domain.model.DocumentMetadata;
import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import com.flamingo.ai.doclinker.domain.model.MappingStatistics;
import com.flamingo.ai.doclinker.domain.model.Page;
import com.flamingo.ai.doclinker.domain.model.ProcessingInfo;
import com.flamingo.ai.doclinker.domain.model.ReferenceMention;
import com.flamingo.ai.doclinker.domain.model.StructuredDocument;
import com.flamingo.ai.doclinker.domain.model.TypeStatistics;
import com.flamingo.ai.doclinker.exception.DocumentStructureException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Post-barrier bookkeeping for a document: fallback numbering, the uniqueness check, per-page
 * sequence numbers and the statistics attached to the output.
 *
 * <p>Every method here runs on the calling thread after all page tasks have completed.
 */
@Slf4j
@Service
public class DocumentAggregator {

  /**
   * Gives every record without a declared identifier a generated one of the form {@code
   * <type>_unlabeled_<n>}. Records are numbered in reading order with one counter per canonical
   * type; numbers already taken by another record of that type are skipped.
   *
   * @param records all grouped records of the document
   * @return number of identifiers assigned
   */
  public int assignFallbackIdentifiers(List<FigureRecord> records) {
    Map<CanonicalType, Set<String>> taken = new EnumMap<>(CanonicalType.class);
    for (FigureRecord record : records) {
      if (record.getFigureId() != null) {
        taken.computeIfAbsent(record.getType(), t -> new HashSet<>()).add(record.getFigureId());
      }
    }

    Map<CanonicalType, Integer> counters = new EnumMap<>(CanonicalType.class);
    int assigned = 0;
    for (FigureRecord record : readingOrder(records)) {
      if (record.getFigureId() != null) {
        continue;
      }
      Set<String> used = taken.computeIfAbsent(record.getType(), t -> new HashSet<>());
      String candidate;
      do {
        int next = counters.merge(record.getType(), 1, Integer::sum);
        candidate = record.getType().label() + "_unlabeled_" + next;
      } while (used.contains(candidate));
      used.add(candidate);
      record.assignFallbackId(candidate);
      assigned++;
      log.debug("Assigned fallback id {} to {}", candidate, record);
    }
    return assigned;
  }

  /**
   * Fails when two records share an identifier and type.
   *
   * @param documentTitle title used in the error
   * @param records all records of the document, each with an identifier
   * @throws DocumentStructureException on the first duplicate found
   */
  public void verifyUniqueIdentifiers(String documentTitle, List<FigureRecord> records) {
    Map<String, FigureRecord> seen = new HashMap<>();
    for (FigureRecord record : records) {
      if (record.getFigureId() == null) {
        throw new DocumentStructureException(
            documentTitle, "Figure record without identifier after fallback numbering: " + record);
      }
      String key = record.getType().label() + "/" + record.getFigureId();
      FigureRecord previous = seen.putIfAbsent(key, record);
      if (previous != null) {
        throw new DocumentStructureException(
            documentTitle,
            "Duplicate "
                + record.getType().label()
                + " identifier '"
                + record.getFigureId()
                + "' on pages "
                + previous.getPageIdx()
                + " and "
                + record.getPageIdx());
      }
    }
  }

  /** Numbers records 1..n among the records of the same type on the same page, top to bottom. */
  public void assignSequenceInPage(List<FigureRecord> records) {
    Map<String, Integer> counters = new HashMap<>();
    for (FigureRecord record : readingOrder(records)) {
      String key = record.getPageIdx() + "/" + record.getType().label();
      record.setSequenceInPage(counters.merge(key, 1, Integer::sum));
    }
  }

  /**
   * Assembles the output document and its statistics.
   *
   * @param metadata document metadata
   * @param pages linked pages in index order, every reference already resolved
   * @param records all figure records
   * @param totalLayoutElements layout elements received, malformed ones included
   * @param malformedElements blocks and elements skipped for missing or invalid geometry
   * @return the structured document
   */
  public StructuredDocument compose(
      DocumentMetadata metadata,
      List<Page> pages,
      List<FigureRecord> records,
      int totalLayoutElements,
      int malformedElements) {
    List<FigureRecord> figures = readingOrder(records);
    List<ReferenceMention> references =
        pages.stream().flatMap(page -> page.references().stream()).toList();

    int matched = (int) references.stream().filter(ref -> !ref.isNotMatched()).count();
    MappingStatistics mappingStatistics = MappingStatistics.of(references.size(), matched);

    Map<String, TypeStatistics> typeStatistics = new LinkedHashMap<>();
    for (CanonicalType type : CanonicalType.values()) {
      int typeTotal = 0;
      int typeMatched = 0;
      for (ReferenceMention reference : references) {
        if (reference.getReferenceType() == type) {
          typeTotal++;
          if (!reference.isNotMatched()) {
            typeMatched++;
          }
        }
      }
      int figureCount = (int) figures.stream().filter(f -> f.getType() == type).count();
      if (typeTotal > 0 || figureCount > 0) {
        typeStatistics.put(type.label(), TypeStatistics.of(typeTotal, typeMatched, figureCount));
      }
    }

    ProcessingInfo processingInfo =
        new ProcessingInfo(
            totalLayoutElements,
            malformedElements,
            (int) figures.stream().filter(f -> f.getMemberElementIds().size() > 1).count(),
            (int) figures.stream().filter(FigureRecord::isFallbackId).count(),
            matched,
            references.size() - matched);

    return new StructuredDocument(
        metadata.withPages(pages.size()),
        pages,
        figures,
        mappingStatistics,
        typeStatistics,
        processingInfo);
  }

  private static List<FigureRecord> readingOrder(List<FigureRecord> records) {
    List<FigureRecord> ordered = new ArrayList<>(records);
    ordered.sort(FigureRecord.READING_ORDER);
    return ordered;
  }
}
