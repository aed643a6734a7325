package com.flamingo.ai.doclinker.service.mapping;

import com.flamingo.ai.doclinker.config.LinkerConfig;
import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import com.flamingo.ai.doclinker.domain.model.ReferenceMention;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves reference mentions to figure records across the whole document.
 *
 * <p>Edges exist only between a reference and figures of the same canonical type. Each reference
 * takes its heaviest edge if that edge reaches the match threshold; otherwise it is marked
 * unmatched. A figure may be the target of any number of references.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StructureMapper {

  /** Same page first, then the lexically smallest figure id. */
  private static final Comparator<CompatibilityEdge> TIE_BREAK =
      Comparator.comparing((CompatibilityEdge edge) -> !edge.samePage())
          .thenComparing(
              edge -> edge.figure().getFigureId(), Comparator.nullsLast(String::compareTo));

  private final LinkerConfig linkerConfig;

  /**
   * Resolves every reference exactly once.
   *
   * @param references all reference mentions of the document, unresolved
   * @param figures all finalized figure records of the document
   * @return number of references that were matched
   */
  public int resolve(List<ReferenceMention> references, List<FigureRecord> figures) {
    Map<CanonicalType, List<FigureRecord>> figuresByType =
        figures.stream()
            .collect(
                Collectors.groupingBy(
                    FigureRecord::getType,
                    () -> new EnumMap<>(CanonicalType.class),
                    Collectors.toList()));
    double threshold = linkerConfig.getMapping().getMatchThreshold();

    int matched = 0;
    for (ReferenceMention reference : references) {
      List<FigureRecord> sameType =
          figuresByType.getOrDefault(reference.getReferenceType(), List.of());
      List<CompatibilityEdge> edges = candidateEdges(reference, sameType);
      Optional<CompatibilityEdge> best = selectBest(edges);

      if (best.isPresent() && best.get().weight() >= threshold) {
        CompatibilityEdge edge = best.get();
        reference.resolveTo(edge.figure().getFigureId(), edge.weight());
        matched++;
        log.debug(
            "Reference '{}' -> {} {} (score {})",
            reference.getText(),
            edge.figure().getType().label(),
            edge.figure().getFigureId(),
            edge.weight());
      } else {
        double bestScore = best.map(CompatibilityEdge::weight).orElse(0.0);
        reference.markUnmatched(bestScore);
        log.debug(
            "Reference '{}' left unmatched ({} candidates, best score {})",
            reference.getText(),
            edges.size(),
            bestScore);
      }
    }
    return matched;
  }

  /**
   * Scores every figure of the reference's type.
   *
   * @param reference the reference
   * @param sameTypeFigures all figures sharing the reference's canonical type
   * @return one edge per figure
   */
  public List<CompatibilityEdge> candidateEdges(
      ReferenceMention reference, List<FigureRecord> sameTypeFigures) {
    LinkerConfig.Mapping weights = linkerConfig.getMapping();
    boolean soleFigure = sameTypeFigures.size() == 1;

    List<CompatibilityEdge> edges = new ArrayList<>(sameTypeFigures.size());
    for (FigureRecord figure : sameTypeFigures) {
      if (figure.getType() != reference.getReferenceType()) {
        continue;
      }
      double weight = 0.0;
      String figureId = figure.isLabeled() ? figure.getFigureId() : null;
      if (figureId != null && figureId.equals(reference.getDeclaredId())) {
        weight += weights.getExactIdWeight();
      } else if (figureId != null && sharesLeadingComponent(figureId, reference.getDeclaredId())) {
        weight += weights.getPrefixIdWeight();
      }
      if (figure.getPageIdx() == reference.getPageIdx()) {
        weight += weights.getSamePageWeight();
      }
      if (soleFigure) {
        weight += weights.getSoleFigureWeight();
      }
      edges.add(new CompatibilityEdge(reference, figure, weight));
    }
    return edges;
  }

  private Optional<CompatibilityEdge> selectBest(List<CompatibilityEdge> edges) {
    double max = edges.stream().mapToDouble(CompatibilityEdge::weight).max().orElse(Double.NaN);
    if (Double.isNaN(max)) {
      return Optional.empty();
    }
    return edges.stream().filter(edge -> isSameWeight(edge.weight(), max)).min(TIE_BREAK);
  }

  private static boolean isSameWeight(double a, double b) {
    return Math.abs(a - b) < 1e-9;
  }

  /** Whether two dotted ids, neither equal to the other, start with the same component. */
  static boolean sharesLeadingComponent(String figureId, String declaredId) {
    if (declaredId == null || figureId.equals(declaredId)) {
      return false;
    }
    return leadingComponent(figureId).equals(leadingComponent(declaredId));
  }

  private static String leadingComponent(String id) {
    int dot = id.indexOf('.');
    return dot < 0 ? id : id.substring(0, dot);
  }
}
