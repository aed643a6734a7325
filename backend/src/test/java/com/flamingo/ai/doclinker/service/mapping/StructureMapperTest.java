package com.flamingo.ai.doclinker.service.mapping;

import static com.flamingo.ai.doclinker.LinkerFixtures.elementOn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.doclinker.config.LinkerConfig;
import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import com.flamingo.ai.doclinker.domain.model.BoundingBox;
import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import com.flamingo.ai.doclinker.domain.model.ReferenceMention;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link StructureMapper}. */
@DisplayName("StructureMapper Tests")
class StructureMapperTest {

  private LinkerConfig config;
  private StructureMapper mapper;

  @BeforeEach
  void setUp() {
    config = new LinkerConfig();
    mapper = new StructureMapper(config);
  }

  @Test
  @DisplayName("Should match an exact identifier across pages")
  void shouldMatchExactIdentifierAcrossPages() {
    FigureRecord target = labeled(CanonicalType.FIGURE, "2.6", 1);
    FigureRecord sibling = labeled(CanonicalType.FIGURE, "2.7", 0);
    ReferenceMention reference = reference(CanonicalType.FIGURE, "2.6", 0);

    int matched = mapper.resolve(List.of(reference), List.of(target, sibling));

    assertThat(matched).isEqualTo(1);
    assertThat(reference.getMatchedFigureId()).isEqualTo("2.6");
    assertThat(reference.getMatchScore()).isCloseTo(0.6, within(1e-9));
    assertThat(reference.isNotMatched()).isFalse();
  }

  @Test
  @DisplayName("Exact match on the same page with a sole figure should score highest")
  void shouldSumAllSignals() {
    FigureRecord figure = labeled(CanonicalType.FIGURE, "1", 0);
    ReferenceMention reference = reference(CanonicalType.FIGURE, "1", 0);

    mapper.resolve(List.of(reference), List.of(figure));

    assertThat(reference.getMatchScore()).isCloseTo(0.8, within(1e-9));
  }

  @Test
  @DisplayName("Should never match across canonical types")
  void shouldNotMatchAcrossTypes() {
    FigureRecord figure = labeled(CanonicalType.FIGURE, "1", 0);
    ReferenceMention reference = reference(CanonicalType.TABLE, "1", 0);

    int matched = mapper.resolve(List.of(reference), List.of(figure));

    assertThat(matched).isZero();
    assertThat(reference.isNotMatched()).isTrue();
    assertThat(reference.getMatchedFigureId()).isNull();
    assertThat(reference.getMatchScore()).isZero();
  }

  @Test
  @DisplayName("Should leave a reference unmatched when only weak signals apply")
  void shouldLeaveWeakCandidatesUnmatched() {
    FigureRecord first = labeled(CanonicalType.FIGURE, "1", 0);
    FigureRecord second = labeled(CanonicalType.FIGURE, "2", 0);
    ReferenceMention reference = reference(CanonicalType.FIGURE, "9", 0);

    mapper.resolve(List.of(reference), List.of(first, second));

    assertThat(reference.isNotMatched()).isTrue();
    assertThat(reference.getMatchScore()).isCloseTo(0.1, within(1e-9));
  }

  @Test
  @DisplayName("A prefix match should stay below an exact match")
  void shouldPreferExactOverPrefix() {
    FigureRecord exact = labeled(CanonicalType.TABLE, "2.6", 3);
    FigureRecord prefix = labeled(CanonicalType.TABLE, "2.60", 0);
    ReferenceMention reference = reference(CanonicalType.TABLE, "2.6", 0);

    mapper.resolve(List.of(reference), List.of(exact, prefix));

    assertThat(reference.getMatchedFigureId()).isEqualTo("2.6");
  }

  @Test
  @DisplayName("Ties should prefer the same page, then the smallest identifier")
  void shouldBreakTies() {
    config.getMapping().setSamePageWeight(0.0);
    config.getMapping().setMatchThreshold(0.1);
    FigureRecord onOtherPage = labeled(CanonicalType.FIGURE, "2.1", 1);
    FigureRecord onSamePage = labeled(CanonicalType.FIGURE, "2.3", 0);
    FigureRecord alsoOther = labeled(CanonicalType.FIGURE, "2.2", 1);
    ReferenceMention samePage = reference(CanonicalType.FIGURE, "2", 0);
    ReferenceMention otherPage = reference(CanonicalType.FIGURE, "2", 5);

    mapper.resolve(List.of(samePage, otherPage), List.of(onOtherPage, onSamePage, alsoOther));

    assertThat(samePage.getMatchedFigureId()).isEqualTo("2.3");
    assertThat(otherPage.getMatchedFigureId()).isEqualTo("2.1");
  }

  @Test
  @DisplayName("Fallback identifiers should not count as declared identifiers")
  void shouldIgnoreFallbackIdentifiers() {
    FigureRecord unlabeled =
        new FigureRecord(elementOn(0, "t", "Table", 0, 0, 10, 10), CanonicalType.TABLE);
    unlabeled.assignFallbackId("table_unlabeled_1");
    ReferenceMention reference = reference(CanonicalType.TABLE, "1", 0);

    List<CompatibilityEdge> edges = mapper.candidateEdges(reference, List.of(unlabeled));

    assertThat(edges).hasSize(1);
    assertThat(edges.get(0).weight()).isCloseTo(0.2, within(1e-9));
  }

  @Test
  @DisplayName("Many references may resolve to the same figure")
  void shouldAllowManyReferencesPerFigure() {
    FigureRecord figure = labeled(CanonicalType.ALGORITHM, "1", 0);
    ReferenceMention first = reference(CanonicalType.ALGORITHM, "1", 0);
    ReferenceMention second = reference(CanonicalType.ALGORITHM, "1", 2);

    int matched = mapper.resolve(List.of(first, second), List.of(figure));

    assertThat(matched).isEqualTo(2);
    assertThat(first.getMatchedFigureId()).isEqualTo("1");
    assertThat(second.getMatchedFigureId()).isEqualTo("1");
  }

  @Test
  void shouldDetectSharedLeadingComponent() {
    assertThat(StructureMapper.sharesLeadingComponent("2.60", "2.6")).isTrue();
    assertThat(StructureMapper.sharesLeadingComponent("3.1", "2.6")).isFalse();
    assertThat(StructureMapper.sharesLeadingComponent("2.6", "2.6")).isFalse();
  }

  private static FigureRecord labeled(CanonicalType type, String id, int page) {
    String elementId = type.label() + "-" + id;
    FigureRecord record =
        new FigureRecord(elementOn(page, elementId, type.label(), 0, 0, 10, 10), type);
    record.applyCaption(id, type, type.label() + " " + id);
    return record;
  }

  private static ReferenceMention reference(CanonicalType type, String id, int page) {
    return new ReferenceMention(
        type.label() + " " + id, new BoundingBox(0, 0, 10, 10), page, type, id, 0.7);
  }
}
