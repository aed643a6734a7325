package com.flamingo.ai.doclinker.service.grouping;

import static com.flamingo.ai.doclinker.LinkerFixtures.element;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.doclinker.LinkerFixtures;
import com.flamingo.ai.doclinker.config.LinkerConfig;
import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import com.flamingo.ai.doclinker.domain.model.LayoutElement;
import com.flamingo.ai.doclinker.service.vocabulary.TypeVocabulary;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ElementGrouper Tests")
class ElementGrouperTest {

  private ElementGrouper grouper;

  @BeforeEach
  void setUp() {
    LinkerConfig config = new LinkerConfig();
    grouper = LinkerFixtures.grouper(config, new TypeVocabulary(config));
  }

  @Test
  @DisplayName("Should apply identifier, pattern and proximity grouping on a page")
  void shouldGroupPage() {
    FigureRecord panelA = labeledFigure(element("a", "Figure", 100, 100, 100, 100), "1");
    FigureRecord panelB = labeledFigure(element("b", "Figure", 210, 100, 100, 100), "1");
    FigureRecord unlabeled =
        new FigureRecord(element("c", "Figure", 100, 400, 200, 100), CanonicalType.FIGURE);
    LayoutElement caption =
        element("cap", "caption", 100, 505, 200, 12).withRawText("Figure 2: Loss curves");

    List<FigureRecord> grouped =
        grouper.groupPage(
            GroupingContext.forPage(
                0, List.of(panelA, panelB, unlabeled), List.of(caption), 18.0));

    assertThat(grouped).extracting(FigureRecord::getFigureId).containsExactly("1", "2");
    assertThat(grouped.get(0).getMemberElementIds()).containsExactly("a", "b");
    assertThat(grouped.get(1).getMemberElementIds()).containsExactly("c", "cap");
  }

  @Test
  @DisplayName("Grouping an already grouped page should change nothing")
  void shouldBeIdempotent() {
    List<FigureRecord> records =
        List.of(
            labeledFigure(element("a", "Figure", 100, 100, 100, 100), "4"),
            new FigureRecord(element("b", "Figure", 210, 100, 90, 100), CanonicalType.FIGURE),
            new FigureRecord(element("c", "Figure", 100, 600, 100, 100), CanonicalType.FIGURE));
    List<LayoutElement> loose = List.of(element("t", "title", 100, 80, 200, 10));

    GroupingContext first = GroupingContext.forPage(0, records, loose, 18.0);
    List<FigureRecord> once = grouper.groupPage(first);
    String snapshot = describe(once);

    List<FigureRecord> twice =
        grouper.groupPage(
            GroupingContext.forPage(0, once, first.getUnattachedElements(), 18.0));

    assertThat(describe(twice)).isEqualTo(snapshot);
    assertThat(twice).hasSize(2);
  }

  @Test
  @DisplayName("Document pass should only merge identical identifiers")
  void shouldMergeOnlyIdenticalIdentifiersAcrossDocument() {
    FigureRecord first = labeledFigure(element("a", "Figure", 0, 0, 10, 10), "1");
    FigureRecord again =
        labeledFigure(
            new LayoutElement("b", "Figure", first.getBbox(), 2, null, 0.9), "1");
    FigureRecord other = labeledFigure(element("c", "Figure", 0, 50, 10, 10), "2");

    List<FigureRecord> merged = grouper.groupDocument(List.of(first, again, other));

    assertThat(merged).containsExactly(first, other);
  }

  private static FigureRecord labeledFigure(LayoutElement element, String id) {
    FigureRecord record = new FigureRecord(element, CanonicalType.FIGURE);
    record.applyCaption(id, CanonicalType.FIGURE, "Figure " + id);
    return record;
  }

  private static String describe(List<FigureRecord> records) {
    return records.stream()
        .map(r -> r.getFigureId() + r.getMemberElementIds() + r.getBbox())
        .collect(Collectors.joining(";"));
  }
}
