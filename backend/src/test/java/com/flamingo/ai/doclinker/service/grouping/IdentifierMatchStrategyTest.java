package com.flamingo.ai.doclinker.service.grouping;

import static com.flamingo.ai.doclinker.LinkerFixtures.element;
import static com.flamingo.ai.doclinker.LinkerFixtures.elementOn;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import com.flamingo.ai.doclinker.domain.enums.GroupingMethod;
import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import com.flamingo.ai.doclinker.domain.model.LayoutElement;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link IdentifierMatchStrategy}. */
class IdentifierMatchStrategyTest {

  private IdentifierMatchStrategy strategy;

  @BeforeEach
  void setUp() {
    strategy = new IdentifierMatchStrategy();
  }

  @Test
  void shouldMergePanelsDeclaringSameIdentifier() {
    FigureRecord left = labeled(element("a", "Figure", 100, 100, 100, 100), "3");
    FigureRecord right = labeled(element("b", "Figure", 210, 100, 100, 100), "3");
    GroupingContext context = GroupingContext.forPage(0, List.of(right, left), List.of(), 18.0);

    strategy.group(context);

    // The left panel comes first in reading order and survives
    assertThat(context.getRecords()).containsExactly(left);
    assertThat(left.getMemberElementIds()).containsExactly("a", "b");
    assertThat(left.getBbox().x()).isEqualTo(100.0);
    assertThat(left.getBbox().width()).isEqualTo(210.0);
    assertThat(left.getGroupingMethod()).isEqualTo(GroupingMethod.IDENTIFIER);
  }

  @Test
  void shouldNotMergeSameIdentifierOfDifferentType() {
    FigureRecord figure = labeled(element("a", "Figure", 100, 100, 100, 100), "1");
    FigureRecord table = labeled(element("b", "Table", 100, 300, 100, 100), "1");
    GroupingContext context = GroupingContext.forPage(0, List.of(figure, table), List.of(), 18.0);

    strategy.group(context);

    assertThat(context.getRecords()).containsExactly(figure, table);
  }

  @Test
  void shouldLeaveUnlabeledRecordsAlone() {
    FigureRecord first =
        new FigureRecord(element("a", "Figure", 0, 0, 10, 10), CanonicalType.FIGURE);
    FigureRecord second =
        new FigureRecord(element("b", "Figure", 20, 0, 10, 10), CanonicalType.FIGURE);
    GroupingContext context = GroupingContext.forPage(0, List.of(first, second), List.of(), 18.0);

    strategy.group(context);

    assertThat(context.getRecords()).hasSize(2);
  }

  @Test
  void shouldMergeAcrossPagesKeepingFirstPageGeometry() {
    FigureRecord first = labeled(elementOn(0, "a", "Table", 50, 500, 400, 200), "1");
    FigureRecord continued = labeled(elementOn(1, "b", "Table", 50, 40, 400, 300), "1");
    GroupingContext context = GroupingContext.forDocument(List.of(continued, first));

    strategy.group(context);

    assertThat(context.getRecords()).containsExactly(first);
    assertThat(first.getPageIdx()).isZero();
    assertThat(first.getBbox().y()).isEqualTo(500.0);
    assertThat(first.getBbox().height()).isEqualTo(200.0);
    assertThat(first.getMemberElementIds()).containsExactlyInAnyOrder("a", "b");
  }

  private static FigureRecord labeled(LayoutElement element, String id) {
    CanonicalType type =
        element.type().equals("Table") ? CanonicalType.TABLE : CanonicalType.FIGURE;
    FigureRecord record = new FigureRecord(element, type);
    record.applyCaption(id, type, type.label() + " " + id);
    return record;
  }
}
