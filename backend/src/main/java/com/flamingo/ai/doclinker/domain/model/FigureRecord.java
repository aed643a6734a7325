package com.flamingo.ai.doclinker.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import com.flamingo.ai.doclinker.domain.enums.GroupingMethod;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;

/**
 * One logical figure-like object (figure, table, equation, algorithm, example) assembled from one
 * or more layout elements.
 *
 * <p>Records are created by the caption locator, mutated by the element grouper and treated as
 * frozen once reference mapping starts.
 */
@Getter
@JsonPropertyOrder({
  "figure_id",
  "type",
  "bbox",
  "page_idx",
  "title",
  "confidence",
  "grouping_method",
  "fallback_id",
  "sequence_in_page",
  "member_element_ids"
})
public class FigureRecord {

  /** Page, then top-to-bottom, then left-to-right. */
  public static final Comparator<FigureRecord> READING_ORDER =
      Comparator.comparingInt(FigureRecord::getPageIdx)
          .thenComparingDouble(record -> record.getBbox().y())
          .thenComparingDouble(record -> record.getBbox().x());

  @JsonProperty("figure_id")
  private String figureId;

  private CanonicalType type;

  private BoundingBox bbox;

  @JsonProperty("page_idx")
  private final int pageIdx;

  private String title;

  private double confidence;

  /** Identifier of the layout element the record was created from. */
  @JsonIgnore private final String primaryElementId;

  @JsonProperty("member_element_ids")
  private final Set<String> memberElementIds = new LinkedHashSet<>();

  /** True when {@link #figureId} was assigned by fallback numbering rather than read from text. */
  @Setter
  @JsonProperty("fallback_id")
  private boolean fallbackId;

  @Setter
  @JsonProperty("sequence_in_page")
  private int sequenceInPage;

  @JsonIgnore
  private final EnumSet<GroupingMethod> contributions = EnumSet.noneOf(GroupingMethod.class);

  public FigureRecord(LayoutElement element, CanonicalType detectorType) {
    this.primaryElementId = element.elementId();
    this.type = detectorType;
    this.bbox = element.bbox();
    this.pageIdx = element.pageIdx();
    this.confidence = element.confidence();
    this.memberElementIds.add(element.elementId());
  }

  /**
   * Labels this record from caption text. Caption text is authoritative: its keyword type replaces
   * whatever type the layout detector reported.
   */
  public void applyCaption(String declaredId, CanonicalType captionType, String captionText) {
    this.figureId = declaredId;
    this.type = captionType;
    this.title = captionText;
  }

  /** Assigns a generated identifier to a record that never found a caption. */
  public void assignFallbackId(String generatedId) {
    this.figureId = generatedId;
    this.fallbackId = true;
  }

  /**
   * Folds another record with the same identifier into this one. Boxes are only combined when both
   * records sit on the same page.
   */
  public void absorb(FigureRecord other, GroupingMethod method) {
    if (other == this) {
      return;
    }
    if (other.pageIdx == pageIdx) {
      bbox = bbox.union(other.bbox);
    }
    memberElementIds.addAll(other.memberElementIds);
    confidence = Math.max(confidence, other.confidence);
    if (title == null) {
      title = other.title;
    }
    contributions.addAll(other.contributions);
    contributions.add(method);
  }

  /** Adds a free-standing element on the same page as an extra member. */
  public void addMember(LayoutElement element, GroupingMethod method) {
    if (!memberElementIds.add(element.elementId())) {
      return;
    }
    if (element.pageIdx() == pageIdx) {
      bbox = bbox.union(element.bbox());
    }
    contributions.add(method);
  }

  /** Records a contribution without changing geometry, e.g. when a caption element labels it. */
  public void markContribution(GroupingMethod method) {
    contributions.add(method);
  }

  public Set<String> getMemberElementIds() {
    return Collections.unmodifiableSet(memberElementIds);
  }

  @JsonProperty("grouping_method")
  public GroupingMethod getGroupingMethod() {
    if (contributions.isEmpty()) {
      return GroupingMethod.NONE;
    }
    return contributions.size() > 1
        ? GroupingMethod.MULTI_STRATEGY
        : contributions.iterator().next();
  }

  /** Whether an identifier was declared by caption text. */
  @JsonIgnore
  public boolean isLabeled() {
    return figureId != null && !fallbackId;
  }

  @Override
  public String toString() {
    return "FigureRecord{"
        + type.label()
        + " "
        + figureId
        + " page="
        + pageIdx
        + " members="
        + memberElementIds
        + "}";
  }
}
