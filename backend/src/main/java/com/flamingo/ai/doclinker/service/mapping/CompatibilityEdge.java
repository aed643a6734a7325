package com.flamingo.ai.doclinker.service.mapping;

import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import com.flamingo.ai.doclinker.domain.model.ReferenceMention;

/**
 * A scored candidate assignment of a reference to a figure of the same canonical type.
 *
 * @param reference the reference mention
 * @param figure the candidate figure
 * @param weight sum of the matching signals that apply
 */
public record CompatibilityEdge(ReferenceMention reference, FigureRecord figure, double weight) {

  public boolean samePage() {
    return reference.getPageIdx() == figure.getPageIdx();
  }
}
