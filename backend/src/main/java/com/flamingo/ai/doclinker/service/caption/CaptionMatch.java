package com.flamingo.ai.doclinker.service.caption;

import com.flamingo.ai.doclinker.domain.model.TextBlock;
import com.flamingo.ai.doclinker.service.vocabulary.DeclaredIdentifier;

/**
 * A caption found next to a figure-like element.
 *
 * @param block the text block holding the caption
 * @param identifier declared identifier and keyword type
 * @param position where the caption sits relative to the element
 * @param verticalGap vertical distance used for tie-breaking
 * @param horizontalOffset horizontal distance used for tie-breaking
 */
public record CaptionMatch(
    TextBlock block,
    DeclaredIdentifier identifier,
    CaptionPosition position,
    double verticalGap,
    double horizontalOffset) {}
