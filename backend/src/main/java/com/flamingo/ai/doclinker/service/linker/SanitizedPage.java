package com.flamingo.ai.doclinker.service.linker;

import com.flamingo.ai.doclinker.domain.model.LayoutElement;
import com.flamingo.ai.doclinker.domain.model.PageSize;
import com.flamingo.ai.doclinker.domain.model.TextBlock;
import java.util.List;
import java.util.Map;

/**
 * Page input after validation: malformed items removed, duplicate blocks collapsed and every
 * element carrying an identifier.
 *
 * @param index 0-based page index
 * @param pageSize rendered page size
 * @param blocks distinct, well-formed text blocks
 * @param elements well-formed layout elements
 * @param spanScores classifier scores supplied with the page
 * @param receivedElements layout elements received, malformed ones included
 * @param malformedItems blocks and elements dropped for missing or invalid geometry
 */
public record SanitizedPage(
    int index,
    PageSize pageSize,
    List<TextBlock> blocks,
    List<LayoutElement> elements,
    Map<String, Double> spanScores,
    int receivedElements,
    int malformedItems) {}
