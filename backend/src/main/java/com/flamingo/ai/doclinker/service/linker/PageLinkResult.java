package com.flamingo.ai.doclinker.service.linker;

import com.flamingo.ai.doclinker.domain.model.FigureRecord;
import com.flamingo.ai.doclinker.domain.model.ReferenceMention;
import java.util.List;

/**
 * Outcome of the page-local stages for one page.
 *
 * @param page the sanitized page
 * @param records figure records after page-local grouping
 * @param references unresolved reference mentions found in the page body
 */
public record PageLinkResult(
    SanitizedPage page, List<FigureRecord> records, List<ReferenceMention> references) {}
