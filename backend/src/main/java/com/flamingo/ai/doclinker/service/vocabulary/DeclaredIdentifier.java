package com.flamingo.ai.doclinker.service.vocabulary;

import com.flamingo.ai.doclinker.domain.enums.CanonicalType;

/**
 * A typed identifier read from text.
 *
 * @param type canonical type implied by the keyword, or {@code equation} for bare numbers
 * @param id normalized dotted identifier, e.g. {@code 2.6}
 * @param start offset of the identifier's first character in the scanned text
 * @param end offset just past the identifier's last character
 */
public record DeclaredIdentifier(CanonicalType type, String id, int start, int end) {}
