package com.flamingo.ai.doclinker.domain.enums;

import java.util.Optional;

/**
 * Layout detector vocabulary after normalization. Labels the detector emits that are not in the
 * configured label table become {@link #TEXT}.
 */
public enum LayoutType {
  FIGURE(CanonicalType.FIGURE),
  TABLE(CanonicalType.TABLE),
  EQUATION(CanonicalType.EQUATION),
  ALGORITHM(CanonicalType.ALGORITHM),
  CAPTION(null),
  TITLE(null),
  TEXT(null);

  private final CanonicalType canonicalType;

  LayoutType(CanonicalType canonicalType) {
    this.canonicalType = canonicalType;
  }

  /** Whether elements of this type become figure records. */
  public boolean isFigureLike() {
    return canonicalType != null;
  }

  /** The detector-side canonical type; empty for captions, titles and text. */
  public Optional<CanonicalType> canonicalType() {
    return Optional.ofNullable(canonicalType);
  }
}
