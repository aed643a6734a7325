package com.flamingo.ai.doclinker.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Which grouping strategy produced the final shape of a figure record. */
public enum GroupingMethod {
  /** No grouping strategy touched the record. */
  NONE,

  /** Merged with records declaring the same identifier and type. */
  IDENTIFIER,

  /** Labeled by a free-standing caption element. */
  PATTERN,

  /** Absorbed nearby sub-elements. */
  PROXIMITY,

  /** More than one strategy contributed. */
  MULTI_STRATEGY;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
