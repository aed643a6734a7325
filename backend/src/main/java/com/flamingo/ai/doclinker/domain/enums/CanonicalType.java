package com.flamingo.ai.doclinker.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Normalized category of a figure-like element or of a reference pointing at one. */
public enum CanonicalType {
  FIGURE,
  TABLE,
  EQUATION,
  ALGORITHM,
  EXAMPLE;

  /** Lower-case name used in output and in fallback identifiers, e.g. {@code table}. */
  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static CanonicalType fromLabel(String label) {
    return valueOf(label.trim().toUpperCase(Locale.ROOT));
  }
}
