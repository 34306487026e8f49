package com.flamingo.ai.frontdesk.domain.enums;

import java.util.Arrays;
import java.util.Locale;

/** Kinds of business knowledge a document can hold. */
public enum DocumentType {
  PDF,
  NOTE,
  POLICY,
  FAQ,
  GUIDE,
  GENERAL;

  /** Lower-case name used in provenance headers. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a type name case-insensitively.
   *
   * @throws IllegalArgumentException if the name is not a known type
   */
  public static DocumentType fromLabel(String label) {
    return Arrays.stream(values())
        .filter(type -> type.name().equalsIgnoreCase(label == null ? "" : label.trim()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown document type: " + label));
  }
}
