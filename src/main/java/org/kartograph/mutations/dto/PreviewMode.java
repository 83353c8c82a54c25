package org.kartograph.mutations.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Depth of a parse preview.
 */
public enum PreviewMode {
  /** Structural errors, warnings and per-operation details. */
  FULL("full"),
  /** Read-only breakdown: counts per operation kind and the first errors, no warnings. */
  SUMMARY("summary");

  private final String wireValue;

  PreviewMode(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }
}
