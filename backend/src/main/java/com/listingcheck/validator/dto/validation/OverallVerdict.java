package com.listingcheck.validator.dto.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OverallVerdict {
  READY("ready", "Ready for automatic approval."),
  WARNINGS_PENDING_REVIEW("warnings_pending_review", "Submitted with warnings; HO will review."),
  REQUIRES_CORRECTION("requires_correction", "Requires correction before submission.");

  private final String code;
  private final String label;

  OverallVerdict(String code, String label) {
    this.code = code;
    this.label = label;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  public String getLabel() {
    return label;
  }

  /** Reads stored submissions; only the wire codes are accepted, never the display labels. */
  @JsonCreator
  public static OverallVerdict fromCode(String code) {
    for (OverallVerdict verdict : values()) {
      if (verdict.code.equals(code)) {
        return verdict;
      }
    }
    throw new IllegalArgumentException("Unknown overall verdict: " + code);
  }
}
