package com.listingcheck.validator.dto.submission;

import com.fasterxml.jackson.annotation.JsonValue;

/** Head office review priority derived from a submission's risk score. */
public enum RiskLevel {
  LOW("low"),
  MEDIUM("medium"),
  HIGH("high");

  static final int HIGH_THRESHOLD = 3;
  static final int MEDIUM_THRESHOLD = 1;

  private final String value;

  RiskLevel(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public static RiskLevel fromScore(int score) {
    if (score >= HIGH_THRESHOLD) {
      return HIGH;
    }
    if (score >= MEDIUM_THRESHOLD) {
      return MEDIUM;
    }
    return LOW;
  }
}
