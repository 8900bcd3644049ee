package com.listingcheck.validator.dto.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Per-field outcome, declared in increasing order of severity. */
public enum DecisionLevel {
  PASS("pass", 0),
  WARNING("warning", 1),
  HARD_STOP("hard_stop", 2);

  private final String value;
  private final int riskWeight;

  DecisionLevel(String value, int riskWeight) {
    this.value = value;
    this.riskWeight = riskWeight;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Contribution of one field decision to a submission's review risk score. */
  public int getRiskWeight() {
    return riskWeight;
  }

  public boolean isMoreSevereThan(DecisionLevel other) {
    return compareTo(other) > 0;
  }

  @JsonCreator
  public static DecisionLevel fromValue(String value) {
    for (DecisionLevel level : values()) {
      if (level.value.equalsIgnoreCase(value)) {
        return level;
      }
    }
    throw new IllegalArgumentException("Unknown decision level: " + value);
  }
}
