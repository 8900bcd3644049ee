package com.listingcheck.validator.dto.submission;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SubmissionStatus {
  PENDING("pending"),
  APPROVED("approved"),
  DENIED("denied");

  private final String value;

  SubmissionStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public boolean isReviewed() {
    return this != PENDING;
  }

  @JsonCreator
  public static SubmissionStatus fromValue(String value) {
    for (SubmissionStatus status : values()) {
      if (status.value.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown submission status: " + value);
  }
}
