package com.listingcheck.validator.dto.submission;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Whether the store accepted a suggested correction for one field. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldChange {

  /** {@code category}, {@code price} or {@code age_flag}. */
  @JsonProperty("field")
  private String field;

  @JsonProperty("accepted")
  private boolean accepted;

  @JsonProperty("original_value")
  private String originalValue;

  @JsonProperty("suggested_value")
  private String suggestedValue;
}
