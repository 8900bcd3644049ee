package com.listingcheck.validator.dto.submission;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.listingcheck.validator.dto.validation.ValidationResult;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExplanationResponse {

  @JsonProperty("validation")
  private ValidationResult validation;

  /** Markdown text, absent when no explainer is available or it failed. */
  @JsonProperty("explanation")
  private String explanation;
}
