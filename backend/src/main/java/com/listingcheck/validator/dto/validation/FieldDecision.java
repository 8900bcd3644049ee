package com.listingcheck.validator.dto.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Decision for the category or age-verification field. */
@Value
@Builder
@Jacksonized
@Schema(description = "Decision for a categorical field")
public class FieldDecision implements Decision {

  @JsonProperty("decision")
  DecisionLevel decision;

  @JsonProperty("message")
  String message;

  @JsonProperty("predicted")
  String predicted;

  @JsonProperty("confidence")
  Double confidence;
}
