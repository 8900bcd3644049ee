package com.listingcheck.validator.dto.validation;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Decision for the price field with the reference price band")
public class PriceDecision implements Decision {

  @JsonProperty("decision")
  DecisionLevel decision;

  @JsonProperty("message")
  String message;

  @JsonProperty("median")
  BigDecimal median;

  @JsonProperty("lower")
  BigDecimal lower;

  @JsonProperty("upper")
  BigDecimal upper;
}
