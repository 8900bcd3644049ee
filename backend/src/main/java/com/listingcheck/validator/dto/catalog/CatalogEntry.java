package com.listingcheck.validator.dto.catalog;

import java.math.BigDecimal;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** One known-good product from the head office reference catalog. */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CatalogEntry {

  @JsonProperty("product_name")
  String productName;

  @JsonProperty("category")
  String category;

  /** Reference price in GBP; {@code null} when the catalog row has none. */
  @JsonProperty("price")
  BigDecimal price;

  /** {@code "Yes"} / {@code "No"} as recorded in the catalog, {@code null} when undefined. */
  @JsonProperty("age_verification_required")
  String ageVerificationRequired;

  @JsonProperty("attributes")
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  @Builder.Default
  Map<String, String> attributes = Map.of();

  public boolean hasAgeVerificationFlag() {
    return ageVerificationRequired != null && !ageVerificationRequired.isBlank();
  }
}
