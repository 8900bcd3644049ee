package com.listingcheck.validator.dto.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.listingcheck.validator.dto.catalog.CatalogEntry;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A catalog entry similar to the submitted name, with its position in the catalog. */
@Value
@Builder
@Jacksonized
public class Neighbour {

  @JsonProperty("catalog_index")
  int catalogIndex;

  @JsonProperty("product")
  CatalogEntry product;

  @JsonProperty("similarity")
  double similarity;
}
