package com.listingcheck.validator.dto.validation;

import java.math.BigDecimal;

import lombok.Value;

/** Median neighbour price and the ±25% band around it. All three are null together. */
@Value
public class PriceBand {

  private static final PriceBand UNDEFINED = new PriceBand(null, null, null);

  BigDecimal median;
  BigDecimal lower;
  BigDecimal upper;

  public static PriceBand undefined() {
    return UNDEFINED;
  }

  public boolean isDefined() {
    return median != null;
  }
}
