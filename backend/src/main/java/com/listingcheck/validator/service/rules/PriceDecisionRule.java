package com.listingcheck.validator.service.rules;

import java.math.BigDecimal;
import java.math.MathContext;

import org.springframework.stereotype.Component;

import com.listingcheck.validator.dto.validation.DecisionLevel;
import com.listingcheck.validator.dto.validation.PriceBand;
import com.listingcheck.validator.dto.validation.PriceDecision;

/**
 * Compares the submitted price with the neighbours' median. Within ±25% passes, within ±50% is a
 * warning, anything further out is a hard stop. Both limits are inclusive.
 */
@Component
public class PriceDecisionRule {

  static final BigDecimal PASS_TOLERANCE = new BigDecimal("0.25");
  static final BigDecimal WARNING_TOLERANCE = new BigDecimal("0.50");

  public PriceDecision classify(BigDecimal price, PriceBand band) {
    if (band == null || !band.isDefined()) {
      return decision(
          DecisionLevel.PASS, "No price band available; price accepted.", PriceBand.undefined());
    }

    if (price == null || price.signum() <= 0) {
      return decision(DecisionLevel.HARD_STOP, "Price must be greater than zero.", band);
    }

    BigDecimal median = band.getMedian();
    BigDecimal diff =
        median.signum() > 0
            ? price.subtract(median).divide(median, MathContext.DECIMAL64)
            : BigDecimal.ZERO;
    String typical = "~" + Percentages.pounds(median);

    if (diff.abs().compareTo(PASS_TOLERANCE) <= 0) {
      return decision(
          DecisionLevel.PASS,
          String.format("Price is within ±25%% of typical HO price (%s).", typical),
          band);
    }

    if (diff.abs().compareTo(WARNING_TOLERANCE) <= 0) {
      return decision(
          DecisionLevel.WARNING,
          String.format(
              "Price is %s away from typical HO price (%s). Submission will be flagged for review.",
              Percentages.format(diff), typical),
          band);
    }

    return decision(
        DecisionLevel.HARD_STOP,
        String.format(
            "Price is an extreme outlier (%s from typical %s). "
                + "Please check and correct before submitting.",
            Percentages.format(diff), typical),
        band);
  }

  private static PriceDecision decision(DecisionLevel level, String message, PriceBand band) {
    return PriceDecision.builder()
        .decision(level)
        .message(message)
        .median(band.getMedian())
        .lower(band.getLower())
        .upper(band.getUpper())
        .build();
  }
}
