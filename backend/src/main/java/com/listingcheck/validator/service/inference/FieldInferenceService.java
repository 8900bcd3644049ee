package com.listingcheck.validator.service.inference;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.springframework.stereotype.Service;

import com.listingcheck.validator.dto.catalog.CatalogEntry;
import com.listingcheck.validator.dto.validation.Inference;
import com.listingcheck.validator.dto.validation.Neighbour;
import com.listingcheck.validator.dto.validation.PriceBand;

/**
 * Derives the expected category, price band and age-verification setting from a neighbour set.
 *
 * <p>Category and age flag predictions need some lexical evidence: when every neighbour has zero
 * similarity nothing is predicted. The price band is taken from whatever neighbours were returned.
 */
@Service
public class FieldInferenceService {

  static final BigDecimal BAND_LOWER_FACTOR = new BigDecimal("0.75");
  static final BigDecimal BAND_UPPER_FACTOR = new BigDecimal("1.25");
  static final String YES = "Yes";
  static final String NO = "No";

  /**
   * Sums similarity per category; the heaviest category wins and its share of the total is the
   * confidence. Equal sums go to the category met first in neighbour order.
   */
  public Inference inferCategory(List<Neighbour> neighbours) {
    Map<String, Double> weightByCategory = new LinkedHashMap<>();
    double total = 0.0;
    for (Neighbour neighbour : neighbours) {
      weightByCategory.merge(neighbour.getProduct().getCategory(), neighbour.getSimilarity(), Double::sum);
      total += neighbour.getSimilarity();
    }
    if (weightByCategory.isEmpty() || total <= 0.0) {
      return Inference.none();
    }

    String best = null;
    double bestWeight = -1.0;
    for (Map.Entry<String, Double> entry : weightByCategory.entrySet()) {
      if (entry.getValue() > bestWeight) {
        best = entry.getKey();
        bestWeight = entry.getValue();
      }
    }
    return Inference.of(best, bestWeight / total);
  }

  /** Median of the neighbours' prices with a ±25% band; undefined when no neighbour has a price. */
  public PriceBand inferPriceBand(List<Neighbour> neighbours) {
    List<BigDecimal> prices =
        neighbours.stream()
            .map(Neighbour::getProduct)
            .map(CatalogEntry::getPrice)
            .filter(Objects::nonNull)
            .sorted()
            .toList();
    if (prices.isEmpty()) {
      return PriceBand.undefined();
    }

    int middle = prices.size() / 2;
    BigDecimal median =
        prices.size() % 2 == 1
            ? prices.get(middle)
            : prices
                .get(middle - 1)
                .add(prices.get(middle))
                .divide(BigDecimal.valueOf(2), 10, RoundingMode.HALF_UP)
                .stripTrailingZeros();

    return new PriceBand(
        median, median.multiply(BAND_LOWER_FACTOR), median.multiply(BAND_UPPER_FACTOR));
  }

  /**
   * Share of neighbours (with a recorded flag) that require age verification. Predicts "Yes" from
   * 50% upwards; confidence is 0 at an even split and 1 when unanimous.
   */
  public Inference inferAgeFlag(List<Neighbour> neighbours) {
    double totalSimilarity = neighbours.stream().mapToDouble(Neighbour::getSimilarity).sum();
    if (totalSimilarity <= 0.0) {
      return Inference.none();
    }

    int defined = 0;
    int yes = 0;
    for (Neighbour neighbour : neighbours) {
      CatalogEntry product = neighbour.getProduct();
      if (!product.hasAgeVerificationFlag()) {
        continue;
      }
      defined++;
      if ("yes".equals(product.getAgeVerificationRequired().trim().toLowerCase(Locale.ROOT))) {
        yes++;
      }
    }
    if (defined == 0) {
      return Inference.none();
    }

    double yesRatio = (double) yes / defined;
    return Inference.of(yesRatio >= 0.5 ? YES : NO, Math.abs(yesRatio - 0.5) * 2);
  }
}
