package com.listingcheck.validator.service;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.stereotype.Service;

import com.listingcheck.validator.config.ApplicationProperties;
import com.listingcheck.validator.dto.validation.FieldDecision;
import com.listingcheck.validator.dto.validation.Inference;
import com.listingcheck.validator.dto.validation.Neighbour;
import com.listingcheck.validator.dto.validation.OverallVerdict;
import com.listingcheck.validator.dto.validation.PriceBand;
import com.listingcheck.validator.dto.validation.PriceDecision;
import com.listingcheck.validator.dto.validation.ValidationResult;
import com.listingcheck.validator.exception.CatalogDataException;
import com.listingcheck.validator.exception.ValidationInputException;
import com.listingcheck.validator.service.catalog.CatalogIndexProvider;
import com.listingcheck.validator.service.inference.FieldInferenceService;
import com.listingcheck.validator.service.rules.AgeVerificationDecisionRule;
import com.listingcheck.validator.service.rules.CategoryDecisionRule;
import com.listingcheck.validator.service.rules.PriceDecisionRule;
import com.listingcheck.validator.service.rules.VerdictAggregator;
import com.listingcheck.validator.service.similarity.CatalogIndex;
import com.listingcheck.validator.service.similarity.NeighbourRetrievalService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates one store-submitted listing against the reference catalog: retrieves similar catalog
 * products, infers the expected category, price band and age-verification setting from them, and
 * applies the decision rules to each submitted field.
 *
 * <p>Stateless apart from the shared read-only catalog index; safe for concurrent use.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductValidationService {

  private final CatalogIndexProvider catalogIndexProvider;
  private final NeighbourRetrievalService neighbourRetrievalService;
  private final FieldInferenceService fieldInferenceService;
  private final CategoryDecisionRule categoryDecisionRule;
  private final PriceDecisionRule priceDecisionRule;
  private final AgeVerificationDecisionRule ageVerificationDecisionRule;
  private final VerdictAggregator verdictAggregator;
  private final ApplicationProperties applicationProperties;

  /**
   * @param productName submitted product name; blank names simply find no similar products
   * @param category submitted category
   * @param price submitted price; {@code null} is treated as not greater than zero
   * @param ageFlag submitted age-verification flag, "Yes" or "No"
   * @throws CatalogDataException if the reference catalog is unavailable
   * @throws ValidationInputException if the price is not a finite number
   */
  public ValidationResult validateProduct(
      String productName, String category, Number price, String ageFlag) {
    BigDecimal submittedPrice = toDecimal(price);
    CatalogIndex index = catalogIndexProvider.getIndex();
    String name = productName == null ? "" : productName;

    List<Neighbour> neighbours =
        neighbourRetrievalService.retrieve(
            index, name, applicationProperties.getNeighbours().getTopK());

    Inference categoryInference = fieldInferenceService.inferCategory(neighbours);
    PriceBand priceBand = fieldInferenceService.inferPriceBand(neighbours);
    Inference ageInference = fieldInferenceService.inferAgeFlag(neighbours);

    FieldDecision categoryDecision =
        categoryDecisionRule.classify(
            category, categoryInference.getPredicted(), categoryInference.getStrength());
    PriceDecision priceDecision = priceDecisionRule.classify(submittedPrice, priceBand);
    FieldDecision ageDecision =
        ageVerificationDecisionRule.classify(
            name, category, ageFlag, ageInference.getPredicted(), ageInference.getStrength());

    OverallVerdict overall =
        verdictAggregator.aggregate(categoryDecision, priceDecision, ageDecision);

    log.info(
        "Validated '{}': category={}, price={}, age_verification={}, overall={}",
        name,
        categoryDecision.getDecision().getValue(),
        priceDecision.getDecision().getValue(),
        ageDecision.getDecision().getValue(),
        overall.getCode());

    return ValidationResult.builder()
        .category(categoryDecision)
        .price(priceDecision)
        .ageVerification(ageDecision)
        .overall(overall)
        .neighbours(neighbours)
        .build();
  }

  private static BigDecimal toDecimal(Number price) {
    if (price == null) {
      return null;
    }
    if (price instanceof BigDecimal) {
      return (BigDecimal) price;
    }
    if (price instanceof Double || price instanceof Float) {
      double value = price.doubleValue();
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new ValidationInputException("Price must be a finite number, got " + price);
      }
      return BigDecimal.valueOf(value);
    }
    try {
      return new BigDecimal(price.toString());
    } catch (NumberFormatException e) {
      throw new ValidationInputException("Price is not a number: " + price);
    }
  }
}
