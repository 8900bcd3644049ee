package com.listingcheck.validator.service.explanation;

import java.util.Optional;

import com.listingcheck.validator.dto.submission.ProductInput;
import com.listingcheck.validator.dto.validation.ValidationResult;

/**
 * Produces a plain-language explanation of a validation result. Explanations never alter the
 * decisions they describe.
 */
public interface ProductExplainer {

  /**
   * Explains the result for store staff and head office.
   *
   * @param product the listing that was validated
   * @param result the engine's decisions for it
   * @return the explanation, or empty when no explainer is available
   * @throws com.listingcheck.validator.exception.ExplanationException if the explainer fails
   */
  Optional<String> explain(ProductInput product, ValidationResult result);
}
