package com.listingcheck.validator.service.rules;

import java.util.Objects;

import org.springframework.stereotype.Component;

import com.listingcheck.validator.dto.validation.DecisionLevel;
import com.listingcheck.validator.dto.validation.FieldDecision;

/** A category mismatch is always a warning; confidence only changes the wording. */
@Component
public class CategoryDecisionRule {

  static final double STRONG_CONFIDENCE = 0.70;

  public FieldDecision classify(String submitted, String predicted, double confidence) {
    if (predicted == null || predicted.isEmpty()) {
      return decision(
          DecisionLevel.PASS,
          "No clear match found in HO data, category accepted.",
          null,
          confidence);
    }

    if (Objects.equals(submitted, predicted)) {
      return decision(
          DecisionLevel.PASS,
          String.format("Category matches typical HO category '%s'.", predicted),
          predicted,
          confidence);
    }

    if (confidence >= STRONG_CONFIDENCE) {
      return decision(
          DecisionLevel.WARNING,
          String.format(
              "Most similar HO products are in category '%s' (confidence %s). Consider updating.",
              predicted, Percentages.format(confidence)),
          predicted,
          confidence);
    }

    return decision(
        DecisionLevel.WARNING,
        String.format(
            "Category differs from common HO category '%s', but model confidence is moderate. "
                + "Submission will be flagged for review.",
            predicted),
        predicted,
        confidence);
  }

  private static FieldDecision decision(
      DecisionLevel level, String message, String predicted, double confidence) {
    return FieldDecision.builder()
        .decision(level)
        .message(message)
        .predicted(predicted)
        .confidence(confidence)
        .build();
  }
}
