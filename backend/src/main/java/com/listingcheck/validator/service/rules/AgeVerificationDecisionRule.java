package com.listingcheck.validator.service.rules;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.listingcheck.validator.dto.validation.DecisionLevel;
import com.listingcheck.validator.dto.validation.FieldDecision;

import lombok.RequiredArgsConstructor;

/**
 * Age-verification decision. The {@link AgeRestrictionPolicy} is checked first: a restricted
 * product submitted with "No" is a hard stop whatever the neighbours suggest. Otherwise the
 * submitted flag is compared with the predicted one.
 */
@Component
@RequiredArgsConstructor
public class AgeVerificationDecisionRule {

  static final double STRONG_CONFIDENCE = 0.70;

  private final AgeRestrictionPolicy policy;

  public FieldDecision classify(
      String productName,
      String category,
      String submittedFlag,
      String predictedFlag,
      double confidence) {
    String submitted = normaliseFlag(submittedFlag);
    String predicted = predictedFlag == null ? null : normaliseFlag(predictedFlag);

    if (policy.requiresVerification(productName, category) && "No".equals(submitted)) {
      return decision(
          DecisionLevel.HARD_STOP,
          "Product appears to be age-restricted by policy. Age verification must be set to 'Yes'.",
          predicted,
          confidence);
    }

    if (predicted == null || predicted.isEmpty()) {
      return decision(
          DecisionLevel.PASS,
          "No clear age-check pattern in HO data; value accepted.",
          null,
          confidence);
    }

    if (submitted.equals(predicted)) {
      return decision(
          DecisionLevel.PASS,
          String.format(
              "Age verification setting matches typical HO pattern ('%s').", predicted),
          predicted,
          confidence);
    }

    if (confidence >= STRONG_CONFIDENCE) {
      return decision(
          DecisionLevel.WARNING,
          String.format(
              "Most similar HO products use age verification '%s'. "
                  + "Submission will be flagged for review.",
              predicted),
          predicted,
          confidence);
    }

    return decision(
        DecisionLevel.WARNING,
        "Age verification differs from many similar HO products; "
            + "submission will be flagged for review.",
        predicted,
        confidence);
  }

  /** Trims and title-cases a flag: " yes " becomes "Yes"; null becomes "". */
  static String normaliseFlag(String flag) {
    if (flag == null) {
      return "";
    }
    return Arrays.stream(flag.trim().split("\\s+"))
        .filter(word -> !word.isEmpty())
        .map(
            word ->
                word.substring(0, 1).toUpperCase(Locale.ROOT)
                    + word.substring(1).toLowerCase(Locale.ROOT))
        .collect(Collectors.joining(" "));
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
