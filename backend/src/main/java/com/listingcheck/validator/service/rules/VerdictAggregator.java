package com.listingcheck.validator.service.rules;

import org.springframework.stereotype.Component;

import com.listingcheck.validator.dto.validation.Decision;
import com.listingcheck.validator.dto.validation.DecisionLevel;
import com.listingcheck.validator.dto.validation.OverallVerdict;

/** The overall verdict follows the most severe field decision. */
@Component
public class VerdictAggregator {

  public OverallVerdict aggregate(Decision... decisions) {
    DecisionLevel worst = DecisionLevel.PASS;
    for (Decision decision : decisions) {
      if (decision.getDecision().isMoreSevereThan(worst)) {
        worst = decision.getDecision();
      }
    }

    switch (worst) {
      case HARD_STOP:
        return OverallVerdict.REQUIRES_CORRECTION;
      case WARNING:
        return OverallVerdict.WARNINGS_PENDING_REVIEW;
      default:
        return OverallVerdict.READY;
    }
  }
}
