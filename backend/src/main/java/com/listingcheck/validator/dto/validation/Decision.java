package com.listingcheck.validator.dto.validation;

/** Common view of a single field decision. */
public interface Decision {

  DecisionLevel getDecision();

  String getMessage();
}
