package com.listingcheck.validator.exception;

/** The caller passed a structurally invalid value, such as a non-numeric price. */
public class ValidationInputException extends RuntimeException {

  public ValidationInputException(String message) {
    super(message);
  }
}
