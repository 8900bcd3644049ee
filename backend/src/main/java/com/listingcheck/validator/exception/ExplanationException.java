package com.listingcheck.validator.exception;

/** Raised by an explainer when the language model call fails or returns nothing usable. */
public class ExplanationException extends RuntimeException {

  public ExplanationException(String message, Throwable cause) {
    super(message, cause);
  }
}
