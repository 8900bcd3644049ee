package com.listingcheck.validator.exception;

/**
 * The reference catalog could not be loaded or is empty. The engine cannot serve validations
 * without it.
 */
public class CatalogDataException extends RuntimeException {

  public CatalogDataException(String message) {
    super(message);
  }

  public CatalogDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
