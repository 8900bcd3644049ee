package com.listingcheck.validator.exception;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps failures to a single {@link ErrorResponse} shape. Business outcomes such as a hard stop on
 * price are not errors and never reach this class.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  static final String CATALOG_RETRY_AFTER_SECONDS = "30";

  private static final PropertyNamingStrategies.SnakeCaseStrategy WIRE_NAMES =
      new PropertyNamingStrategies.SnakeCaseStrategy();

  @Value("${app.environment:production}")
  private String environment;

  @Value("${app.debug.enabled:false}")
  private boolean debugEnabled;

  @ExceptionHandler(ValidationInputException.class)
  public ResponseEntity<ErrorResponse> handleInvalidInput(
      ValidationInputException ex, WebRequest request) {
    log.warn("Rejected listing input: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage(), request).build();
  }

  /** Field errors are keyed by the JSON names clients send, e.g. {@code product_name}. */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidationExceptions(
      MethodArgumentNotValidException ex, WebRequest request) {
    Map<String, String> errors = new LinkedHashMap<>();
    for (FieldError error : ex.getBindingResult().getFieldErrors()) {
      errors.putIfAbsent(WIRE_NAMES.translate(error.getField()), error.getDefaultMessage());
    }
    log.warn("Request body failed validation: {}", errors);

    return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Invalid request data", request)
        .error("Validation Failed")
        .validationErrors(errors)
        .build();
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.warn("Unreadable request body: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "MALFORMED_JSON", "Malformed JSON request", request)
        .build();
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
      ResourceNotFoundException ex, WebRequest request) {
    log.info("Lookup miss: {}", ex.getMessage());
    return respond(HttpStatus.NOT_FOUND, "SUBMISSION_NOT_FOUND", ex.getMessage(), request)
        .build();
  }

  /** Sets {@code Retry-After}; an operator reload can bring the catalog back. */
  @ExceptionHandler(CatalogDataException.class)
  public ResponseEntity<ErrorResponse> handleCatalogDataException(
      CatalogDataException ex, WebRequest request) {
    log.error("Reference catalog unavailable: {}", ex.getMessage());
    return respond(
            HttpStatus.SERVICE_UNAVAILABLE, "CATALOG_UNAVAILABLE", ex.getMessage(), request)
        .header(HttpHeaders.RETRY_AFTER, CATALOG_RETRY_AFTER_SECONDS)
        .build();
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleHttpRequestMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    String message = String.format("Request method '%s' is not supported", ex.getMethod());
    log.warn("Method not allowed: {}", message);
    return respond(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", message, request).build();
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGlobalException(Exception ex, WebRequest request) {
    log.error("Unexpected error occurred", ex);

    ResponseBuilder builder =
        respond(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "INTERNAL_ERROR",
            "An unexpected error occurred",
            request);
    if (debugEnabled && !"production".equals(environment)) {
      builder.debugMessage(ex.getMessage());
    }
    return builder.build();
  }

  private ResponseBuilder respond(
      HttpStatus status, String code, String message, WebRequest request) {
    return new ResponseBuilder(
        status,
        ErrorResponse.builder()
            .timestamp(LocalDateTime.now())
            .status(status.value())
            .error(status.getReasonPhrase())
            .code(code)
            .message(message)
            .path(request.getDescription(false).replace("uri=", "")));
  }

  private static final class ResponseBuilder {
    private final HttpStatus status;
    private final ErrorResponse.ErrorResponseBuilder body;
    private final HttpHeaders headers = new HttpHeaders();

    private ResponseBuilder(HttpStatus status, ErrorResponse.ErrorResponseBuilder body) {
      this.status = status;
      this.body = body;
    }

    ResponseBuilder error(String error) {
      body.error(error);
      return this;
    }

    ResponseBuilder validationErrors(Map<String, String> errors) {
      body.validationErrors(errors);
      return this;
    }

    ResponseBuilder debugMessage(String message) {
      body.debugMessage(message);
      return this;
    }

    ResponseBuilder header(String name, String value) {
      headers.set(name, value);
      return this;
    }

    ResponseEntity<ErrorResponse> build() {
      return new ResponseEntity<>(body.build(), headers, status);
    }
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @Schema(description = "Error returned by every endpoint")
  public static class ErrorResponse {
    private LocalDateTime timestamp;
    private int status;
    private String error;

    /** Stable machine-readable reason, e.g. {@code CATALOG_UNAVAILABLE}. */
    @Schema(
        allowableValues = {
          "INVALID_INPUT",
          "VALIDATION_FAILED",
          "MALFORMED_JSON",
          "SUBMISSION_NOT_FOUND",
          "CATALOG_UNAVAILABLE",
          "METHOD_NOT_ALLOWED",
          "INTERNAL_ERROR"
        })
    private String code;

    private String message;
    private String path;
    private Map<String, String> validationErrors;
    private String debugMessage;

    public Map<String, String> getValidationErrors() {
      return validationErrors == null ? null : Collections.unmodifiableMap(validationErrors);
    }
  }
}
