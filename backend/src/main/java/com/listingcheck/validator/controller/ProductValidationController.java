package com.listingcheck.validator.controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.listingcheck.validator.dto.submission.ExplanationResponse;
import com.listingcheck.validator.dto.submission.ProductInput;
import com.listingcheck.validator.dto.validation.ValidationResult;
import com.listingcheck.validator.service.SubmissionService;
import com.listingcheck.validator.service.catalog.CatalogIndexProvider;
import com.listingcheck.validator.service.llm.LLMServiceSelector;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Product Validation", description = "Validate store listings against the HO catalog")
public class ProductValidationController {

  private final SubmissionService submissionService;
  private final CatalogIndexProvider catalogIndexProvider;
  private final LLMServiceSelector llmServiceSelector;

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Service status and reference catalog size")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is running")})
  public ResponseEntity<Map<String, Object>> health() {
    boolean available = catalogIndexProvider.isAvailable();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", available ? "UP" : "DEGRADED");
    body.put("catalogSize", available ? catalogIndexProvider.getIndex().size() : 0);
    body.put("explanationProvider", llmServiceSelector.getActiveProvider());
    body.put("timestamp", System.currentTimeMillis());
    return ResponseEntity.ok(body);
  }

  @GetMapping("/categories")
  @Operation(
      summary = "List catalog categories",
      description = "Sorted distinct categories used by the HO reference catalog")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Categories retrieved"),
        @ApiResponse(
            responseCode = "503",
            description = "Reference catalog unavailable",
            content = @Content)
      })
  public ResponseEntity<List<String>> categories() {
    return ResponseEntity.ok(catalogIndexProvider.categories());
  }

  @PostMapping(
      value = "/validate",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Validate a product listing",
      description =
          "Checks category, price and age verification against similar HO catalog products")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Validation completed",
            content = @Content(schema = @Schema(implementation = ValidationResult.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content),
        @ApiResponse(
            responseCode = "503",
            description = "Reference catalog unavailable",
            content = @Content)
      })
  public ResponseEntity<ValidationResult> validate(@Valid @RequestBody ProductInput product) {
    log.debug("Validation request for '{}'", product.getProductName());
    return ResponseEntity.ok(submissionService.validate(product));
  }

  @PostMapping(
      value = "/explain",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Validate and explain",
      description =
          "Validates the listing and adds a plain-English explanation when an LLM provider is"
              + " configured. The explanation never changes the decisions.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Validation completed",
            content = @Content(schema = @Schema(implementation = ExplanationResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content)
      })
  public ResponseEntity<ExplanationResponse> explain(@Valid @RequestBody ProductInput product) {
    return ResponseEntity.ok(submissionService.validateAndExplain(product));
  }
}
