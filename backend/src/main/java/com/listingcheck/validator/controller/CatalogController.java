package com.listingcheck.validator.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.listingcheck.validator.service.catalog.CatalogIndexProvider;
import com.listingcheck.validator.service.similarity.CatalogIndex;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/catalog")
@RequiredArgsConstructor
@Tag(name = "Catalog", description = "HO reference catalog management")
public class CatalogController {

  private final CatalogIndexProvider catalogIndexProvider;

  @PostMapping("/reload")
  @Operation(
      summary = "Reload the reference catalog",
      description =
          "Re-reads the configured catalog file and swaps in the rebuilt index. In-flight"
              + " validations finish against the previous index.")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Catalog reloaded"),
        @ApiResponse(
            responseCode = "503",
            description = "Catalog could not be read; previous index kept",
            content = @Content)
      })
  public ResponseEntity<Map<String, Object>> reload() {
    CatalogIndex index = catalogIndexProvider.reload();
    return ResponseEntity.ok(
        Map.of(
            "status", "reloaded",
            "catalogSize", index.size(),
            "vocabularySize", index.getModel().vocabularySize()));
  }
}
