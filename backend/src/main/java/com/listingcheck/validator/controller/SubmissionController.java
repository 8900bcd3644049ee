package com.listingcheck.validator.controller;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.listingcheck.validator.dto.submission.Submission;
import com.listingcheck.validator.dto.submission.SubmissionRequest;
import com.listingcheck.validator.dto.submission.SubmissionStatus;
import com.listingcheck.validator.dto.submission.SubmissionsResponse;
import com.listingcheck.validator.dto.submission.SubmitResponse;
import com.listingcheck.validator.exception.ValidationInputException;
import com.listingcheck.validator.service.SubmissionService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Store submissions and the head office review queue. */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Submissions", description = "Store submissions and head office review")
public class SubmissionController {

  private final SubmissionService submissionService;

  @PostMapping(
      value = "/submit",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Submit a product listing",
      description =
          "Re-validates and stores the listing. Flagged listings, and listings that are not ready"
              + " for automatic approval, wait for head office review.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Submission stored",
            content = @Content(schema = @Schema(implementation = SubmitResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content)
      })
  public ResponseEntity<SubmitResponse> submit(@Valid @RequestBody SubmissionRequest request) {
    Submission stored = submissionService.submit(request);
    return ResponseEntity.ok(
        SubmitResponse.builder()
            .id(stored.getId())
            .status(stored.getStatus())
            .timestamp(stored.getTimestamp())
            .build());
  }

  @GetMapping("/submissions")
  @Operation(
      summary = "List submissions",
      description =
          "Pending submissions by risk, highest first, then newest; reviewed submissions newest"
              + " first; counts per status")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Submissions listed"),
        @ApiResponse(responseCode = "400", description = "Unknown status", content = @Content)
      })
  public ResponseEntity<SubmissionsResponse> listSubmissions(
      @Parameter(description = "Only list submissions with this status: pending, approved, denied")
          @RequestParam(value = "status", required = false)
          String status) {
    return ResponseEntity.ok(submissionService.listSubmissions(parseStatus(status)));
  }

  @GetMapping(value = "/submissions/export", produces = "text/csv")
  @Operation(summary = "Export submissions", description = "All submissions as a CSV download")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "CSV written")})
  public void exportSubmissions(HttpServletResponse response) throws IOException {
    response.setContentType("text/csv");
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    response.setHeader(
        HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"submissions.csv\"");
    Writer writer = new OutputStreamWriter(response.getOutputStream(), StandardCharsets.UTF_8);
    int rows = submissionService.exportCsv(writer);
    log.info("Exported {} submissions as CSV", rows);
  }

  @GetMapping("/submissions/{id}")
  @Operation(summary = "Get a submission")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Submission found"),
        @ApiResponse(responseCode = "404", description = "No such submission", content = @Content)
      })
  public ResponseEntity<Submission> getSubmission(@PathVariable String id) {
    return ResponseEntity.ok(submissionService.getSubmission(id));
  }

  @PostMapping("/submissions/{id}/approve")
  @Operation(summary = "Approve a submission")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Submission approved"),
        @ApiResponse(responseCode = "404", description = "No such submission", content = @Content)
      })
  public ResponseEntity<Submission> approve(@PathVariable String id) {
    return ResponseEntity.ok(submissionService.approve(id));
  }

  @PostMapping("/submissions/{id}/deny")
  @Operation(summary = "Deny a submission")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Submission denied"),
        @ApiResponse(responseCode = "404", description = "No such submission", content = @Content)
      })
  public ResponseEntity<Submission> deny(
      @PathVariable String id,
      @Parameter(description = "Reason shown to the store")
          @RequestParam(value = "reason", required = false, defaultValue = "")
          String reason) {
    return ResponseEntity.ok(submissionService.deny(id, reason));
  }

  private static SubmissionStatus parseStatus(String status) {
    if (status == null || status.isBlank()) {
      return null;
    }
    try {
      return SubmissionStatus.fromValue(status.trim());
    } catch (IllegalArgumentException e) {
      throw new ValidationInputException(
          "Unknown status '" + status + "'; expected pending, approved or denied");
    }
  }
}
