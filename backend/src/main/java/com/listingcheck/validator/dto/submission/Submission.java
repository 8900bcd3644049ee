package com.listingcheck.validator.dto.submission;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.listingcheck.validator.dto.validation.Decision;
import com.listingcheck.validator.dto.validation.ValidationResult;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Submission {

  @JsonProperty("id")
  private String id;

  @JsonProperty("timestamp")
  private LocalDateTime timestamp;

  @JsonProperty("product")
  private ProductInput product;

  @JsonProperty("validation")
  private ValidationResult validation;

  @Builder.Default
  @JsonProperty("accepted_changes")
  private List<FieldChange> acceptedChanges = new ArrayList<>();

  @JsonProperty("notes")
  private String notes;

  @JsonProperty("status")
  private SubmissionStatus status;

  @JsonProperty("flagged")
  private boolean flagged;

  @JsonProperty("denial_reason")
  private String denialReason;

  @JsonProperty("explanation")
  private String explanation;

  @JsonProperty("reviewed_at")
  private LocalDateTime reviewedAt;

  /** Sum of the field decisions' risk weights; higher needs head office attention sooner. */
  @JsonProperty(value = "risk_score", access = JsonProperty.Access.READ_ONLY)
  public int getRiskScore() {
    if (validation == null) {
      return 0;
    }
    return weightOf(validation.getCategory())
        + weightOf(validation.getPrice())
        + weightOf(validation.getAgeVerification());
  }

  @JsonProperty(value = "risk_level", access = JsonProperty.Access.READ_ONLY)
  public RiskLevel getRiskLevel() {
    return RiskLevel.fromScore(getRiskScore());
  }

  private static int weightOf(Decision decision) {
    return decision == null || decision.getDecision() == null
        ? 0
        : decision.getDecision().getRiskWeight();
  }
}
