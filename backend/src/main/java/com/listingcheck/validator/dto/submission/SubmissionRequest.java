package com.listingcheck.validator.dto.submission;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionRequest {

  @NotNull
  @Valid
  @JsonProperty("product")
  private ProductInput product;

  @Builder.Default
  @JsonProperty("accepted_changes")
  private List<FieldChange> acceptedChanges = new ArrayList<>();

  @JsonProperty("notes")
  private String notes;

  /** Set by the store to force head office review even when validation passes. */
  @JsonProperty("flagged")
  private boolean flagged;

  /** Attach a plain-English explanation to the stored submission. */
  @JsonProperty("explain")
  private boolean explain;
}
