package com.listingcheck.validator.dto.submission;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Submissions split into the review queue, highest risk first, and those already decided, newest
 * first, with the number of submissions in each status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionsResponse {

  @JsonProperty("pending")
  private List<Submission> pending;

  @JsonProperty("reviewed")
  private List<Submission> reviewed;

  /** Keyed by status value, e.g. {@code pending}; statuses with no submissions count zero. */
  @JsonProperty("counts")
  private Map<String, Integer> counts;
}
