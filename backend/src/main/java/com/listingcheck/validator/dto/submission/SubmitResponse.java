package com.listingcheck.validator.dto.submission;

import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitResponse {

  @JsonProperty("id")
  private String id;

  @JsonProperty("status")
  private SubmissionStatus status;

  @JsonProperty("timestamp")
  private LocalDateTime timestamp;
}
