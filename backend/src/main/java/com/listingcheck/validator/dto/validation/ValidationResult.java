package com.listingcheck.validator.dto.validation;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Outcome of validating one product listing")
public class ValidationResult {

  @JsonProperty("category")
  FieldDecision category;

  @JsonProperty("price")
  PriceDecision price;

  @JsonProperty("age_verification")
  FieldDecision ageVerification;

  @JsonProperty("overall")
  OverallVerdict overall;

  @JsonProperty("neighbours")
  List<Neighbour> neighbours;

  @JsonProperty("overall_message")
  public String getOverallMessage() {
    return overall == null ? null : overall.getLabel();
  }
}
