package com.listingcheck.validator.dto.submission;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Product listing as submitted by a store")
public class ProductInput {

  @Size(max = 500)
  @JsonProperty("product_name")
  private String productName;

  @Size(max = 200)
  @JsonProperty("category")
  private String category;

  @JsonProperty("price")
  private BigDecimal price;

  @Schema(allowableValues = {"Yes", "No"})
  @JsonProperty("age_flag")
  private String ageFlag;
}
