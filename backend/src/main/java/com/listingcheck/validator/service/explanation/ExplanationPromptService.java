package com.listingcheck.validator.service.explanation;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import com.listingcheck.validator.dto.submission.ProductInput;
import com.listingcheck.validator.dto.validation.FieldDecision;
import com.listingcheck.validator.dto.validation.PriceDecision;
import com.listingcheck.validator.dto.validation.ValidationResult;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class ExplanationPromptService {

  public static final String SYSTEM_PROMPT =
      "You explain validation results clearly to supermarket staff.";

  private static final String PROMPTS_PATH = "prompts/";
  private static final String EXPLANATION_TEMPLATE = "product-explanation";
  private static final String NOT_AVAILABLE = "n/a";

  public String buildExplanationPrompt(ProductInput product, ValidationResult result)
      throws IOException {
    String prompt = loadPromptTemplate(EXPLANATION_TEMPLATE);

    prompt = prompt.replace("{{PRODUCT_NAME}}", text(product.getProductName()));
    prompt = prompt.replace("{{CATEGORY}}", text(product.getCategory()));
    prompt = prompt.replace("{{PRICE}}", pounds(product.getPrice()));
    prompt = prompt.replace("{{AGE_FLAG}}", text(product.getAgeFlag()));
    prompt = prompt.replace("{{OVERALL}}", result.getOverallMessage());

    FieldDecision category = result.getCategory();
    prompt = prompt.replace("{{CATEGORY_DECISION}}", category.getDecision().getValue());
    prompt = prompt.replace("{{CATEGORY_MESSAGE}}", category.getMessage());
    prompt = prompt.replace("{{CATEGORY_PREDICTED}}", text(category.getPredicted()));
    prompt = prompt.replace("{{CATEGORY_CONFIDENCE}}", percent(category.getConfidence()));

    PriceDecision price = result.getPrice();
    prompt = prompt.replace("{{PRICE_DECISION}}", price.getDecision().getValue());
    prompt = prompt.replace("{{PRICE_MESSAGE}}", price.getMessage());
    prompt = prompt.replace("{{PRICE_MEDIAN}}", decimal(price.getMedian()));
    prompt = prompt.replace("{{PRICE_LOWER}}", decimal(price.getLower()));
    prompt = prompt.replace("{{PRICE_UPPER}}", decimal(price.getUpper()));

    FieldDecision age = result.getAgeVerification();
    prompt = prompt.replace("{{AGE_DECISION}}", age.getDecision().getValue());
    prompt = prompt.replace("{{AGE_MESSAGE}}", age.getMessage());
    prompt = prompt.replace("{{AGE_PREDICTED}}", text(age.getPredicted()));
    prompt = prompt.replace("{{AGE_CONFIDENCE}}", percent(age.getConfidence()));

    return prompt.strip();
  }

  public String loadPromptTemplate(String promptName) throws IOException {
    String fileName = PROMPTS_PATH + promptName + ".txt";
    ClassPathResource resource = new ClassPathResource(fileName);

    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
      return reader.lines().collect(Collectors.joining("\n"));
    } catch (IOException e) {
      log.error("Failed to load prompt template: {}", fileName, e);
      throw new IOException("Failed to load prompt template: " + fileName, e);
    }
  }

  private static String text(String value) {
    return value == null || value.isBlank() ? NOT_AVAILABLE : value;
  }

  private static String pounds(BigDecimal value) {
    return value == null ? NOT_AVAILABLE : "£" + value.setScale(2, RoundingMode.HALF_EVEN);
  }

  private static String decimal(BigDecimal value) {
    return value == null ? NOT_AVAILABLE : value.toPlainString();
  }

  private static String percent(Double value) {
    if (value == null) {
      return NOT_AVAILABLE;
    }
    return BigDecimal.valueOf(value * 100).setScale(0, RoundingMode.HALF_EVEN) + "%";
  }
}
