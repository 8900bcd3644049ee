package com.listingcheck.validator.service.explanation;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.springframework.stereotype.Service;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.listingcheck.validator.config.ApplicationProperties;
import com.listingcheck.validator.dto.submission.ProductInput;
import com.listingcheck.validator.dto.validation.ValidationResult;
import com.listingcheck.validator.exception.ExplanationException;
import com.listingcheck.validator.service.llm.LLMService;
import com.listingcheck.validator.service.llm.LLMServiceSelector;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Explains validation results through the configured LLM provider. Identical listings with
 * identical decisions share one cached explanation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmProductExplainer implements ProductExplainer {

  private final LLMServiceSelector llmServiceSelector;
  private final ExplanationPromptService promptService;
  private final ApplicationProperties applicationProperties;

  private Cache<String, String> explanationCache;

  @PostConstruct
  public void init() {
    ApplicationProperties.Cache cacheSettings =
        applicationProperties.getExplanation().getCache();
    if (cacheSettings.isEnabled()) {
      explanationCache =
          CacheBuilder.newBuilder()
              .maximumSize(cacheSettings.getMaxSize())
              .expireAfterWrite(cacheSettings.getExpireAfterWriteMinutes(), TimeUnit.MINUTES)
              .build();
    }
  }

  @Override
  public Optional<String> explain(ProductInput product, ValidationResult result) {
    if (!applicationProperties.getExplanation().isEnabled()) {
      return Optional.empty();
    }

    Optional<LLMService> llmService = llmServiceSelector.findLLMService();
    if (llmService.isEmpty()) {
      log.debug("No LLM provider configured, skipping explanation");
      return Optional.empty();
    }

    String key = cacheKey(product, result);
    if (explanationCache != null) {
      String cached = explanationCache.getIfPresent(key);
      if (cached != null) {
        return Optional.of(cached);
      }
    }

    try {
      String prompt = promptService.buildExplanationPrompt(product, result);
      String explanation =
          llmService.get().complete(ExplanationPromptService.SYSTEM_PROMPT, prompt).strip();
      log.info(
          "Generated explanation for '{}' with model {}",
          product.getProductName(),
          llmService.get().getCurrentModelId());

      if (explanationCache != null) {
        explanationCache.put(key, explanation);
      }
      return Optional.of(explanation);
    } catch (Exception e) {
      throw new ExplanationException(
          "Failed to generate explanation for '" + product.getProductName() + "'", e);
    }
  }

  void clearCache() {
    if (explanationCache != null) {
      explanationCache.invalidateAll();
    }
  }

  static String cacheKey(ProductInput product, ValidationResult result) {
    return String.join(
        "|",
        String.valueOf(product.getProductName()),
        String.valueOf(product.getCategory()),
        product.getPrice() == null ? "null" : product.getPrice().stripTrailingZeros().toPlainString(),
        String.valueOf(product.getAgeFlag()),
        result.getCategory().getDecision().getValue(),
        result.getPrice().getDecision().getValue(),
        result.getAgeVerification().getDecision().getValue(),
        result.getOverall().getCode());
  }
}
