package com.listingcheck.validator.service.llm;

import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses between OpenAI and AWS Bedrock. The provider named by {@code llm.provider} wins when it
 * is configured, otherwise any configured provider is used.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LLMServiceSelector {

  private final AwsBedrockService awsBedrockService;
  private final OpenAIService openAIService;

  @Value("${llm.provider:openai}")
  private String preferredProvider;

  /**
   * Finds the LLM service to use.
   * @return the configured service, or empty if none is configured
   */
  public Optional<LLMService> findLLMService() {
    if ("openai".equalsIgnoreCase(preferredProvider) && openAIService.isConfigured()) {
      return Optional.of(openAIService);
    }

    if ("bedrock".equalsIgnoreCase(preferredProvider) && awsBedrockService.isConfigured()) {
      return Optional.of(awsBedrockService);
    }

    if (openAIService.isConfigured()) {
      log.debug("Preferred provider '{}' not available, falling back to OpenAI", preferredProvider);
      return Optional.of(openAIService);
    }

    if (awsBedrockService.isConfigured()) {
      log.debug(
          "Preferred provider '{}' not available, falling back to AWS Bedrock", preferredProvider);
      return Optional.of(awsBedrockService);
    }

    return Optional.empty();
  }

  /**
   * Gets the currently active provider name
   * @return "openai", "bedrock" or "none"
   */
  public String getActiveProvider() {
    return findLLMService()
        .map(service -> service == openAIService ? "openai" : "bedrock")
        .orElse("none");
  }
}
