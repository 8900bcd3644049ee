package com.listingcheck.validator.service.llm;

/**
 * Common interface for LLM providers (OpenAI, AWS Bedrock).
 */
public interface LLMService {

  /**
   * Sends a single-turn chat to the model.
   * @param systemPrompt instructions for the model, may be null
   * @param userPrompt the user message
   * @return the model's text response
   * @throws Exception if the call fails
   */
  String complete(String systemPrompt, String userPrompt) throws Exception;

  /**
   * Gets the current model ID being used
   * @return The model identifier
   */
  String getCurrentModelId();

  /**
   * Checks if the service is properly configured
   * @return true if configured, false otherwise
   */
  boolean isConfigured();
}
