package com.listingcheck.validator.service.llm;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chat completions client for the OpenAI API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAIService implements LLMService {

  static final String OPENAI_API_URL = "https://api.openai.com/v1/chat/completions";

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;

  @Value("${openai.api-key:}")
  private String openaiApiKey;

  @Value("${openai.model:gpt-4.1-nano}")
  private String model;

  @Value("${openai.max-tokens:600}")
  private int maxTokens;

  @Value("${openai.temperature:0.3}")
  private double temperature;

  @Value("${openai.retry.max-attempts:3}")
  private int maxRetryAttempts;

  @Value("${openai.retry.backoff-ms:1000}")
  private long retryBackoffMs;

  @Override
  public boolean isConfigured() {
    return openaiApiKey != null && !openaiApiKey.trim().isEmpty();
  }

  @Override
  public String complete(String systemPrompt, String userPrompt) throws Exception {
    if (!isConfigured()) {
      throw new IllegalStateException(
          "OpenAI API key not configured. Please set OPENAI_API_KEY environment variable.");
    }

    log.info("OpenAI request model={}, maxTokens={}, temperature={}", model, maxTokens, temperature);

    ObjectNode requestBody = objectMapper.createObjectNode();
    requestBody.put("model", model);
    requestBody.put("max_tokens", maxTokens);
    requestBody.put("temperature", temperature);

    ArrayNode messages = requestBody.putArray("messages");
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      messages.addObject().put("role", "system").put("content", systemPrompt);
    }
    messages.addObject().put("role", "user").put("content", userPrompt);

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setBearerAuth(openaiApiKey);

    HttpEntity<String> entity = new HttpEntity<>(requestBody.toString(), headers);

    int attempt = 0;
    while (true) {
      try {
        ResponseEntity<String> response =
            restTemplate.exchange(OPENAI_API_URL, HttpMethod.POST, entity, String.class);
        return extractContent(response);
      } catch (Exception e) {
        attempt++;
        log.warn("OpenAI API call attempt {} failed: {}", attempt, e.getMessage());

        if (attempt >= maxRetryAttempts) {
          throw new IllegalStateException(
              "OpenAI API call failed after " + maxRetryAttempts + " attempts", e);
        }

        try {
          Thread.sleep(retryBackoffMs * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted during retry", ie);
        }
      }
    }
  }

  private String extractContent(ResponseEntity<String> response) throws Exception {
    if (response.getBody() != null) {
      JsonNode choices = objectMapper.readTree(response.getBody()).get("choices");
      if (choices != null && choices.isArray() && choices.size() > 0) {
        JsonNode messageNode = choices.get(0).get("message");
        if (messageNode != null && messageNode.has("content")) {
          String content = messageNode.get("content").asText();
          log.debug("OpenAI response content length={} chars", content.length());
          return content;
        }
      }
    }

    log.error(
        "Invalid response format from OpenAI API: status={}, bodyPresent={}",
        response.getStatusCode(),
        response.getBody() != null);
    throw new IllegalStateException("Invalid response format from OpenAI API");
  }

  @Override
  public String getCurrentModelId() {
    return model;
  }
}
