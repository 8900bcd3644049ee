package com.listingcheck.validator.service.llm;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.AccessDeniedException;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.Message;
import software.amazon.awssdk.services.bedrockruntime.model.SystemContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ThrottlingException;
import software.amazon.awssdk.services.bedrockruntime.model.ValidationException;

/**
 * AWS Bedrock provider using the unified Converse API, so any chat model enabled in the account
 * can be configured by id. The client is created at startup only when {@code aws.bedrock.enabled}
 * is set; credentials come from the default provider chain.
 */
@Slf4j
@Service
public class AwsBedrockService implements LLMService {

  private BedrockRuntimeClient bedrockRuntimeClient;

  @Value("${aws.bedrock.enabled:false}")
  private boolean enabled;

  @Value("${aws.bedrock.model-id:anthropic.claude-3-haiku-20240307-v1:0}")
  private String modelId;

  @Value("${aws.region:eu-west-2}")
  private String region;

  @Value("${aws.bedrock.retry.max-attempts:5}")
  private int maxRetryAttempts;

  @Value("${aws.bedrock.retry.initial-delay-ms:1000}")
  private long initialRetryDelayMs;

  @Value("${aws.bedrock.retry.max-delay-ms:60000}")
  private long maxRetryDelayMs;

  @Value("${aws.bedrock.retry.jitter-ms:1000}")
  private long retryJitterMs;

  @Value("${aws.bedrock.max-tokens:600}")
  private int maxTokens;

  @Value("${aws.bedrock.temperature:0.3}")
  private double temperature;

  @PostConstruct
  public void initializeClient() {
    if (!enabled) {
      log.debug("AWS Bedrock provider disabled");
      return;
    }
    this.bedrockRuntimeClient =
        BedrockRuntimeClient.builder()
            .region(Region.of(region))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .build();
    log.info("AWS Bedrock client initialized for region: {} with model: {}", region, modelId);
  }

  @PreDestroy
  public void close() {
    if (bedrockRuntimeClient != null) {
      bedrockRuntimeClient.close();
      bedrockRuntimeClient = null;
    }
  }

  @Override
  public boolean isConfigured() {
    return bedrockRuntimeClient != null && modelId != null && !modelId.isBlank();
  }

  @Override
  public String getCurrentModelId() {
    return modelId;
  }

  @Override
  public String complete(String systemPrompt, String userPrompt) throws Exception {
    if (!isConfigured()) {
      throw new IllegalStateException(
          "AWS Bedrock client not initialized. Set aws.bedrock.enabled=true and a model id.");
    }

    log.debug("Sending prompt to AWS Bedrock model {}", modelId);

    Message userMessage =
        Message.builder()
            .role(ConversationRole.USER)
            .content(ContentBlock.builder().text(userPrompt).build())
            .build();

    ConverseRequest.Builder requestBuilder =
        ConverseRequest.builder()
            .modelId(modelId)
            .messages(List.of(userMessage))
            .inferenceConfig(
                InferenceConfiguration.builder()
                    .maxTokens(maxTokens)
                    .temperature((float) temperature)
                    .build());
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      requestBuilder.system(SystemContentBlock.builder().text(systemPrompt).build());
    }
    ConverseRequest converseRequest = requestBuilder.build();

    int attempt = 0;
    long retryDelay = initialRetryDelayMs;

    while (true) {
      try {
        ConverseResponse response = bedrockRuntimeClient.converse(converseRequest);

        Message responseMessage = response.output().message();
        if (responseMessage != null && !responseMessage.content().isEmpty()) {
          String text = responseMessage.content().get(0).text();
          if (text != null) {
            return text;
          }
        }
        throw new IllegalStateException("No content in model response");

      } catch (ThrottlingException e) {
        attempt++;
        if (attempt >= maxRetryAttempts) {
          log.error("Max retry attempts ({}) reached for AWS Bedrock throttling", maxRetryAttempts);
          throw new IllegalStateException(
              String.format(
                  "AWS Bedrock throttling error after %d retry attempts", maxRetryAttempts),
              e);
        }

        log.warn(
            "AWS Bedrock throttling detected. Retrying in {} ms (attempt {}/{})",
            retryDelay,
            attempt,
            maxRetryAttempts);

        try {
          Thread.sleep(retryDelay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Retry interrupted", ie);
        }

        // Exponential backoff with jitter
        retryDelay =
            Math.min(retryDelay * 2 + (long) (Math.random() * retryJitterMs), maxRetryDelayMs);

      } catch (AccessDeniedException e) {
        log.error("Access denied to AWS Bedrock model: {}", modelId, e);
        throw new IllegalStateException(
            String.format(
                "No access to model '%s' in region %s. Enable it in the Bedrock console.",
                modelId, region),
            e);
      } catch (ValidationException e) {
        log.error("Validation error for model: {}", modelId, e);
        throw new IllegalStateException(
            String.format("Model '%s' rejected the request in region %s", modelId, region), e);
      }
    }
  }
}
