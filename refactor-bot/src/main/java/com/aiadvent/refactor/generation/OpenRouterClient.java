package com.aiadvent.refactor.generation;

import com.aiadvent.refactor.config.RefactorBotProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.retry.RetryContext;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * Minimal OpenAI-compatible chat-completions client. Every HTTP attempt, retry, token and cent of
 * cost is recorded in the caller's {@link UsageStats}.
 */
public class OpenRouterClient {

  private static final Logger log = LoggerFactory.getLogger(OpenRouterClient.class);
  private static final int MAX_LOGGED_PAYLOAD = 500;

  private final RestClient restClient;
  private final RefactorBotProperties.GenerationProperties properties;
  private final ObjectMapper objectMapper;
  private final RetryTemplate retryTemplate;

  public OpenRouterClient(
      RestClient restClient,
      RefactorBotProperties.GenerationProperties properties,
      ObjectMapper objectMapper) {
    this.restClient = Objects.requireNonNull(restClient, "restClient");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.retryTemplate = buildRetryTemplate(properties);
  }

  public String complete(ChatCompletionRequest request, UsageStats usage) {
    Objects.requireNonNull(request, "request");
    if (!StringUtils.hasText(properties.getApiKey())) {
      throw new IllegalStateException(
          "Generation API key is not configured (refactor.generation.api-key / OPENROUTER_API_KEY)");
    }
    String body;
    try {
      body = objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize chat completion request", ex);
    }
    ChatCompletionResponse response =
        retryTemplate.execute(context -> attempt(context, body, usage));
    String content = response.firstContent();
    return content == null ? "" : content;
  }

  private ChatCompletionResponse attempt(RetryContext context, String body, UsageStats usage) {
    int attempt = context.getRetryCount() + 1;
    if (usage != null) {
      usage.recordRequest(attempt > 1);
    }
    long started = System.nanoTime();
    try {
      RawResponse raw = send(body);
      if (raw.status() < 200 || raw.status() >= 300) {
        throw new GenerationApiException(
            raw.status(),
            raw.body(),
            "Generation API returned HTTP " + raw.status() + ": " + abbreviate(raw.body()));
      }
      ChatCompletionResponse response = parse(raw);
      if (usage != null) {
        usage.recordSuccess(response.usage());
      }
      return response;
    } catch (RuntimeException ex) {
      logAttemptFailure(attempt, ex);
      throw ex;
    } finally {
      if (usage != null) {
        usage.recordLatency((System.nanoTime() - started) / 1_000_000L);
      }
    }
  }

  private RawResponse send(String body) {
    try {
      return restClient
          .post()
          .uri("/chat/completions")
          .contentType(MediaType.APPLICATION_JSON)
          .accept(MediaType.APPLICATION_JSON)
          .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey().trim())
          .body(body)
          .exchange(
              (request, response) ->
                  new RawResponse(
                      response.getStatusCode().value(),
                      StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8)));
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        throw new GenerationTimeoutException(
            "Generation request timed out after " + properties.getTimeout().toSeconds() + "s", ex);
      }
      throw new GenerationTransportException(
          "Generation request failed: " + ex.getMostSpecificCause().getMessage(), ex);
    }
  }

  private ChatCompletionResponse parse(RawResponse raw) {
    try {
      ChatCompletionResponse response =
          objectMapper.readValue(raw.body(), ChatCompletionResponse.class);
      if (response == null) {
        throw new GenerationApiException(raw.status(), raw.body(), "Generation API returned no body");
      }
      return response;
    } catch (JsonProcessingException ex) {
      throw new GenerationApiException(
          raw.status(),
          raw.body(),
          "Generation API returned malformed JSON: " + ex.getOriginalMessage(),
          ex);
    }
  }

  static boolean isRetryable(Throwable throwable) {
    if (throwable instanceof GenerationApiException apiException) {
      return apiException.isRetryable();
    }
    return throwable instanceof GenerationTimeoutException
        || throwable instanceof GenerationTransportException;
  }

  static boolean isTimeout(Throwable throwable) {
    Throwable current = throwable;
    while (current != null) {
      if (current instanceof HttpTimeoutException
          || current instanceof SocketTimeoutException
          || current instanceof TimeoutException
          || (current instanceof InterruptedIOException
              && String.valueOf(current.getMessage()).toLowerCase().contains("timed out"))) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static RetryTemplate buildRetryTemplate(
      RefactorBotProperties.GenerationProperties properties) {
    long initialInterval = Math.max(1L, properties.getInitialBackoff().toMillis());
    double multiplier = Math.max(1.0d, properties.getBackoffMultiplier());
    long maxInterval = Math.max(initialInterval, initialInterval * 32L);
    return RetryTemplate.builder()
        .maxAttempts(Math.max(1, properties.getMaxRetries() + 1))
        .exponentialBackoff(initialInterval, multiplier, maxInterval)
        .retryOn(OpenRouterClient::isRetryable)
        .build();
  }

  private void logAttemptFailure(int attempt, RuntimeException ex) {
    boolean retryable = isRetryable(ex);
    if (retryable && attempt <= properties.getMaxRetries()) {
      log.warn(
          "Generation attempt {} failed, retrying: model={}, error={}",
          attempt,
          properties.getModel(),
          ex.getMessage());
    } else {
      log.warn(
          "Generation attempt {} failed: model={}, retryable={}, error={}",
          attempt,
          properties.getModel(),
          retryable,
          ex.getMessage());
    }
  }

  private static String abbreviate(String value) {
    if (value == null) {
      return "";
    }
    String trimmed = value.strip();
    return trimmed.length() <= MAX_LOGGED_PAYLOAD
        ? trimmed
        : trimmed.substring(0, MAX_LOGGED_PAYLOAD) + "...";
  }

  private record RawResponse(int status, String body) {}
}
