package dev.ragjudge.judge.transport;

import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the Anthropic Messages API, bound from {@code ragjudge.anthropic.*}.
 *
 * <p>The API key may be absent at startup; it is checked when the transport is first built.
 */
@ConfigurationProperties(prefix = "ragjudge.anthropic")
public record AnthropicProperties(
    String baseUrl,
    @Nullable String apiKey,
    String apiVersion,
    int connectTimeoutMs,
    int readTimeoutMs,
    Retry retry) {

  public AnthropicProperties {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalStateException("ragjudge.anthropic.base-url must not be blank");
    }
    if (apiVersion == null || apiVersion.isBlank()) {
      throw new IllegalStateException("ragjudge.anthropic.api-version must not be blank");
    }
    if (connectTimeoutMs <= 0 || readTimeoutMs <= 0) {
      throw new IllegalStateException("ragjudge.anthropic timeouts must be positive");
    }
    if (retry == null) {
      throw new IllegalStateException("ragjudge.anthropic.retry must be configured");
    }
  }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }

  /**
   * Retry settings.
   *
   * @param maxAttempts total attempts including the first
   * @param initialDelayMs wait before the first retry
   * @param multiplier growth factor between retries
   * @param maxDelayMs cap on the exponential part of the wait
   * @param maxJitterMs upper bound of the random extra wait
   */
  public record Retry(
      int maxAttempts,
      long initialDelayMs,
      double multiplier,
      long maxDelayMs,
      long maxJitterMs) {

    public JudgeRetryPolicy toPolicy() {
      return new JudgeRetryPolicy(
          maxAttempts,
          Duration.ofMillis(initialDelayMs),
          multiplier,
          Duration.ofMillis(maxDelayMs),
          Duration.ofMillis(maxJitterMs),
          JudgeRetryPolicy.RETRYABLE_API_ERRORS);
    }
  }
}
