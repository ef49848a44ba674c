package dev.ragjudge.judge.transport;

/**
 * Sends one system/user prompt pair to an LLM provider and returns the normalized text response.
 *
 * <p>Implementations own retry and backoff. They raise {@link
 * dev.ragjudge.judge.JudgeApiException} when the provider cannot be reached or answers with an
 * error status after retries, and {@link dev.ragjudge.judge.JudgeResponseException} when the
 * provider answered without usable text content.
 */
public interface JudgeTransport {

  TransportResponse send(
      String systemPrompt, String userPrompt, String model, double temperature, int maxTokens);
}
