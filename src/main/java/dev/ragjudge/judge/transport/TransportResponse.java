package dev.ragjudge.judge.transport;

/**
 * Provider-neutral response of a single transport call.
 *
 * @param text raw text output of the model
 * @param inputTokens prompt tokens
 * @param outputTokens completion tokens
 * @param model model identifier reported by the provider
 */
public record TransportResponse(String text, int inputTokens, int outputTokens, String model) {

  public TransportResponse {
    if (text == null) {
      throw new IllegalArgumentException("text must not be null");
    }
    if (inputTokens < 0 || outputTokens < 0) {
      throw new IllegalArgumentException("Token counts must not be negative");
    }
    if (model == null || model.isBlank()) {
      throw new IllegalArgumentException("model must not be blank");
    }
  }

  public int totalTokens() {
    return inputTokens + outputTokens;
  }
}
