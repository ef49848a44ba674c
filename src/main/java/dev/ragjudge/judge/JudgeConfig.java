package dev.ragjudge.judge;

/**
 * Model parameters used for every judge call.
 *
 * @param model provider model identifier
 * @param temperature sampling temperature in [0, 1]
 * @param maxTokens maximum response tokens in [1, 4096]
 */
public record JudgeConfig(String model, double temperature, int maxTokens) {

  public static final String DEFAULT_MODEL = "claude-sonnet-4-20250514";

  public JudgeConfig {
    if (model == null || model.isBlank()) {
      throw new IllegalArgumentException("Judge model must not be blank");
    }
    if (temperature < 0.0 || temperature > 1.0) {
      throw new IllegalArgumentException(
          "Judge temperature must be in [0.0, 1.0] but was " + temperature);
    }
    if (maxTokens < 1 || maxTokens > 4096) {
      throw new IllegalArgumentException(
          "Judge maxTokens must be in [1, 4096] but was " + maxTokens);
    }
  }

  /** Deterministic defaults: {@value #DEFAULT_MODEL}, temperature 0, 1024 tokens. */
  public static JudgeConfig defaults() {
    return new JudgeConfig(DEFAULT_MODEL, 0.0, 1024);
  }
}
