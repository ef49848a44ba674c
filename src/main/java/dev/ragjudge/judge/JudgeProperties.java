package dev.ragjudge.judge;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Judge settings bound from {@code ragjudge.judge.*}.
 *
 * @param model provider model identifier
 * @param temperature sampling temperature in [0, 1]
 * @param maxTokens maximum response tokens in [1, 4096]
 * @param maxConcurrency maximum in-flight provider calls per judge
 */
@ConfigurationProperties(prefix = "ragjudge.judge")
public record JudgeProperties(String model, double temperature, int maxTokens, int maxConcurrency) {

  public JudgeProperties {
    if (maxConcurrency < 1) {
      throw new IllegalStateException(
          "ragjudge.judge.max-concurrency must be at least 1 but was " + maxConcurrency);
    }
  }

  public JudgeConfig toConfig() {
    return new JudgeConfig(model, temperature, maxTokens);
  }
}
