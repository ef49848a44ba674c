package dev.ragjudge.judge;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Telemetry for one transport call made by a judge. Prompt and response bodies are deliberately
 * not recorded.
 *
 * @param timestamp when the call started
 * @param operation judge operation name (e.g. {@code verify_claim})
 * @param model model reported by the provider on success, the requested model on failure
 * @param inputTokens prompt tokens, 0 on failure
 * @param outputTokens response tokens, 0 on failure
 * @param latencyMs measured call latency in milliseconds
 * @param success whether the transport call succeeded
 * @param error failure description, {@code null} on success
 */
public record JudgeTrace(
    Instant timestamp,
    String operation,
    String model,
    int inputTokens,
    int outputTokens,
    long latencyMs,
    boolean success,
    @Nullable String error) {

  public JudgeTrace {
    if (inputTokens < 0 || outputTokens < 0) {
      throw new IllegalArgumentException("Token counts must not be negative");
    }
    if (latencyMs < 0) {
      throw new IllegalArgumentException("latencyMs must not be negative");
    }
  }

  public int totalTokens() {
    return inputTokens + outputTokens;
  }
}
