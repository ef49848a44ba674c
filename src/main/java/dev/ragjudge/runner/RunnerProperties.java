package dev.ragjudge.runner;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runner settings bound from {@code ragjudge.runner.*}.
 *
 * @param evaluators names of the evaluators to run on every test case, in order
 * @param thresholds per-evaluator threshold overrides
 * @param maxConcurrency test cases evaluated at the same time in batch mode
 * @param failFast propagate evaluator and test-case failures instead of recording them
 * @param testCaseTimeout optional limit per test case in batch mode; late cases become ERROR. The
 *     timed-out work is not interrupted and keeps its concurrency permit until it finishes, so
 *     with {@code maxConcurrency} of 1 later cases still wait for it
 */
@ConfigurationProperties(prefix = "ragjudge.runner")
public record RunnerProperties(
    List<String> evaluators,
    Map<String, Double> thresholds,
    int maxConcurrency,
    boolean failFast,
    @Nullable Duration testCaseTimeout) {

  public static final List<String> DEFAULT_EVALUATORS = List.of("faithfulness", "relevance");
  public static final int DEFAULT_MAX_CONCURRENCY = 5;

  public RunnerProperties {
    evaluators =
        evaluators == null || evaluators.isEmpty() ? DEFAULT_EVALUATORS : List.copyOf(evaluators);
    thresholds = thresholds == null ? Map.of() : Map.copyOf(thresholds);
    if (maxConcurrency < 1) {
      throw new IllegalStateException(
          "ragjudge.runner.max-concurrency must be at least 1 but was " + maxConcurrency);
    }
    thresholds.forEach(
        (name, threshold) -> {
          if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalStateException(
                "ragjudge.runner.thresholds."
                    + name
                    + " must be in [0.0, 1.0] but was "
                    + threshold);
          }
        });
    if (testCaseTimeout != null && (testCaseTimeout.isZero() || testCaseTimeout.isNegative())) {
      throw new IllegalStateException("ragjudge.runner.test-case-timeout must be positive");
    }
  }

  /** Faithfulness and relevance, 5 concurrent test cases, errors recorded, no timeout. */
  public static RunnerProperties defaults() {
    return new RunnerProperties(DEFAULT_EVALUATORS, Map.of(), DEFAULT_MAX_CONCURRENCY, false, null);
  }

  public RunnerProperties withEvaluators(List<String> names) {
    return new RunnerProperties(names, thresholds, maxConcurrency, failFast, testCaseTimeout);
  }

  public RunnerProperties withMaxConcurrency(int concurrency) {
    return new RunnerProperties(evaluators, thresholds, concurrency, failFast, testCaseTimeout);
  }

  public RunnerProperties withFailFast(boolean enabled) {
    return new RunnerProperties(evaluators, thresholds, maxConcurrency, enabled, testCaseTimeout);
  }

  public RunnerProperties withTestCaseTimeout(@Nullable Duration timeout) {
    return new RunnerProperties(evaluators, thresholds, maxConcurrency, failFast, timeout);
  }

  public RunnerProperties withThreshold(String evaluator, double threshold) {
    Map<String, Double> merged = new HashMap<>(thresholds);
    merged.put(evaluator, threshold);
    return new RunnerProperties(evaluators, merged, maxConcurrency, failFast, testCaseTimeout);
  }
}
