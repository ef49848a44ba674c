package dev.ragjudge.testcase;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Aggregated outcome of running every configured evaluator against one {@link TestCase}.
 *
 * @param testCase the evaluated test case
 * @param status overall status derived from the evaluator results
 * @param scores evaluator name to score in [0, 1]
 * @param details evaluator name to reasoning, pass flag, raw payload and optional error
 * @param executionTimeMs wall-clock time spent on this test case
 * @param judgeTokensUsed tokens consumed by all judge calls for this test case
 */
public record TestResult(
    TestCase testCase,
    EvalStatus status,
    Map<String, Double> scores,
    Map<String, EvaluationDetail> details,
    long executionTimeMs,
    int judgeTokensUsed) {

  public TestResult {
    if (testCase == null) {
      throw new IllegalArgumentException("testCase must not be null");
    }
    if (status == null) {
      throw new IllegalArgumentException("status must not be null");
    }
    scores = scores == null ? Map.of() : Map.copyOf(scores);
    details = details == null ? Map.of() : Map.copyOf(details);
  }

  /** True iff the status is {@link EvalStatus#PASSED}. */
  public boolean passed() {
    return status == EvalStatus.PASSED;
  }

  /** Score reported by the named evaluator, or {@code null} if it did not run. */
  public @Nullable Double score(String evaluatorName) {
    return scores.get(evaluatorName);
  }
}
