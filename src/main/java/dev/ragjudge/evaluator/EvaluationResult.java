package dev.ragjudge.evaluator;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of one evaluator on one test case.
 *
 * @param evaluatorName evaluator that produced this result
 * @param score score in [0, 1]
 * @param passed whether the score met the evaluator's threshold
 * @param reasoning human-readable explanation
 * @param rawResponse structured breakdown (per claim, per document or per fact)
 * @param tokensUsed judge tokens consumed
 * @param error set when the evaluator itself failed; the score is then 0
 */
public record EvaluationResult(
    String evaluatorName,
    double score,
    boolean passed,
    String reasoning,
    Map<String, Object> rawResponse,
    int tokensUsed,
    @Nullable String error) {

  public EvaluationResult {
    if (evaluatorName == null || evaluatorName.isBlank()) {
      throw new IllegalArgumentException("evaluatorName must not be blank");
    }
    if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
      throw new IllegalArgumentException("Score must be in [0.0, 1.0] but was " + score);
    }
    if (tokensUsed < 0) {
      throw new IllegalArgumentException("tokensUsed must not be negative");
    }
    reasoning = reasoning == null ? "" : reasoning;
    rawResponse = rawResponse == null ? Map.of() : Map.copyOf(rawResponse);
  }

  public EvaluationResult(
      String evaluatorName,
      double score,
      boolean passed,
      String reasoning,
      Map<String, Object> rawResponse,
      int tokensUsed) {
    this(evaluatorName, score, passed, reasoning, rawResponse, tokensUsed, null);
  }

  /** Error-shaped result: score 0, not passed, reasoning and error describing the failure. */
  public static EvaluationResult failure(String evaluatorName, Throwable failure) {
    String description = describe(failure);
    return new EvaluationResult(
        evaluatorName, 0.0, false, "Evaluation failed: " + description, Map.of(), 0, description);
  }

  public boolean hasError() {
    return error != null;
  }

  static String describe(Throwable failure) {
    return failure.getClass().getSimpleName() + ": " + failure.getMessage();
  }
}
