package dev.ragjudge.testcase;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Per-evaluator breakdown stored in a {@link TestResult}.
 *
 * @param reasoning human-readable explanation of the score
 * @param passed whether the evaluator's threshold was met
 * @param raw structured diagnostic payload produced by the evaluator
 * @param error failure description when the evaluator itself failed, otherwise {@code null}
 */
public record EvaluationDetail(
    String reasoning, boolean passed, Map<String, Object> raw, @Nullable String error) {

  public EvaluationDetail {
    reasoning = reasoning == null ? "" : reasoning;
    raw = raw == null ? Map.of() : Map.copyOf(raw);
  }

  public boolean hasError() {
    return error != null;
  }
}
