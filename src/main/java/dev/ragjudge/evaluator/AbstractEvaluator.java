package dev.ragjudge.evaluator;

import dev.ragjudge.concurrent.FanOut;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.function.Function;

/** Name, threshold and fan-out executor shared by the built-in evaluators. */
public abstract class AbstractEvaluator implements Evaluator {

  public static final double DEFAULT_THRESHOLD = 0.7;

  private final String name;
  private final String description;
  private final double threshold;
  private final Executor executor;

  protected AbstractEvaluator(
      String name, String description, double threshold, Executor executor) {
    if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
      throw new IllegalArgumentException(
          "Threshold for " + name + " must be in [0.0, 1.0] but was " + threshold);
    }
    this.name = name;
    this.description = description;
    this.threshold = threshold;
    this.executor = executor;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public String description() {
    return description;
  }

  @Override
  public double threshold() {
    return threshold;
  }

  /** Runs {@code task} for every input in parallel, preserving input order. */
  protected <T, R> List<R> inParallel(List<T> inputs, Function<? super T, ? extends R> task) {
    return FanOut.map(inputs, task, executor);
  }

  protected EvaluationResult result(
      double score, String reasoning, Map<String, Object> raw, int tokensUsed) {
    return new EvaluationResult(name, score, isPassing(score), reasoning, raw, tokensUsed);
  }

  /** Formats a ratio as a whole percentage, e.g. {@code 0.75 -> "75%"}. */
  static String percent(double ratio) {
    return String.format(Locale.ROOT, "%.0f%%", ratio * 100);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(threshold=" + threshold + ")";
  }
}
