package dev.ragjudge.evaluator;

import org.jspecify.annotations.Nullable;

/** Creates an evaluator, optionally overriding its default threshold. */
@FunctionalInterface
public interface EvaluatorFactory {

  /**
   * @param threshold pass threshold in [0, 1], or {@code null} for the evaluator's default
   */
  Evaluator create(@Nullable Double threshold);
}
