package dev.ragjudge.evaluator;

import dev.ragjudge.judge.LlmJudge;
import dev.ragjudge.testcase.TestCase;

/**
 * Assesses one quality dimension of a RAG answer using an {@link LlmJudge}.
 *
 * <p>Implementations are stateless apart from their configuration and may be shared across
 * threads.
 */
public interface Evaluator {

  /** Registry key, also used as the key in {@code TestResult} score and detail maps. */
  String name();

  String description();

  /** Minimum score that counts as passing, in [0, 1]. */
  double threshold();

  /**
   * Scores the test case. Judge failures propagate; the runner turns them into error results.
   *
   * @throws EvaluatorUsageException if the test case lacks data this evaluator requires
   */
  EvaluationResult evaluate(TestCase testCase, LlmJudge judge);

  /**
   * Checks that the test case carries what this evaluator needs, without calling the judge.
   *
   * @throws EvaluatorUsageException if it does not
   */
  default void validate(TestCase testCase) {}

  default boolean isPassing(double score) {
    return score >= threshold();
  }
}
