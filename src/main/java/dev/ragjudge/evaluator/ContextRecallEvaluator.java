package dev.ragjudge.evaluator;

import dev.ragjudge.concurrent.FanOut;
import dev.ragjudge.judge.ClaimVerdict;
import dev.ragjudge.judge.LlmJudge;
import dev.ragjudge.testcase.TestCase;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Share of the expected ground-truth facts that the retrieved context covers.
 *
 * <p>Requires {@link TestCase#expectedFacts()}. An empty fact list scores 1.0.
 */
public class ContextRecallEvaluator extends AbstractEvaluator {

  public static final String NAME = "context_recall";

  public ContextRecallEvaluator() {
    this(DEFAULT_THRESHOLD);
  }

  public ContextRecallEvaluator(double threshold) {
    this(threshold, FanOut.sharedExecutor());
  }

  public ContextRecallEvaluator(double threshold, Executor executor) {
    super(
        NAME,
        "Measures whether the retrieved context contains every expected fact",
        threshold,
        executor);
  }

  @Override
  public void validate(TestCase testCase) {
    if (testCase.expectedFacts() == null) {
      throw new EvaluatorUsageException(
          NAME
              + " requires 'expectedFacts' in test case '"
              + testCase.id()
              + "'. Add the ground-truth facts the context should contain, or use "
              + ContextPrecisionEvaluator.NAME
              + " instead, which evaluates retrieval quality without expected answers.");
    }
  }

  @Override
  public EvaluationResult evaluate(TestCase testCase, LlmJudge judge) {
    validate(testCase);
    List<String> facts = testCase.expectedFacts();
    if (facts.isEmpty()) {
      return result(
          1.0,
          "No expected facts to verify; context is vacuously complete.",
          Map.of("fact_coverage", List.of(), "total_facts", 0, "covered_facts", 0),
          0);
    }

    List<ClaimVerdict> verdicts =
        inParallel(facts, fact -> judge.verifyClaim(fact, testCase.context()));

    List<Map<String, Object>> coverage = new ArrayList<>(facts.size());
    int covered = 0;
    int tokens = 0;
    for (int i = 0; i < facts.size(); i++) {
      ClaimVerdict verdict = verdicts.get(i);
      tokens += verdict.tokensUsed();
      if (verdict.isSupported()) {
        covered++;
      }
      coverage.add(
          Map.of(
              "fact", facts.get(i),
              "verdict", verdict.verdict().name(),
              "evidence", verdict.evidence()));
    }
    double score = (double) covered / facts.size();
    return result(
        score,
        reasoning(covered, facts.size()),
        Map.of("fact_coverage", coverage, "total_facts", facts.size(), "covered_facts", covered),
        tokens);
  }

  static String reasoning(int covered, int total) {
    if (covered == total) {
      return "All " + total + " expected facts are covered by the context.";
    }
    if (covered == 0) {
      return "None of the " + total + " expected facts are covered by the context.";
    }
    return covered
        + " of "
        + total
        + " expected facts are covered ("
        + percent((double) covered / total)
        + "). "
        + (total - covered)
        + " fact(s) missing from context.";
  }
}
