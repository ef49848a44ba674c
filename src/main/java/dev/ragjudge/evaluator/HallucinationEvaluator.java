package dev.ragjudge.evaluator;

import dev.ragjudge.concurrent.FanOut;
import dev.ragjudge.judge.LlmJudge;
import dev.ragjudge.testcase.TestCase;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Penalizes claims the context does not support. Contradicted and unverifiable claims both count
 * as hallucinated.
 *
 * <p>Score = 1 - hallucinated / total. Stricter default threshold than faithfulness (0.8), since a
 * single invented fact is usually worse than a vague answer.
 */
public class HallucinationEvaluator extends AbstractEvaluator {

  public static final String NAME = "hallucination";
  public static final double DEFAULT_HALLUCINATION_THRESHOLD = 0.8;

  private final ClaimVerificationPipeline pipeline;

  public HallucinationEvaluator() {
    this(DEFAULT_HALLUCINATION_THRESHOLD);
  }

  public HallucinationEvaluator(double threshold) {
    this(threshold, FanOut.sharedExecutor());
  }

  public HallucinationEvaluator(double threshold, Executor executor) {
    super(
        NAME,
        "Detects claims in the response that are not supported by the retrieved context",
        threshold,
        executor);
    this.pipeline = new ClaimVerificationPipeline(executor);
  }

  @Override
  public EvaluationResult evaluate(TestCase testCase, LlmJudge judge) {
    ClaimVerificationResult verification =
        pipeline.verifyAll(testCase.response(), testCase.context(), judge);

    if (verification.claimsEmpty()) {
      return result(
          1.0,
          "No claims to verify; no hallucinations detected.",
          Map.of(
              "claims", List.of(),
              "total_claims", 0,
              "hallucinated_claims", List.of(),
              "hallucination_count", 0),
          verification.totalTokens());
    }

    int total = verification.totalClaims();
    List<ClaimDetail> hallucinated = verification.unsupportedClaims();
    double score = 1.0 - (double) hallucinated.size() / total;
    return result(
        score,
        reasoning(hallucinated.size(), total),
        Map.of(
            "claims", verification.claimDetails().stream().map(ClaimDetail::toRaw).toList(),
            "total_claims", total,
            "hallucinated_claims", hallucinated.stream().map(ClaimDetail::toRaw).toList(),
            "hallucination_count", hallucinated.size()),
        verification.totalTokens());
  }

  static String reasoning(int hallucinated, int total) {
    if (hallucinated == 0) {
      return "All " + total + " claims are grounded in the context. No hallucinations detected.";
    }
    if (hallucinated == total) {
      return "All " + total + " claims are hallucinated; none are supported by the context.";
    }
    return "Found "
        + hallucinated
        + " hallucinated claim(s) out of "
        + total
        + " ("
        + percent(1.0 - (double) hallucinated / total)
        + " grounded). "
        + (total - hallucinated)
        + " claim(s) are supported by the context.";
  }
}
