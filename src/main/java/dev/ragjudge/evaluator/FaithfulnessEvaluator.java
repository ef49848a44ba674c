package dev.ragjudge.evaluator;

import dev.ragjudge.concurrent.FanOut;
import dev.ragjudge.judge.LlmJudge;
import dev.ragjudge.testcase.TestCase;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Share of the response's claims that the context supports.
 *
 * <p>Score = supported claims / total claims. A response with no claims is vacuously faithful and
 * scores 1.0.
 */
public class FaithfulnessEvaluator extends AbstractEvaluator {

  public static final String NAME = "faithfulness";

  private final ClaimVerificationPipeline pipeline;

  public FaithfulnessEvaluator() {
    this(DEFAULT_THRESHOLD);
  }

  public FaithfulnessEvaluator(double threshold) {
    this(threshold, FanOut.sharedExecutor());
  }

  public FaithfulnessEvaluator(double threshold, Executor executor) {
    super(
        NAME,
        "Measures whether every claim in the response is grounded in the retrieved context",
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
          "No claims to verify; response is vacuously faithful.",
          Map.of("claims", List.of(), "total_claims", 0, "supported_claims", 0),
          verification.totalTokens());
    }

    int total = verification.totalClaims();
    int supported = verification.supportedClaims();
    double score = (double) supported / total;
    return result(
        score,
        reasoning(supported, total),
        Map.of(
            "claims", verification.claimDetails().stream().map(ClaimDetail::toRaw).toList(),
            "total_claims", total,
            "supported_claims", supported),
        verification.totalTokens());
  }

  static String reasoning(int supported, int total) {
    if (supported == total) {
      return "All " + total + " claims are supported by the context.";
    }
    if (supported == 0) {
      return "None of the " + total + " claims are supported by the context.";
    }
    return supported
        + " of "
        + total
        + " claims are supported ("
        + percent((double) supported / total)
        + "). "
        + (total - supported)
        + " claim(s) not grounded in context.";
  }
}
