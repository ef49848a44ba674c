package dev.ragjudge.evaluator;

import dev.ragjudge.concurrent.FanOut;
import dev.ragjudge.judge.ClaimVerdict;
import dev.ragjudge.judge.ClaimsResult;
import dev.ragjudge.judge.LlmJudge;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts atomic claims from a response and verifies each one against the context in parallel.
 * Shared by the faithfulness and hallucination evaluators.
 */
public class ClaimVerificationPipeline {

  private static final Logger log = LoggerFactory.getLogger(ClaimVerificationPipeline.class);

  private final Executor executor;

  public ClaimVerificationPipeline() {
    this(FanOut.sharedExecutor());
  }

  public ClaimVerificationPipeline(Executor executor) {
    this.executor = executor;
  }

  public ClaimVerificationResult verifyAll(String response, List<String> context, LlmJudge judge) {
    ClaimsResult extracted = judge.extractClaims(response);
    List<String> claims = extracted.claims();
    if (claims.isEmpty()) {
      log.debug("No claims extracted; skipping verification");
      return ClaimVerificationResult.noClaims(extracted.tokensUsed());
    }

    List<ClaimVerdict> verdicts =
        FanOut.map(claims, claim -> judge.verifyClaim(claim, context), executor);

    int totalTokens = extracted.tokensUsed();
    List<ClaimDetail> details = new ArrayList<>(claims.size());
    for (int i = 0; i < claims.size(); i++) {
      ClaimVerdict verdict = verdicts.get(i);
      totalTokens += verdict.tokensUsed();
      details.add(new ClaimDetail(claims.get(i), verdict.verdict(), verdict.evidence()));
    }
    log.debug("Verified {} claims using {} tokens", claims.size(), totalTokens);
    return new ClaimVerificationResult(details, verdicts, totalTokens, false);
  }
}
