package dev.ragjudge.evaluator;

import dev.ragjudge.judge.ClaimVerdict;
import java.util.List;

/**
 * Output of {@link ClaimVerificationPipeline}.
 *
 * @param claimDetails one entry per extracted claim, in extraction order
 * @param verdicts the judge's verdicts, aligned with {@code claimDetails}
 * @param totalTokens tokens spent on extraction plus every verification
 * @param claimsEmpty true when the judge extracted no claims
 */
public record ClaimVerificationResult(
    List<ClaimDetail> claimDetails,
    List<ClaimVerdict> verdicts,
    int totalTokens,
    boolean claimsEmpty) {

  public ClaimVerificationResult {
    claimDetails = List.copyOf(claimDetails);
    verdicts = List.copyOf(verdicts);
    if (totalTokens < 0) {
      throw new IllegalArgumentException("totalTokens must not be negative");
    }
  }

  static ClaimVerificationResult noClaims(int extractionTokens) {
    return new ClaimVerificationResult(List.of(), List.of(), extractionTokens, true);
  }

  public int totalClaims() {
    return claimDetails.size();
  }

  public int supportedClaims() {
    return (int) claimDetails.stream().filter(ClaimDetail::isSupported).count();
  }

  public List<ClaimDetail> unsupportedClaims() {
    return claimDetails.stream().filter(detail -> !detail.isSupported()).toList();
  }
}
