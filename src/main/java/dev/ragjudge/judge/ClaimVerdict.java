package dev.ragjudge.judge;

/**
 * Outcome of verifying a single claim.
 *
 * @param verdict three-way classification
 * @param evidence quote or explanation backing the verdict
 * @param tokensUsed tokens consumed by the verification call
 */
public record ClaimVerdict(Verdict verdict, String evidence, int tokensUsed) {

  public ClaimVerdict {
    if (verdict == null) {
      throw new IllegalArgumentException("verdict must not be null");
    }
    if (tokensUsed < 0) {
      throw new IllegalArgumentException("tokensUsed must not be negative");
    }
    evidence = evidence == null ? "" : evidence;
  }

  public boolean isSupported() {
    return verdict == Verdict.SUPPORTED;
  }
}
