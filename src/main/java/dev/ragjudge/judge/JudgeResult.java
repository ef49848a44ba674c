package dev.ragjudge.judge;

/**
 * Score-bearing result of a judge scoring call.
 *
 * @param score normalized score in [0, 1]
 * @param reasoning explanation returned by the judge (may be empty)
 * @param tokensUsed input plus output tokens of the underlying call
 */
public record JudgeResult(double score, String reasoning, int tokensUsed) {

  public JudgeResult {
    if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
      throw new IllegalArgumentException("Score must be in [0.0, 1.0] but was " + score);
    }
    if (tokensUsed < 0) {
      throw new IllegalArgumentException("tokensUsed must not be negative");
    }
    reasoning = reasoning == null ? "" : reasoning;
  }
}
