package dev.ragjudge.judge;

/** Three-way classification of a claim against a set of context documents. */
public enum Verdict {
  /** The context states or directly implies the claim. */
  SUPPORTED,
  /** The context explicitly contradicts the claim. */
  CONTRADICTED,
  /** The context neither supports nor contradicts the claim. */
  NOT_ENOUGH_INFO
}
