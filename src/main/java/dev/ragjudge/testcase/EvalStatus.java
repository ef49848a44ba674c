package dev.ragjudge.testcase;

/** Overall outcome of evaluating one {@link TestCase}. */
public enum EvalStatus {
  PASSED,
  FAILED,
  SKIPPED,
  ERROR
}
