package dev.ragjudge.evaluator;

/**
 * Raised when an evaluator is applied to a test case that lacks required data. This signals a
 * caller misconfiguration, so the runner lets it propagate instead of recording an error result.
 */
public class EvaluatorUsageException extends IllegalArgumentException {

  public EvaluatorUsageException(String message) {
    super(message);
  }
}
