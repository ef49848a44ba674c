package dev.ragjudge.judge;

/**
 * Raised when the provider answered successfully but the content is unusable: no text, malformed
 * JSON, a missing required field, or an unknown verdict. Never retried.
 */
public class JudgeResponseException extends JudgeException {

  public JudgeResponseException(String message) {
    super(message);
  }

  public JudgeResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
