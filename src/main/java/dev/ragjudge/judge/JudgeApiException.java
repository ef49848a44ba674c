package dev.ragjudge.judge;

import org.jspecify.annotations.Nullable;

/**
 * Raised when the call to the LLM provider fails: the provider could not be reached, or it
 * answered with an error status.
 *
 * <p>Connection failures, HTTP 429 and HTTP 5xx are retryable; every other status is not.
 */
public class JudgeApiException extends JudgeException {

  private final @Nullable Integer statusCode;
  private final boolean connectionFailure;

  public JudgeApiException(String message, @Nullable Integer statusCode) {
    this(message, statusCode, false, null);
  }

  public JudgeApiException(
      String message,
      @Nullable Integer statusCode,
      boolean connectionFailure,
      @Nullable Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.connectionFailure = connectionFailure;
  }

  /** Failure to reach the provider at all (refused, reset, timed out). */
  public static JudgeApiException connectionFailure(String message, Throwable cause) {
    return new JudgeApiException(message, null, true, cause);
  }

  public @Nullable Integer getStatusCode() {
    return statusCode;
  }

  public boolean isConnectionFailure() {
    return connectionFailure;
  }

  public boolean isRetryable() {
    if (connectionFailure) {
      return true;
    }
    return statusCode != null && (statusCode == 429 || statusCode >= 500);
  }
}
