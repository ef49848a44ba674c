package dev.ragjudge.judge;

/** Base type for failures raised by judge operations. */
public class JudgeException extends RuntimeException {

  public JudgeException(String message) {
    super(message);
  }

  public JudgeException(String message, Throwable cause) {
    super(message, cause);
  }
}
