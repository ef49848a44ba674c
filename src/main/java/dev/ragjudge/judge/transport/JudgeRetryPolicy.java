package dev.ragjudge.judge.transport;

import dev.ragjudge.judge.JudgeApiException;
import java.time.Duration;
import java.util.function.Predicate;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy for transport calls, expressed as data: which failures are retried, how many
 * attempts are made in total, and how long to wait between attempts.
 *
 * <p>The wait before retry {@code n} (1-based) is {@code min(initialDelay * multiplier^(n-1),
 * maxDelay)} plus a random jitter of up to {@code maxJitter}.
 *
 * @param maxAttempts total attempts including the first one
 * @param initialDelay wait before the first retry
 * @param multiplier growth factor applied per retry
 * @param maxDelay cap applied before jitter
 * @param maxJitter upper bound of the random delay added to every wait
 * @param retryable decides whether a failure is worth another attempt
 */
public record JudgeRetryPolicy(
    int maxAttempts,
    Duration initialDelay,
    double multiplier,
    Duration maxDelay,
    Duration maxJitter,
    Predicate<Throwable> retryable) {

  /** Connection failures, HTTP 429 and HTTP 5xx. */
  public static final Predicate<Throwable> RETRYABLE_API_ERRORS =
      t -> t instanceof JudgeApiException e && e.isRetryable();

  public JudgeRetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    if (initialDelay == null || initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must not be negative");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be at least 1.0");
    }
    if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be at least initialDelay");
    }
    if (maxJitter == null || maxJitter.isNegative()) {
      throw new IllegalArgumentException("maxJitter must not be negative");
    }
    if (retryable == null) {
      throw new IllegalArgumentException("retryable predicate must not be null");
    }
  }

  /** 3 attempts, 1s initial wait doubling up to 10s, up to 1s jitter. */
  public static JudgeRetryPolicy defaults() {
    return new JudgeRetryPolicy(
        3,
        Duration.ofSeconds(1),
        2.0,
        Duration.ofSeconds(10),
        Duration.ofSeconds(1),
        RETRYABLE_API_ERRORS);
  }

  public boolean isRetryable(Throwable failure) {
    return retryable.test(failure);
  }

  /**
   * Computes the wait before the given retry.
   *
   * @param retryNumber 1 for the wait between the first and second attempt
   * @param jitterFraction value in [0, 1) scaling {@link #maxJitter()}
   * @return the delay to sleep before the retry
   */
  public Duration delayBeforeRetry(int retryNumber, double jitterFraction) {
    if (retryNumber < 1) {
      throw new IllegalArgumentException("retryNumber must be at least 1");
    }
    double exponential = initialDelay.toMillis() * Math.pow(multiplier, retryNumber - 1);
    long capped = (long) Math.min(exponential, maxDelay.toMillis());
    long jitter = Math.round(maxJitter.toMillis() * jitterFraction);
    return Duration.ofMillis(capped + jitter);
  }

  /** Builds a Spring Retry template that applies this policy. */
  public RetryTemplate toRetryTemplate(Sleeper sleeper) {
    RetryTemplate template = new RetryTemplate();
    template.setRetryPolicy(new PredicateRetryPolicy(this));
    template.setBackOffPolicy(new JitteredExponentialBackOffPolicy(this, sleeper));
    template.registerListener(new LoggingRetryListener());
    return template;
  }
}
