package dev.ragjudge.judge.transport;

import java.util.concurrent.ThreadLocalRandom;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/** Sleeps for {@link JudgeRetryPolicy#delayBeforeRetry(int, double)} between attempts. */
class JitteredExponentialBackOffPolicy implements BackOffPolicy {

  private final JudgeRetryPolicy policy;
  private final Sleeper sleeper;

  JitteredExponentialBackOffPolicy(JudgeRetryPolicy policy, Sleeper sleeper) {
    this.policy = policy;
    this.sleeper = sleeper;
  }

  @Override
  public BackOffContext start(RetryContext context) {
    return new RetryCounter();
  }

  @Override
  public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
    RetryCounter counter = (RetryCounter) backOffContext;
    counter.retries++;
    long delayMs =
        policy
            .delayBeforeRetry(counter.retries, ThreadLocalRandom.current().nextDouble())
            .toMillis();
    try {
      sleeper.sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackOffInterruptedException("Interrupted while backing off before retry", e);
    }
  }

  private static final class RetryCounter implements BackOffContext {

    private static final long serialVersionUID = 1L;

    private int retries;
  }
}
