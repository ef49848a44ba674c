package dev.ragjudge.judge.transport;

import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.context.RetryContextSupport;

/**
 * Spring Retry policy driven by {@link JudgeRetryPolicy#retryable()}: a failure is retried only
 * when the predicate accepts it and attempts remain.
 */
class PredicateRetryPolicy implements RetryPolicy {

  private final JudgeRetryPolicy policy;

  PredicateRetryPolicy(JudgeRetryPolicy policy) {
    this.policy = policy;
  }

  @Override
  public boolean canRetry(RetryContext context) {
    Throwable last = context.getLastThrowable();
    if (last == null) {
      return true;
    }
    return policy.isRetryable(last) && context.getRetryCount() < policy.maxAttempts();
  }

  @Override
  public RetryContext open(RetryContext parent) {
    return new RetryContextSupport(parent);
  }

  @Override
  public void close(RetryContext context) {
    // no per-call resources
  }

  @Override
  public void registerThrowable(RetryContext context, Throwable throwable) {
    ((RetryContextSupport) context).registerThrowable(throwable);
  }
}
