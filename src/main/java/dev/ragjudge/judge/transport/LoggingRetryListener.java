package dev.ragjudge.judge.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;

/** Logs every failed transport attempt; the final outcome is reported by the caller. */
class LoggingRetryListener implements RetryListener {

  private static final Logger log = LoggerFactory.getLogger(LoggingRetryListener.class);

  @Override
  public <T, E extends Throwable> void onError(
      RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
    log.warn(
        "Judge transport attempt {} failed: {}", context.getRetryCount(), throwable.getMessage());
  }
}
