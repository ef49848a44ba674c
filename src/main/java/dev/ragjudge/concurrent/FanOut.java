package dev.ragjudge.concurrent;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Runs one blocking task per input in parallel and collects the results in input order.
 *
 * <p>No bound is applied here: the judge limits in-flight provider calls, so fanning out wider
 * than that only queues callers on its permits.
 */
public final class FanOut {

  private static final ExecutorService SHARED = newSharedPool();

  private FanOut() {}

  /** Executor used when callers do not supply one. Threads are daemons and idle out. */
  public static Executor sharedExecutor() {
    return SHARED;
  }

  /**
   * Applies {@code task} to every input concurrently and waits for all of them.
   *
   * <p>If any task fails, its exception is rethrown unwrapped once every task has settled; when
   * several fail, the first failing input wins.
   */
  public static <T, R> List<R> map(
      List<T> inputs, Function<? super T, ? extends R> task, Executor executor) {
    if (inputs.isEmpty()) {
      return List.of();
    }
    if (inputs.size() == 1) {
      return List.of(task.apply(inputs.get(0)));
    }
    List<CompletableFuture<R>> futures =
        inputs.stream()
            .map(input -> CompletableFuture.<R>supplyAsync(() -> task.apply(input), executor))
            .toList();
    try {
      CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
    } catch (CompletionException e) {
      throw firstFailure(futures, e);
    }
    return futures.stream().map(CompletableFuture::join).toList();
  }

  /** Unwraps {@link CompletionException} and {@link ExecutionException} layers. */
  public static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** Rethrows {@code failure} unchecked, after unwrapping. */
  public static RuntimeException propagate(Throwable failure) {
    Throwable cause = unwrap(failure);
    if (cause instanceof RuntimeException runtime) {
      throw runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    throw new CompletionException(cause);
  }

  private static <R> RuntimeException firstFailure(
      List<CompletableFuture<R>> futures, CompletionException fallback) {
    for (CompletableFuture<R> future : futures) {
      if (future.isCompletedExceptionally()) {
        try {
          future.join();
        } catch (CompletionException e) {
          return propagate(e);
        }
      }
    }
    return propagate(fallback);
  }

  private static ExecutorService newSharedPool() {
    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("rag-fanout-");
    threadFactory.setDaemon(true);
    return Executors.newCachedThreadPool(threadFactory);
  }
}
