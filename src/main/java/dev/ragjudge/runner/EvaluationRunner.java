package dev.ragjudge.runner;

import dev.ragjudge.concurrent.FanOut;
import dev.ragjudge.evaluator.EvaluationResult;
import dev.ragjudge.evaluator.Evaluator;
import dev.ragjudge.evaluator.EvaluatorRegistry;
import dev.ragjudge.judge.LlmJudge;
import dev.ragjudge.testcase.EvalStatus;
import dev.ragjudge.testcase.EvaluationDetail;
import dev.ragjudge.testcase.TestCase;
import dev.ragjudge.testcase.TestResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.function.SingletonSupplier;

/**
 * Runs the configured evaluators against test cases and aggregates their results.
 *
 * <p>For one test case, every evaluator runs in parallel. An evaluator that throws is recorded as
 * an error result and never aborts the others; the case then gets status {@link EvalStatus#ERROR}.
 * Missing test-case data an evaluator requires is checked before any judge call and propagates as
 * {@link dev.ragjudge.evaluator.EvaluatorUsageException}.
 *
 * <p>In batch mode at most {@link RunnerProperties#maxConcurrency()} test cases are evaluated at a
 * time, results come back in input order, and a failing test case becomes an ERROR result.
 *
 * <p>The judge and evaluators are created on first use, once, even under concurrent callers.
 */
public class EvaluationRunner {

  private static final Logger log = LoggerFactory.getLogger(EvaluationRunner.class);

  static final String RUNNER_ERROR_KEY = "error";

  private final SingletonSupplier<LlmJudge> judge;
  private final SingletonSupplier<List<Evaluator>> evaluators;
  private final RunnerProperties properties;
  private final Executor executor;

  public EvaluationRunner(LlmJudge judge, EvaluatorRegistry registry, RunnerProperties properties) {
    this(() -> judge, registry, properties, FanOut.sharedExecutor());
  }

  /**
   * @param judgeFactory invoked at most once, on the first evaluation
   * @param executor runs evaluators and batch cases; must not be a bounded pool, since tasks
   *     block waiting on the judge
   */
  public EvaluationRunner(
      Supplier<LlmJudge> judgeFactory,
      EvaluatorRegistry registry,
      RunnerProperties properties,
      Executor executor) {
    this.judge = SingletonSupplier.of(judgeFactory);
    this.evaluators = SingletonSupplier.of(() -> createEvaluators(registry, properties));
    this.properties = properties;
    this.executor = executor;
  }

  public RunnerProperties properties() {
    return properties;
  }

  /** Evaluators in configured order, creating them if needed. */
  public List<Evaluator> evaluators() {
    return evaluators.obtain();
  }

  /**
   * Evaluates one test case with every configured evaluator.
   *
   * @throws dev.ragjudge.evaluator.EvaluatorUsageException if an evaluator cannot handle the case
   */
  public TestResult evaluate(TestCase testCase) {
    List<Evaluator> active = evaluators();
    validate(active, testCase);
    return run(active, testCase);
  }

  public CompletableFuture<TestResult> evaluateAsync(TestCase testCase) {
    return CompletableFuture.supplyAsync(() -> evaluate(testCase), executor);
  }

  /**
   * Evaluates test cases with bounded concurrency. The returned list is in input order.
   *
   * @throws dev.ragjudge.evaluator.EvaluatorUsageException if an evaluator cannot handle one of
   *     the cases; checked for every case before any evaluation starts
   */
  public List<TestResult> evaluateBatch(List<TestCase> testCases) {
    if (testCases.isEmpty()) {
      return List.of();
    }
    List<Evaluator> active = evaluators();
    testCases.forEach(testCase -> validate(active, testCase));

    long start = System.nanoTime();
    log.info(
        "Evaluating {} test cases with {} (max {} concurrent)",
        testCases.size(),
        properties.evaluators(),
        properties.maxConcurrency());

    Semaphore permits = new Semaphore(properties.maxConcurrency());
    List<CompletableFuture<TestResult>> pending = new ArrayList<>(testCases.size());
    for (int i = 0; i < testCases.size(); i++) {
      TestCase testCase = testCases.get(i);
      try {
        permits.acquire();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while scheduling batch; {} test cases not run", testCases.size() - i);
        for (TestCase skipped : testCases.subList(i, testCases.size())) {
          pending.add(CompletableFuture.completedFuture(errorResult(skipped, e, 0)));
        }
        break;
      }
      pending.add(submit(active, testCase, permits));
    }

    List<TestResult> results = pending.stream().map(this::await).toList();
    logSummary(results, start);
    return results;
  }

  public CompletableFuture<List<TestResult>> evaluateBatchAsync(List<TestCase> testCases) {
    return CompletableFuture.supplyAsync(() -> evaluateBatch(testCases), executor);
  }

  /** ERROR if any evaluator errored, else FAILED if any did not pass, else PASSED. */
  static EvalStatus deriveStatus(Collection<EvaluationResult> results) {
    if (results.stream().anyMatch(EvaluationResult::hasError)) {
      return EvalStatus.ERROR;
    }
    if (results.stream().anyMatch(result -> !result.passed())) {
      return EvalStatus.FAILED;
    }
    return EvalStatus.PASSED;
  }

  private CompletableFuture<TestResult> submit(
      List<Evaluator> active, TestCase testCase, Semaphore permits) {
    long submitted = System.nanoTime();
    CompletableFuture<TestResult> work =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                return run(active, testCase);
              } finally {
                permits.release();
              }
            },
            executor);
    if (properties.testCaseTimeout() != null) {
      work = work.orTimeout(properties.testCaseTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }
    if (properties.failFast()) {
      return work;
    }
    return work.handle(
        (result, failure) -> {
          if (failure == null) {
            return result;
          }
          Throwable cause = FanOut.unwrap(failure);
          log.warn("Test case '{}' failed: {}", testCase.id(), describe(cause));
          return errorResult(testCase, cause, elapsedMs(submitted));
        });
  }

  private TestResult await(CompletableFuture<TestResult> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      throw FanOut.propagate(e);
    }
  }

  private TestResult run(List<Evaluator> active, TestCase testCase) {
    LlmJudge activeJudge = judge.obtain();
    long start = System.nanoTime();

    List<EvaluationResult> results =
        FanOut.map(active, evaluator -> runEvaluator(evaluator, testCase, activeJudge), executor);

    Map<String, Double> scores = new HashMap<>();
    Map<String, EvaluationDetail> details = new HashMap<>();
    int tokens = 0;
    for (EvaluationResult result : results) {
      scores.put(result.evaluatorName(), result.score());
      details.put(
          result.evaluatorName(),
          new EvaluationDetail(
              result.reasoning(), result.passed(), result.rawResponse(), result.error()));
      tokens += result.tokensUsed();
    }
    EvalStatus status = deriveStatus(results);
    log.debug(
        "Test case '{}' finished with status {} using {} tokens", testCase.id(), status, tokens);
    return new TestResult(testCase, status, scores, details, elapsedMs(start), tokens);
  }

  private EvaluationResult runEvaluator(Evaluator evaluator, TestCase testCase, LlmJudge judge) {
    try {
      return evaluator.evaluate(testCase, judge);
    } catch (RuntimeException e) {
      if (properties.failFast()) {
        throw e;
      }
      log.warn(
          "Evaluator '{}' failed on test case '{}': {}",
          evaluator.name(),
          testCase.id(),
          describe(e));
      return EvaluationResult.failure(evaluator.name(), e);
    }
  }

  private static void validate(List<Evaluator> active, TestCase testCase) {
    active.forEach(evaluator -> evaluator.validate(testCase));
  }

  private static List<Evaluator> createEvaluators(
      EvaluatorRegistry registry, RunnerProperties properties) {
    List<Evaluator> created =
        properties.evaluators().stream()
            .map(name -> registry.create(name, properties.thresholds().get(name)))
            .toList();
    log.debug("Initialized evaluators {}", properties.evaluators());
    return created;
  }

  private static TestResult errorResult(TestCase testCase, Throwable failure, long elapsedMs) {
    String description =
        failure instanceof TimeoutException
            ? "Timed out after " + elapsedMs + " ms"
            : describe(failure);
    EvaluationDetail detail =
        new EvaluationDetail("Evaluation failed: " + description, false, Map.of(), description);
    return new TestResult(
        testCase, EvalStatus.ERROR, Map.of(), Map.of(RUNNER_ERROR_KEY, detail), elapsedMs, 0);
  }

  private static void logSummary(List<TestResult> results, long startNanos) {
    Map<EvalStatus, Long> counts = new HashMap<>();
    results.forEach(result -> counts.merge(result.status(), 1L, Long::sum));
    log.info(
        "Batch finished in {} ms: {} passed, {} failed, {} errors",
        elapsedMs(startNanos),
        counts.getOrDefault(EvalStatus.PASSED, 0L),
        counts.getOrDefault(EvalStatus.FAILED, 0L),
        counts.getOrDefault(EvalStatus.ERROR, 0L));
  }

  private static String describe(Throwable failure) {
    return failure.getClass().getSimpleName() + ": " + failure.getMessage();
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
