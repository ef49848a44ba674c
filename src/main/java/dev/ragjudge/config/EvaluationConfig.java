package dev.ragjudge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ragjudge.evaluator.EvaluatorRegistry;
import dev.ragjudge.generator.TestCaseGenerator;
import dev.ragjudge.judge.JudgeProperties;
import dev.ragjudge.judge.LlmJudge;
import dev.ragjudge.judge.TraceCollector;
import dev.ragjudge.judge.TransportJudge;
import dev.ragjudge.judge.prompt.ClasspathPromptProvider;
import dev.ragjudge.judge.prompt.PromptProvider;
import dev.ragjudge.judge.transport.AnthropicProperties;
import dev.ragjudge.judge.transport.AnthropicTransport;
import dev.ragjudge.runner.EvaluationRunner;
import dev.ragjudge.runner.RunnerProperties;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the evaluation pipeline: prompts, traces, evaluator registry and runner.
 *
 * <p>The judge is built lazily by the runner, so the context starts without an Anthropic API key;
 * the key is only required once something is evaluated.
 */
@Configuration
public class EvaluationConfig {

  /** Stamps judge traces; tests may replace it with a fixed clock. */
  @Bean
  public Clock traceClock() {
    return Clock.systemUTC();
  }

  @Bean
  public TraceCollector traceCollector() {
    return new TraceCollector();
  }

  @Bean
  public PromptProvider promptProvider(ObjectMapper objectMapper) {
    return new ClasspathPromptProvider(objectMapper);
  }

  /** Unbounded pool for evaluator and batch fan-out; concurrency is bounded by semaphores. */
  @Bean(destroyMethod = "shutdown")
  public ExecutorService evaluationExecutor() {
    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("rag-eval-");
    threadFactory.setDaemon(true);
    return Executors.newCachedThreadPool(threadFactory);
  }

  @Bean
  public EvaluatorRegistry evaluatorRegistry(
      @Qualifier("evaluationExecutor") ExecutorService evaluationExecutor) {
    return EvaluatorRegistry.withBuiltIns(evaluationExecutor);
  }

  @Bean
  public TestCaseGenerator testCaseGenerator(
      @Qualifier("evaluationExecutor") ExecutorService evaluationExecutor) {
    return new TestCaseGenerator(evaluationExecutor);
  }

  @Bean
  public EvaluationRunner evaluationRunner(
      @Qualifier("anthropicRestClient") RestClient anthropicRestClient,
      AnthropicProperties anthropicProperties,
      JudgeProperties judgeProperties,
      RunnerProperties runnerProperties,
      PromptProvider promptProvider,
      TraceCollector traceCollector,
      EvaluatorRegistry evaluatorRegistry,
      ObjectMapper objectMapper,
      Clock clock,
      @Qualifier("evaluationExecutor") ExecutorService evaluationExecutor) {
    return new EvaluationRunner(
        () ->
            judge(
                anthropicRestClient,
                anthropicProperties,
                judgeProperties,
                promptProvider,
                traceCollector,
                objectMapper,
                clock),
        evaluatorRegistry,
        runnerProperties,
        evaluationExecutor);
  }

  private static LlmJudge judge(
      RestClient restClient,
      AnthropicProperties anthropicProperties,
      JudgeProperties judgeProperties,
      PromptProvider promptProvider,
      TraceCollector traceCollector,
      ObjectMapper objectMapper,
      Clock clock) {
    return new TransportJudge(
        AnthropicTransport.create(restClient, anthropicProperties),
        judgeProperties.toConfig(),
        promptProvider,
        objectMapper,
        judgeProperties.maxConcurrency(),
        traceCollector,
        clock);
  }
}
