package dev.ragjudge.judge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ragjudge.judge.prompt.PromptProvider;
import dev.ragjudge.judge.prompt.PromptTemplate;
import dev.ragjudge.judge.transport.JudgeTransport;
import dev.ragjudge.judge.transport.TransportResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LlmJudge} that renders prompts, sends them through a {@link JudgeTransport} and validates
 * the JSON the model answers with.
 *
 * <p>At most {@code maxConcurrency} transport calls are in flight per instance; callers beyond
 * that block until a slot frees up. When a {@link TraceCollector} is supplied, every transport
 * call records one {@link JudgeTrace}, whether it succeeded or not. Short-circuited operations
 * record nothing.
 */
public class TransportJudge implements LlmJudge {

  private static final Logger log = LoggerFactory.getLogger(TransportJudge.class);

  public static final int DEFAULT_MAX_CONCURRENCY = 20;

  static final String NO_CONTEXT_FAITHFULNESS =
      "No context provided; faithfulness cannot be assessed.";
  static final String NO_CONTEXT_VERIFICATION = "No context provided for verification.";

  private final JudgeTransport transport;
  private final JudgeConfig config;
  private final PromptProvider prompts;
  private final JudgeResponseParser parser;
  private final Semaphore callPermits;
  private final @Nullable TraceCollector traceCollector;
  private final Clock clock;

  public TransportJudge(JudgeTransport transport, JudgeConfig config, PromptProvider prompts) {
    this(
        transport,
        config,
        prompts,
        new ObjectMapper(),
        DEFAULT_MAX_CONCURRENCY,
        null,
        Clock.systemUTC());
  }

  public TransportJudge(
      JudgeTransport transport,
      JudgeConfig config,
      PromptProvider prompts,
      ObjectMapper objectMapper,
      int maxConcurrency,
      @Nullable TraceCollector traceCollector,
      Clock clock) {
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be at least 1");
    }
    this.transport = transport;
    this.config = config;
    this.prompts = prompts;
    this.parser = new JudgeResponseParser(objectMapper);
    this.callPermits = new Semaphore(maxConcurrency);
    this.traceCollector = traceCollector;
    this.clock = clock;
  }

  @Override
  public JudgeConfig config() {
    return config;
  }

  @Override
  public JudgeResult evaluateFaithfulness(String response, List<String> context) {
    if (context.isEmpty()) {
      return new JudgeResult(0.0, NO_CONTEXT_FAITHFULNESS, 0);
    }
    PromptTemplate template = prompts.get("faithfulness");
    String userPrompt =
        template.formatUserPrompt(
            Map.of("context", prompts.formatContext(context), "response", response));
    TransportResponse raw = call(template, userPrompt, "evaluate_faithfulness");
    JsonNode parsed = parser.parseObject(raw.text());
    return new JudgeResult(
        JudgeResponseParser.score(parsed),
        JudgeResponseParser.optionalText(parsed, "reasoning"),
        raw.totalTokens());
  }

  @Override
  public JudgeResult evaluateRelevance(String query, String response) {
    PromptTemplate template = prompts.get("relevance");
    String userPrompt = template.formatUserPrompt(Map.of("query", query, "response", response));
    TransportResponse raw = call(template, userPrompt, "evaluate_relevance");
    JsonNode parsed = parser.parseObject(raw.text());
    return new JudgeResult(
        JudgeResponseParser.score(parsed),
        JudgeResponseParser.optionalText(parsed, "reasoning"),
        raw.totalTokens());
  }

  @Override
  public ClaimsResult extractClaims(String response) {
    if (response == null || response.isBlank()) {
      return ClaimsResult.empty();
    }
    PromptTemplate template = prompts.get("extract_claims");
    String userPrompt = template.formatUserPrompt(Map.of("response", response));
    TransportResponse raw = call(template, userPrompt, "extract_claims");
    JsonNode parsed = parser.parseObject(raw.text());
    return new ClaimsResult(JudgeResponseParser.stringList(parsed, "claims"), raw.totalTokens());
  }

  @Override
  public ClaimVerdict verifyClaim(String claim, List<String> context) {
    if (context.isEmpty()) {
      return new ClaimVerdict(Verdict.NOT_ENOUGH_INFO, NO_CONTEXT_VERIFICATION, 0);
    }
    PromptTemplate template = prompts.get("verify_claim");
    String userPrompt =
        template.formatUserPrompt(
            Map.of("claim", claim, "context", prompts.formatContext(context)));
    TransportResponse raw = call(template, userPrompt, "verify_claim");
    JsonNode parsed = parser.parseObject(raw.text());
    return new ClaimVerdict(
        JudgeResponseParser.verdict(parsed),
        JudgeResponseParser.optionalText(parsed, "evidence"),
        raw.totalTokens());
  }

  @Override
  public QuestionsResult generateQuestions(List<String> documents, int count) {
    if (count < 1) {
      throw new IllegalArgumentException("Question count must be at least 1 but was " + count);
    }
    if (documents.isEmpty()) {
      return QuestionsResult.empty();
    }
    PromptTemplate template = prompts.get("generate_questions");
    String userPrompt =
        template.formatUserPrompt(
            Map.of(
                "context", prompts.formatContext(documents),
                "num_questions", String.valueOf(count)));
    TransportResponse raw = call(template, userPrompt, "generate_questions");
    JsonNode parsed = parser.parseObject(raw.text());
    return new QuestionsResult(
        JudgeResponseParser.stringList(parsed, "questions"), raw.totalTokens());
  }

  @Override
  public AnswerResult generateAnswer(String question, List<String> documents) {
    if (documents.isEmpty()) {
      return AnswerResult.empty();
    }
    PromptTemplate template = prompts.get("generate_answer");
    String userPrompt =
        template.formatUserPrompt(
            Map.of("question", question, "context", prompts.formatContext(documents)));
    TransportResponse raw = call(template, userPrompt, "generate_answer");
    JsonNode parsed = parser.parseObject(raw.text());
    return new AnswerResult(JudgeResponseParser.requiredText(parsed, "answer"), raw.totalTokens());
  }

  private TransportResponse call(PromptTemplate template, String userPrompt, String operation) {
    acquirePermit(operation);
    try {
      Instant startedAt = clock.instant();
      long start = System.nanoTime();
      try {
        TransportResponse response =
            transport.send(
                template.systemPrompt(),
                userPrompt,
                config.model(),
                config.temperature(),
                config.maxTokens());
        record(
            new JudgeTrace(
                startedAt,
                operation,
                response.model(),
                response.inputTokens(),
                response.outputTokens(),
                elapsedMs(start),
                true,
                null));
        log.debug("Judge {} used {} tokens", operation, response.totalTokens());
        return response;
      } catch (RuntimeException e) {
        record(
            new JudgeTrace(
                startedAt,
                operation,
                config.model(),
                0,
                0,
                elapsedMs(start),
                false,
                e.getClass().getSimpleName() + ": " + e.getMessage()));
        throw e;
      }
    } finally {
      callPermits.release();
    }
  }

  private void acquirePermit(String operation) {
    try {
      callPermits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new JudgeApiException(
          "Interrupted while waiting to call the judge for " + operation, null, false, e);
    }
  }

  private void record(JudgeTrace trace) {
    if (traceCollector != null) {
      traceCollector.add(trace);
    }
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
