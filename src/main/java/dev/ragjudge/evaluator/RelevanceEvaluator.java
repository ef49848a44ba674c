package dev.ragjudge.evaluator;

import dev.ragjudge.concurrent.FanOut;
import dev.ragjudge.judge.JudgeResult;
import dev.ragjudge.judge.LlmJudge;
import dev.ragjudge.testcase.TestCase;
import java.util.Map;
import java.util.concurrent.Executor;

/** How well the response addresses the query. The judge's score passes through unchanged. */
public class RelevanceEvaluator extends AbstractEvaluator {

  public static final String NAME = "relevance";

  public RelevanceEvaluator() {
    this(DEFAULT_THRESHOLD);
  }

  public RelevanceEvaluator(double threshold) {
    this(threshold, FanOut.sharedExecutor());
  }

  public RelevanceEvaluator(double threshold, Executor executor) {
    super(NAME, "Measures whether the response answers the query", threshold, executor);
  }

  @Override
  public EvaluationResult evaluate(TestCase testCase, LlmJudge judge) {
    JudgeResult judged = judge.evaluateRelevance(testCase.query(), testCase.response());
    return result(
        judged.score(),
        judged.reasoning(),
        Map.of(
            "score", judged.score(),
            "reasoning", judged.reasoning(),
            "tokens_used", judged.tokensUsed()),
        judged.tokensUsed());
  }
}
