package dev.ragjudge.evaluator;

import dev.ragjudge.concurrent.FanOut;
import dev.ragjudge.judge.JudgeResult;
import dev.ragjudge.judge.LlmJudge;
import dev.ragjudge.testcase.TestCase;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Rank-weighted relevance of the retrieved documents to the query.
 *
 * <p>Each document is scored independently, then combined as {@code sum(score_i / rank_i) /
 * sum(1 / rank_i)} with 1-based ranks, so irrelevant documents near the top cost more than ones
 * near the bottom. An empty context scores 1.0.
 */
public class ContextPrecisionEvaluator extends AbstractEvaluator {

  public static final String NAME = "context_precision";

  static final int DOCUMENT_PREVIEW_LENGTH = 200;
  static final double RELEVANT_DOCUMENT_SCORE = 0.7;

  public ContextPrecisionEvaluator() {
    this(DEFAULT_THRESHOLD);
  }

  public ContextPrecisionEvaluator(double threshold) {
    this(threshold, FanOut.sharedExecutor());
  }

  public ContextPrecisionEvaluator(double threshold, Executor executor) {
    super(
        NAME,
        "Measures whether the retrieved documents are relevant, weighting higher ranks more",
        threshold,
        executor);
  }

  @Override
  public EvaluationResult evaluate(TestCase testCase, LlmJudge judge) {
    List<String> documents = testCase.context();
    if (documents.isEmpty()) {
      return result(
          1.0,
          "No context documents to evaluate; vacuously precise.",
          Map.of("doc_scores", List.of(), "total_docs", 0, "weighted_precision", 1.0),
          0);
    }

    List<JudgeResult> judged =
        inParallel(documents, document -> judge.evaluateRelevance(testCase.query(), document));

    List<Map<String, Object>> docScores = new ArrayList<>(documents.size());
    double weightedSum = 0.0;
    double weightTotal = 0.0;
    int tokens = 0;
    int relevant = 0;
    for (int i = 0; i < judged.size(); i++) {
      int rank = i + 1;
      JudgeResult documentResult = judged.get(i);
      weightedSum += documentResult.score() / rank;
      weightTotal += 1.0 / rank;
      tokens += documentResult.tokensUsed();
      if (documentResult.score() >= RELEVANT_DOCUMENT_SCORE) {
        relevant++;
      }
      docScores.add(
          Map.of(
              "rank", rank,
              "document", preview(documents.get(i)),
              "score", documentResult.score(),
              "reasoning", documentResult.reasoning()));
    }
    // rounding can push the ratio a hair above 1.0
    double score = Math.min(1.0, weightedSum / weightTotal);

    return result(
        score,
        reasoning(relevant, documents.size(), score),
        Map.of(
            "doc_scores", docScores,
            "total_docs", documents.size(),
            "weighted_precision", score),
        tokens);
  }

  static String reasoning(int relevant, int total, double score) {
    String precision = percent(score) + " weighted precision";
    if (relevant == total) {
      return "All " + total + " retrieved documents are relevant to the query (" + precision + ").";
    }
    if (relevant == 0) {
      return "None of the "
          + total
          + " retrieved documents are relevant to the query ("
          + precision
          + ").";
    }
    return relevant
        + " of "
        + total
        + " retrieved documents are relevant ("
        + precision
        + "). Higher-ranked documents are weighted more heavily.";
  }

  private static String preview(String document) {
    return document.length() <= DOCUMENT_PREVIEW_LENGTH
        ? document
        : document.substring(0, DOCUMENT_PREVIEW_LENGTH);
  }
}
