package dev.ragjudge.judge;

import java.util.List;

/**
 * An LLM acting as an automated evaluator.
 *
 * <p>All operations block until the judge answers. Implementations must be safe for concurrent use
 * and bound the number of in-flight provider calls themselves; evaluators fan out freely.
 *
 * <p>Every operation may throw {@link JudgeApiException} when the provider cannot be reached or
 * rejects the call, and {@link JudgeResponseException} when it answers with unusable content.
 */
public interface LlmJudge {

  /** Model parameters this judge calls the provider with. */
  JudgeConfig config();

  /**
   * Scores how well {@code response} is grounded in {@code context}. An empty context scores 0.0
   * without calling the provider.
   */
  JudgeResult evaluateFaithfulness(String response, List<String> context);

  /** Scores how well {@code response} addresses {@code query}. */
  JudgeResult evaluateRelevance(String query, String response);

  /** Splits a response into atomic claims. A blank response yields no claims. */
  ClaimsResult extractClaims(String response);

  /**
   * Classifies one claim against the context. An empty context yields {@link
   * Verdict#NOT_ENOUGH_INFO} without calling the provider.
   */
  ClaimVerdict verifyClaim(String claim, List<String> context);

  /**
   * Generates questions answerable from {@code documents}. The judge may return more or fewer
   * than requested.
   *
   * @throws IllegalArgumentException if {@code count} is below 1
   */
  QuestionsResult generateQuestions(List<String> documents, int count);

  /** Answers {@code question} from {@code documents} only. */
  AnswerResult generateAnswer(String question, List<String> documents);
}
