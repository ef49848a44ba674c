package dev.ragjudge.judge;

/**
 * Reference answer generated for a question from a set of documents.
 *
 * @param answer generated answer text, empty when no documents were given
 * @param tokensUsed tokens consumed by the generation call
 */
public record AnswerResult(String answer, int tokensUsed) {

  public AnswerResult {
    answer = answer == null ? "" : answer;
    if (tokensUsed < 0) {
      throw new IllegalArgumentException("tokensUsed must not be negative");
    }
  }

  public static AnswerResult empty() {
    return new AnswerResult("", 0);
  }
}
