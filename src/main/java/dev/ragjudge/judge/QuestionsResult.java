package dev.ragjudge.judge;

import java.util.List;

/**
 * Questions generated from a set of documents.
 *
 * @param questions generated questions
 * @param tokensUsed tokens consumed by the generation call
 */
public record QuestionsResult(List<String> questions, int tokensUsed) {

  public QuestionsResult {
    questions = questions == null ? List.of() : List.copyOf(questions);
    if (tokensUsed < 0) {
      throw new IllegalArgumentException("tokensUsed must not be negative");
    }
  }

  public static QuestionsResult empty() {
    return new QuestionsResult(List.of(), 0);
  }
}
