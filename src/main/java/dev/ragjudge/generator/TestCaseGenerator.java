package dev.ragjudge.generator;

import dev.ragjudge.concurrent.FanOut;
import dev.ragjudge.judge.AnswerResult;
import dev.ragjudge.judge.LlmJudge;
import dev.ragjudge.testcase.TestCase;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds synthetic test cases from raw documents: the judge writes questions grounded in the
 * documents, then answers each one from the same documents.
 *
 * <p>Generated cases carry the documents as context and the judge's answer as the response, so
 * they exercise the evaluators against a known-good baseline.
 */
public class TestCaseGenerator {

  private static final Logger log = LoggerFactory.getLogger(TestCaseGenerator.class);

  public static final String GENERATED_TAG = "generated";
  static final int MAX_NAME_LENGTH = 60;

  private final Executor executor;

  public TestCaseGenerator() {
    this(FanOut.sharedExecutor());
  }

  public TestCaseGenerator(Executor executor) {
    this.executor = executor;
  }

  /**
   * Generates up to {@code count} test cases. Fewer are returned when the judge writes fewer
   * questions.
   *
   * @throws IllegalArgumentException if {@code documents} is empty or {@code count} is below 1
   */
  public List<TestCase> generateFromDocuments(List<String> documents, int count, LlmJudge judge) {
    if (documents == null || documents.isEmpty()) {
      throw new IllegalArgumentException("documents must not be empty");
    }
    if (count < 1) {
      throw new IllegalArgumentException("count must be at least 1 but was " + count);
    }

    List<String> questions = judge.generateQuestions(documents, count).questions();
    if (questions.size() > count) {
      questions = questions.subList(0, count);
    }
    List<String> selected = questions;
    List<AnswerResult> answers =
        FanOut.map(selected, question -> judge.generateAnswer(question, documents), executor);

    List<TestCase> generated = new ArrayList<>(selected.size());
    for (int i = 0; i < selected.size(); i++) {
      String question = selected.get(i);
      generated.add(
          new TestCase(
              UUID.randomUUID().toString(),
              displayName(question, i + 1),
              question,
              documents,
              answers.get(i).answer(),
              null,
              null,
              List.of(GENERATED_TAG)));
    }
    log.info("Generated {} test cases from {} documents", generated.size(), documents.size());
    return generated;
  }

  /**
   * {@code "<index>. <question>"} without the trailing question mark, cut at a word boundary with
   * an ellipsis when longer than 60 characters.
   */
  static String displayName(String question, int index) {
    String name = stripTrailingQuestionMarks(question.strip()).strip();
    if (name.length() > MAX_NAME_LENGTH) {
      String head = name.substring(0, MAX_NAME_LENGTH);
      int lastSpace = head.lastIndexOf(' ');
      name = (lastSpace > 0 ? head.substring(0, lastSpace) : head) + "...";
    }
    return index + ". " + name;
  }

  private static String stripTrailingQuestionMarks(String question) {
    int end = question.length();
    while (end > 0 && question.charAt(end - 1) == '?') {
      end--;
    }
    return question.substring(0, end);
  }
}
