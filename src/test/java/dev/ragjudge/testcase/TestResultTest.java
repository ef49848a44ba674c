package dev.ragjudge.testcase;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TestResultTest {

  private final TestCase testCase = new TestCase("tc-1", "n", "query", List.of("doc"), "answer");

  @Test
  void onlyPassedStatusCountsAsPassed() {
    assertThat(result(EvalStatus.PASSED).passed()).isTrue();
    assertThat(result(EvalStatus.FAILED).passed()).isFalse();
    assertThat(result(EvalStatus.ERROR).passed()).isFalse();
    assertThat(result(EvalStatus.SKIPPED).passed()).isFalse();
  }

  @Test
  void scoreLooksUpByEvaluatorName() {
    TestResult result = result(EvalStatus.PASSED);

    assertThat(result.score("relevance")).isEqualTo(0.8);
    assertThat(result.score("faithfulness")).isNull();
  }

  @Test
  void detailRecordsErrorPresence() {
    EvaluationDetail failed = new EvaluationDetail("Evaluation failed", false, null, "boom");

    assertThat(failed.hasError()).isTrue();
    assertThat(failed.raw()).isEmpty();
    assertThat(new EvaluationDetail(null, true, Map.of(), null).reasoning()).isEmpty();
  }

  private TestResult result(EvalStatus status) {
    return new TestResult(
        testCase,
        status,
        Map.of("relevance", 0.8),
        Map.of("relevance", new EvaluationDetail("ok", true, Map.of(), null)),
        12,
        30);
  }
}
