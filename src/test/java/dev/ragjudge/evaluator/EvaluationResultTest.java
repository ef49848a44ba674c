package dev.ragjudge.evaluator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.ragjudge.judge.JudgeApiException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EvaluationResultTest {

  @Test
  void failureCarriesExceptionTypeAndMessage() {
    EvaluationResult result =
        EvaluationResult.failure("relevance", new JudgeApiException("Rate limited", 429));

    assertThat(result.score()).isZero();
    assertThat(result.passed()).isFalse();
    assertThat(result.hasError()).isTrue();
    assertThat(result.error()).isEqualTo("JudgeApiException: Rate limited");
    assertThat(result.reasoning()).isEqualTo("Evaluation failed: JudgeApiException: Rate limited");
    assertThat(result.rawResponse()).isEmpty();
    assertThat(result.tokensUsed()).isZero();
  }

  @Test
  void successfulResultHasNoError() {
    EvaluationResult result = new EvaluationResult("relevance", 0.8, true, "ok", Map.of(), 12);

    assertThat(result.hasError()).isFalse();
    assertThat(result.error()).isNull();
  }

  @Test
  void scoreOutsideUnitIntervalIsRejected() {
    assertThatThrownBy(() -> new EvaluationResult("relevance", 1.01, true, "", Map.of(), 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new EvaluationResult("relevance", Double.NaN, true, "", Map.of(), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void percentRoundsToWholeNumbers() {
    assertThat(AbstractEvaluator.percent(0.75)).isEqualTo("75%");
    assertThat(AbstractEvaluator.percent(2.0 / 3.0)).isEqualTo("67%");
    assertThat(AbstractEvaluator.percent(1.0)).isEqualTo("100%");
  }
}
