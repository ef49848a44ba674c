package dev.ragjudge.evaluator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.ragjudge.judge.LlmJudge;
import dev.ragjudge.testcase.TestCase;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EvaluatorRegistryTest {

  private final EvaluatorRegistry registry = EvaluatorRegistry.withBuiltIns(Runnable::run);

  @Test
  void builtInsAreRegisteredUnderTheirNames() {
    assertThat(registry.names())
        .containsExactly(
            "context_precision", "context_recall", "faithfulness", "hallucination", "relevance");
  }

  @Test
  void createUsesEachEvaluatorsDefaultThreshold() {
    assertThat(registry.create("faithfulness").threshold()).isEqualTo(0.7);
    assertThat(registry.create("hallucination").threshold()).isEqualTo(0.8);
    assertThat(registry.create("context_recall"))
        .isInstanceOf(ContextRecallEvaluator.class);
  }

  @Test
  void createAppliesThresholdOverride() {
    Evaluator evaluator = registry.create("relevance", 0.9);

    assertThat(evaluator).isInstanceOf(RelevanceEvaluator.class);
    assertThat(evaluator.threshold()).isEqualTo(0.9);
    assertThat(evaluator.isPassing(0.89)).isFalse();
    assertThat(evaluator.isPassing(0.9)).isTrue();
  }

  @Test
  void unknownNameListsAvailableEvaluators() {
    assertThatThrownBy(() -> registry.create("coherence"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage(
            "Unknown evaluator: 'coherence'. Available evaluators: "
                + "context_precision, context_recall, faithfulness, hallucination, relevance");
  }

  @Test
  void outOfRangeThresholdIsRejected() {
    assertThatThrownBy(() -> registry.create("faithfulness", 1.5))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must be in [0.0, 1.0]");
  }

  @Test
  void customEvaluatorCanBeRegistered() {
    registry.register("length", threshold -> new LengthEvaluator());

    assertThat(registry.contains("length")).isTrue();
    assertThat(registry.create("length").name()).isEqualTo("length");
  }

  @Test
  void duplicateNameIsRejected() {
    assertThatThrownBy(() -> registry.register("faithfulness", t -> new FaithfulnessEvaluator()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Evaluator 'faithfulness' is already registered");
  }

  @Test
  void blankNameIsRejected() {
    assertThatThrownBy(() -> registry.register(" ", threshold -> new LengthEvaluator()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Evaluator name cannot be empty");
  }

  @Test
  void factoryProducingDifferentNameIsRejected() {
    assertThatThrownBy(() -> registry.register("size", threshold -> new LengthEvaluator()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("named 'length'");
    assertThat(registry.contains("size")).isFalse();
  }

  private static final class LengthEvaluator implements Evaluator {

    @Override
    public String name() {
      return "length";
    }

    @Override
    public String description() {
      return "Passes responses shorter than 100 characters";
    }

    @Override
    public double threshold() {
      return 1.0;
    }

    @Override
    public EvaluationResult evaluate(TestCase testCase, LlmJudge judge) {
      double score = testCase.response().length() < 100 ? 1.0 : 0.0;
      return new EvaluationResult(name(), score, isPassing(score), "", Map.of(), 0);
    }
  }
}
