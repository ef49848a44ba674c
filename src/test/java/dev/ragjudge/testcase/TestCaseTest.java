package dev.ragjudge.testcase;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TestCaseTest {

  @Test
  void queryAndResponseAreTrimmed() {
    TestCase testCase =
        new TestCase("tc-1", "trim", "  What is RAG?\n", List.of("doc"), "\tRetrieval. ");

    assertThat(testCase.query()).isEqualTo("What is RAG?");
    assertThat(testCase.response()).isEqualTo("Retrieval.");
    assertThat(testCase.expectedFacts()).isNull();
    assertThat(testCase.tags()).isEmpty();
  }

  @Test
  void blankQueryIsRejected() {
    assertThatThrownBy(() -> new TestCase("tc-1", "n", "   ", List.of(), "answer"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Query must not be blank");
  }

  @Test
  void blankResponseIsRejected() {
    assertThatThrownBy(() -> new TestCase("tc-1", "n", "query", List.of(), "\n"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Response must not be blank");
  }

  @Test
  void blankIdIsRejected() {
    assertThatThrownBy(() -> new TestCase(" ", "n", "query", List.of(), "answer"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void laterChangesToCallerListAreNotSeen() {
    List<String> context = new ArrayList<>(List.of("doc 1"));
    TestCase testCase = new TestCase("tc-1", "n", "query", context, "answer");

    context.add("doc 2");

    assertThat(testCase.context()).containsExactly("doc 1");
  }

  @Test
  void emptyExpectedFactsDifferFromMissingOnes() {
    TestCase base = new TestCase("tc-1", "n", "query", List.of(), "answer");

    assertThat(base.withExpectedFacts(List.of()).expectedFacts()).isEmpty();
    assertThat(base.withExpectedFacts(null).expectedFacts()).isNull();
    assertThat(base.withExpectedFacts(List.of("fact")).query()).isEqualTo("query");
  }
}
