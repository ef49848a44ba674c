package dev.ragjudge.judge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class JudgeResponseParserTest {

  private final JudgeResponseParser parser = new JudgeResponseParser(new ObjectMapper());

  @Test
  void stripCodeFenceRemovesLanguageTaggedFence() {
    assertThat(JudgeResponseParser.stripCodeFence("```json\n{\"a\": 1}\n```"))
        .isEqualTo("{\"a\": 1}");
  }

  @Test
  void stripCodeFenceHandlesMissingClosingFence() {
    assertThat(JudgeResponseParser.stripCodeFence("```\n{\"a\": 1}")).isEqualTo("{\"a\": 1}");
  }

  @Test
  void stripCodeFenceLeavesUnfencedTextAlone() {
    assertThat(JudgeResponseParser.stripCodeFence("  {\"a\": 1}\n")).isEqualTo("{\"a\": 1}");
  }

  @Test
  void parseObjectRejectsArrays() {
    assertThatThrownBy(() -> parser.parseObject("[1, 2]"))
        .isInstanceOf(JudgeResponseException.class)
        .hasMessageStartingWith("Expected a JSON object");
  }

  @Test
  void parseObjectRejectsSecondObject() {
    assertThatThrownBy(() -> parser.parseObject("{\"score\": 0.9} {\"score\": 0.1}"))
        .isInstanceOf(JudgeResponseException.class)
        .hasMessageContaining("Failed to parse JSON response");
  }

  @Test
  void parseObjectRejectsProseAfterObject() {
    assertThatThrownBy(() -> parser.parseObject("{\"score\": 0.9}\nHope this helps!"))
        .isInstanceOf(JudgeResponseException.class)
        .hasMessageContaining("Raw text: {\"score\": 0.9}");
  }

  @Test
  void parseObjectAcceptsFencedObjectWithTrailingWhitespace() {
    JsonNode node = parser.parseObject("```json\n{\"score\": 0.9}\n```\n\n");

    assertThat(node.get("score").asDouble()).isEqualTo(0.9);
  }

  @Test
  void scoreRejectsNonFiniteText() {
    JsonNode node = parser.parseObject("{\"score\": \"NaN\"}");

    assertThatThrownBy(() -> JudgeResponseParser.score(node))
        .isInstanceOf(JudgeResponseException.class);
  }

  @Test
  void optionalTextDefaultsToEmpty() {
    JsonNode node = parser.parseObject("{\"score\": 1, \"reasoning\": null}");

    assertThat(JudgeResponseParser.optionalText(node, "reasoning")).isEmpty();
    assertThat(JudgeResponseParser.optionalText(node, "evidence")).isEmpty();
  }

  @Test
  void stringListStringifiesNonTextItems() {
    JsonNode node = parser.parseObject("{\"claims\": [\"  Paris is big. \", 42, true]}");

    assertThat(JudgeResponseParser.stringList(node, "claims"))
        .containsExactly("Paris is big.", "42", "true");
  }

  @Test
  void verdictAcceptsSurroundingWhitespace() {
    JsonNode node = parser.parseObject("{\"verdict\": \" not_enough_info \"}");

    assertThat(JudgeResponseParser.verdict(node)).isEqualTo(Verdict.NOT_ENOUGH_INFO);
  }
}
