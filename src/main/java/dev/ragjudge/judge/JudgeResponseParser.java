package dev.ragjudge.judge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw judge text into validated values. Every failure is a {@link JudgeResponseException}.
 */
final class JudgeResponseParser {

  private static final int RAW_TEXT_PREVIEW = 200;
  private static final String FENCE = "```";

  private final ObjectReader reader;

  JudgeResponseParser(ObjectMapper objectMapper) {
    this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * Parses a JSON object, tolerating a single surrounding Markdown code fence. Anything after the
   * object is rejected.
   */
  JsonNode parseObject(String text) {
    String cleaned = stripCodeFence(text);
    JsonNode node;
    try {
      node = reader.readTree(cleaned);
    } catch (JsonProcessingException e) {
      throw new JudgeResponseException(
          "Failed to parse JSON response: "
              + e.getOriginalMessage()
              + ". Raw text: "
              + preview(text),
          e);
    }
    if (node == null || !node.isObject()) {
      throw new JudgeResponseException("Expected a JSON object. Raw text: " + preview(text));
    }
    return node;
  }

  static String stripCodeFence(String text) {
    String cleaned = text.strip();
    if (!cleaned.startsWith(FENCE)) {
      return cleaned;
    }
    List<String> lines = new ArrayList<>(Arrays.asList(cleaned.split("\n", -1)));
    lines.remove(0);
    if (!lines.isEmpty() && lines.get(lines.size() - 1).strip().equals(FENCE)) {
      lines.remove(lines.size() - 1);
    }
    return String.join("\n", lines);
  }

  /** Reads {@code score}, accepting numbers or numeric text, and clamps it to [0, 1]. */
  static double score(JsonNode response) {
    JsonNode node = required(response, "score");
    double score;
    if (node.isNumber()) {
      score = node.asDouble();
    } else if (node.isTextual()) {
      try {
        score = Double.parseDouble(node.textValue().strip());
      } catch (NumberFormatException e) {
        throw new JudgeResponseException("Invalid score value: " + node, e);
      }
    } else {
      throw new JudgeResponseException("Invalid score value: " + node);
    }
    if (Double.isNaN(score) || Double.isInfinite(score)) {
      throw new JudgeResponseException("Invalid score value: " + node);
    }
    return clamp(score);
  }

  static double clamp(double score) {
    return Math.max(0.0, Math.min(1.0, score));
  }

  static String optionalText(JsonNode response, String field) {
    JsonNode node = response.get(field);
    if (node == null || node.isNull()) {
      return "";
    }
    return node.isValueNode() ? node.asText() : node.toString();
  }

  static String requiredText(JsonNode response, String field) {
    JsonNode node = required(response, field);
    return node.isValueNode() ? node.asText() : node.toString();
  }

  /** Reads a required string array, dropping null and blank items. */
  static List<String> stringList(JsonNode response, String field) {
    JsonNode node = required(response, field);
    if (!node.isArray()) {
      throw new JudgeResponseException(
          "Expected '"
              + field
              + "' to be a list, got "
              + node.getNodeType().name().toLowerCase(Locale.ROOT)
              + ": "
              + response);
    }
    List<String> values = new ArrayList<>();
    for (JsonNode item : node) {
      if (item.isNull()) {
        continue;
      }
      String value = item.isValueNode() ? item.asText() : item.toString();
      if (!value.isBlank()) {
        values.add(value.strip());
      }
    }
    return values;
  }

  static Verdict verdict(JsonNode response) {
    String raw = requiredText(response, "verdict").strip().toUpperCase(Locale.ROOT);
    try {
      return Verdict.valueOf(raw);
    } catch (IllegalArgumentException e) {
      throw new JudgeResponseException(
          "Invalid verdict '"
              + raw
              + "'. Expected one of "
              + Arrays.toString(Verdict.values())
              + ": "
              + response,
          e);
    }
  }

  private static JsonNode required(JsonNode response, String field) {
    JsonNode node = response.get(field);
    if (node == null || node.isNull()) {
      throw new JudgeResponseException("Response missing '" + field + "' field: " + response);
    }
    return node;
  }

  private static String preview(String text) {
    return text.length() <= RAW_TEXT_PREVIEW ? text : text.substring(0, RAW_TEXT_PREVIEW);
  }
}
