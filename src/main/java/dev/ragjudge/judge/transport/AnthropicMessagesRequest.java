package dev.ragjudge.judge.transport;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Request body for the Anthropic {@code /v1/messages} endpoint. */
record AnthropicMessagesRequest(
    String model,
    @JsonProperty("max_tokens") int maxTokens,
    double temperature,
    String system,
    List<Message> messages) {

  AnthropicMessagesRequest {
    messages = List.copyOf(messages);
  }

  static AnthropicMessagesRequest singleTurn(
      String model, int maxTokens, double temperature, String system, String userPrompt) {
    return new AnthropicMessagesRequest(
        model, maxTokens, temperature, system, List.of(new Message("user", userPrompt)));
  }

  record Message(String role, String content) {}
}
