package dev.ragjudge.judge.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Subset of the Anthropic {@code /v1/messages} response used by the judge. */
@JsonIgnoreProperties(ignoreUnknown = true)
record AnthropicMessagesResponse(
    @Nullable String model, List<ContentBlock> content, @Nullable Usage usage) {

  AnthropicMessagesResponse {
    content = content == null ? List.of() : List.copyOf(content);
  }

  /** Text of all {@code text} blocks, in order; other block types are ignored. */
  List<String> textBlocks() {
    return content.stream()
        .filter(block -> "text".equals(block.type()) && block.text() != null)
        .map(ContentBlock::text)
        .toList();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ContentBlock(String type, @Nullable String text) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Usage(
      @JsonProperty("input_tokens") int inputTokens,
      @JsonProperty("output_tokens") int outputTokens) {}
}
