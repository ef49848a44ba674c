package dev.ragjudge.judge.transport;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.UnresolvedModelServerException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import dev.ragjudge.judge.JudgeApiException;
import dev.ragjudge.judge.JudgeResponseException;
import java.io.IOException;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;

/**
 * {@link JudgeTransport} backed by any langchain4j {@link ChatModel}, for providers other than the
 * built-in Anthropic client.
 *
 * <p>The status code of a langchain4j {@link HttpException} anywhere in the cause chain is kept,
 * so the same {@link JudgeRetryPolicy} classification applies. Unreachable model servers and
 * failures caused by an {@link IOException} count as connection failures. Configure the wrapped
 * model with {@code maxRetries(0)} to avoid retrying twice.
 */
public class ChatModelTransport implements JudgeTransport {

  private final ChatModel chatModel;
  private final RetryTemplate retryTemplate;

  public ChatModelTransport(ChatModel chatModel, JudgeRetryPolicy retryPolicy) {
    this(chatModel, retryPolicy, new ThreadWaitSleeper());
  }

  public ChatModelTransport(ChatModel chatModel, JudgeRetryPolicy retryPolicy, Sleeper sleeper) {
    this.chatModel = chatModel;
    this.retryTemplate = retryPolicy.toRetryTemplate(sleeper);
  }

  @Override
  public TransportResponse send(
      String systemPrompt, String userPrompt, String model, double temperature, int maxTokens) {
    ChatRequest request =
        ChatRequest.builder()
            .messages(List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt)))
            .parameters(
                ChatRequestParameters.builder()
                    .modelName(model)
                    .temperature(temperature)
                    .maxOutputTokens(maxTokens)
                    .build())
            .build();

    ChatResponse response;
    try {
      response = retryTemplate.execute(context -> call(request));
    } catch (BackOffInterruptedException e) {
      throw new JudgeApiException("Interrupted while retrying chat model call", null, false, e);
    }

    AiMessage message = response.aiMessage();
    String text = message == null ? null : message.text();
    if (text == null || text.isBlank()) {
      throw new JudgeResponseException("Expected text response from chat model, got none");
    }
    TokenUsage usage = response.tokenUsage();
    int inputTokens =
        usage == null || usage.inputTokenCount() == null ? 0 : usage.inputTokenCount();
    int outputTokens =
        usage == null || usage.outputTokenCount() == null ? 0 : usage.outputTokenCount();
    String actualModel =
        response.modelName() == null || response.modelName().isBlank()
            ? model
            : response.modelName();
    return new TransportResponse(text, inputTokens, outputTokens, actualModel);
  }

  private ChatResponse call(ChatRequest request) {
    try {
      ChatResponse response = chatModel.chat(request);
      if (response == null) {
        throw new JudgeResponseException("Empty response from chat model");
      }
      return response;
    } catch (JudgeResponseException e) {
      throw e;
    } catch (RuntimeException e) {
      throw classify(e);
    }
  }

  /**
   * Provider models wrap the raw {@link HttpException} in typed exceptions such as {@code
   * RateLimitException}, so the status code is taken from the first one in the cause chain.
   */
  static JudgeApiException classify(RuntimeException failure) {
    HttpException http = findCause(failure, HttpException.class);
    if (http != null) {
      return new JudgeApiException(
          "Chat model error: HTTP " + http.statusCode() + " " + http.getMessage(),
          http.statusCode(),
          false,
          failure);
    }
    if (failure instanceof UnresolvedModelServerException
        || findCause(failure, IOException.class) != null) {
      return JudgeApiException.connectionFailure(
          "Connection to chat model failed: " + failure.getMessage(), failure);
    }
    return new JudgeApiException(
        "Chat model call failed: " + failure.getMessage(), null, false, failure);
  }

  private static <T extends Throwable> @Nullable T findCause(Throwable failure, Class<T> type) {
    Throwable current = failure;
    int hops = 0;
    while (current != null && hops++ < 10) {
      if (type.isInstance(current)) {
        return type.cast(current);
      }
      current = current.getCause();
    }
    return null;
  }
}
