package dev.ragjudge.judge.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessageType;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.internal.ExceptionMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import dev.ragjudge.judge.JudgeApiException;
import dev.ragjudge.judge.JudgeResponseException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatModelTransportTest {

  @Mock private ChatModel chatModel;

  private ChatModelTransport transport;

  @BeforeEach
  void setUp() {
    transport = new ChatModelTransport(chatModel, JudgeRetryPolicy.defaults(), delay -> {});
  }

  @Test
  void sendMapsPromptsAndParametersToChatRequest() {
    given(chatModel.chat(any(ChatRequest.class)))
        .willReturn(
            ChatResponse.builder()
                .aiMessage(AiMessage.from("{\"score\": 1}"))
                .tokenUsage(new TokenUsage(40, 8))
                .modelName("provider-model-v2")
                .build());

    TransportResponse response = transport.send("system", "user", "provider-model", 0.2, 256);

    ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
    verify(chatModel).chat(captor.capture());
    ChatRequest request = captor.getValue();
    assertThat(request.messages()).hasSize(2);
    assertThat(request.messages().get(0).type()).isEqualTo(ChatMessageType.SYSTEM);
    assertThat(request.messages().get(1).type()).isEqualTo(ChatMessageType.USER);
    assertThat(request.parameters().modelName()).isEqualTo("provider-model");
    assertThat(request.parameters().temperature()).isEqualTo(0.2);
    assertThat(request.parameters().maxOutputTokens()).isEqualTo(256);

    assertThat(response.text()).isEqualTo("{\"score\": 1}");
    assertThat(response.inputTokens()).isEqualTo(40);
    assertThat(response.outputTokens()).isEqualTo(8);
    assertThat(response.model()).isEqualTo("provider-model-v2");
  }

  @Test
  void sendFallsBackToRequestedModelAndZeroTokens() {
    given(chatModel.chat(any(ChatRequest.class)))
        .willReturn(ChatResponse.builder().aiMessage(AiMessage.from("text")).build());

    TransportResponse response = transport.send("system", "user", "provider-model", 0.0, 256);

    assertThat(response.model()).isEqualTo("provider-model");
    assertThat(response.totalTokens()).isZero();
  }

  private static RuntimeException providerFailure(Throwable raw) {
    return ExceptionMapper.DEFAULT.mapException(raw);
  }

  @Test
  void sendRetriesRateLimitsThreeTimesAndKeepsStatus() {
    given(chatModel.chat(any(ChatRequest.class)))
        .willThrow(providerFailure(new HttpException(429, "rate limited")));

    assertThatThrownBy(() -> transport.send("system", "user", "m", 0.0, 256))
        .isInstanceOfSatisfying(
            JudgeApiException.class,
            e -> {
              assertThat(e.getStatusCode()).isEqualTo(429);
              assertThat(e.isRetryable()).isTrue();
            });
    verify(chatModel, times(3)).chat(any(ChatRequest.class));
  }

  @Test
  void sendRetriesServerErrorsReportedByProvider() {
    given(chatModel.chat(any(ChatRequest.class)))
        .willThrow(providerFailure(new HttpException(503, "overloaded")));

    assertThatThrownBy(() -> transport.send("system", "user", "m", 0.0, 256))
        .isInstanceOfSatisfying(
            JudgeApiException.class, e -> assertThat(e.getStatusCode()).isEqualTo(503));
    verify(chatModel, times(3)).chat(any(ChatRequest.class));
  }

  @Test
  void sendRecoversWhenServerErrorIsFollowedBySuccess() {
    given(chatModel.chat(any(ChatRequest.class)))
        .willThrow(providerFailure(new HttpException(500, "internal")))
        .willReturn(ChatResponse.builder().aiMessage(AiMessage.from("ok")).build());

    assertThat(transport.send("system", "user", "m", 0.0, 256).text()).isEqualTo("ok");
    verify(chatModel, times(2)).chat(any(ChatRequest.class));
  }

  @Test
  void sendDoesNotRetryClientErrors() {
    given(chatModel.chat(any(ChatRequest.class)))
        .willThrow(providerFailure(new HttpException(401, "bad key")));

    assertThatThrownBy(() -> transport.send("system", "user", "m", 0.0, 256))
        .isInstanceOfSatisfying(
            JudgeApiException.class, e -> assertThat(e.getStatusCode()).isEqualTo(401));
    verify(chatModel, times(1)).chat(any(ChatRequest.class));
  }

  @Test
  void sendTreatsUnresolvedHostAsConnectionFailure() {
    given(chatModel.chat(any(ChatRequest.class)))
        .willThrow(providerFailure(new UnknownHostException("llm.example.invalid")));

    assertThatThrownBy(() -> transport.send("system", "user", "m", 0.0, 256))
        .isInstanceOfSatisfying(
            JudgeApiException.class, e -> assertThat(e.isConnectionFailure()).isTrue());
    verify(chatModel, times(3)).chat(any(ChatRequest.class));
  }

  @Test
  void sendTreatsIoCausesAsConnectionFailures() {
    given(chatModel.chat(any(ChatRequest.class)))
        .willThrow(new UncheckedIOException(new ConnectException("refused")));

    assertThatThrownBy(() -> transport.send("system", "user", "m", 0.0, 256))
        .isInstanceOfSatisfying(
            JudgeApiException.class, e -> assertThat(e.isConnectionFailure()).isTrue());
    verify(chatModel, times(3)).chat(any(ChatRequest.class));
  }

  @Test
  void sendDoesNotRetryUnclassifiedFailures() {
    given(chatModel.chat(any(ChatRequest.class)))
        .willThrow(new IllegalStateException("unsupported parameter"));

    assertThatThrownBy(() -> transport.send("system", "user", "m", 0.0, 256))
        .isInstanceOfSatisfying(
            JudgeApiException.class,
            e -> {
              assertThat(e.getStatusCode()).isNull();
              assertThat(e.isRetryable()).isFalse();
            });
    verify(chatModel, times(1)).chat(any(ChatRequest.class));
  }

  @Test
  void sendRejectsBlankModelOutput() {
    given(chatModel.chat(any(ChatRequest.class)))
        .willReturn(ChatResponse.builder().aiMessage(AiMessage.from(" ")).build());

    assertThatThrownBy(() -> transport.send("system", "user", "m", 0.0, 256))
        .isInstanceOf(JudgeResponseException.class);
    verify(chatModel, times(1)).chat(any(ChatRequest.class));
  }
}
