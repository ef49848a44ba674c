package dev.ragjudge.judge.transport;

import dev.ragjudge.judge.JudgeApiException;
import dev.ragjudge.judge.JudgeResponseException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link JudgeTransport} for the Anthropic Messages API.
 *
 * <p>Each call is a single-turn request. Connection failures, HTTP 429 and HTTP 5xx are retried
 * according to the configured {@link JudgeRetryPolicy}; other statuses fail immediately. The
 * returned text joins every {@code text} content block with newlines, skipping non-text blocks
 * such as thinking or tool use.
 */
public class AnthropicTransport implements JudgeTransport {

  private static final Logger log = LoggerFactory.getLogger(AnthropicTransport.class);

  static final String MESSAGES_PATH = "/v1/messages";
  static final String API_KEY_HEADER = "x-api-key";
  static final String VERSION_HEADER = "anthropic-version";

  private final RestClient restClient;
  private final RetryTemplate retryTemplate;

  public AnthropicTransport(RestClient restClient, JudgeRetryPolicy retryPolicy) {
    this(restClient, retryPolicy, new ThreadWaitSleeper());
  }

  public AnthropicTransport(RestClient restClient, JudgeRetryPolicy retryPolicy, Sleeper sleeper) {
    this.restClient = restClient;
    this.retryTemplate = retryPolicy.toRetryTemplate(sleeper);
  }

  /**
   * Builds a transport from configuration.
   *
   * @throws IllegalStateException if no API key is configured
   */
  public static AnthropicTransport create(RestClient restClient, AnthropicProperties properties) {
    if (!properties.hasApiKey()) {
      throw new IllegalStateException(
          "Anthropic API key required. Set ragjudge.anthropic.api-key "
              + "or the ANTHROPIC_API_KEY environment variable.");
    }
    return new AnthropicTransport(restClient, properties.retry().toPolicy());
  }

  @Override
  public TransportResponse send(
      String systemPrompt, String userPrompt, String model, double temperature, int maxTokens) {
    AnthropicMessagesRequest request =
        AnthropicMessagesRequest.singleTurn(
            model, maxTokens, temperature, systemPrompt, userPrompt);

    AnthropicMessagesResponse response;
    try {
      response = retryTemplate.execute(context -> post(request));
    } catch (BackOffInterruptedException e) {
      throw new JudgeApiException("Interrupted while retrying Anthropic API call", null, false, e);
    }
    return toTransportResponse(response, model);
  }

  private AnthropicMessagesResponse post(AnthropicMessagesRequest request) {
    try {
      AnthropicMessagesResponse response =
          restClient
              .post()
              .uri(MESSAGES_PATH)
              .body(request)
              .retrieve()
              .body(AnthropicMessagesResponse.class);
      if (response == null) {
        throw new JudgeResponseException("Empty response from Anthropic API");
      }
      return response;
    } catch (RestClientResponseException e) {
      int status = e.getStatusCode().value();
      throw new JudgeApiException(
          "Anthropic API error: HTTP " + status + " " + e.getStatusText(), status, false, e);
    } catch (ResourceAccessException e) {
      throw JudgeApiException.connectionFailure(
          "Connection to Anthropic API failed: " + e.getMessage(), e);
    } catch (RestClientException e) {
      throw new JudgeApiException("Anthropic API call failed: " + e.getMessage(), null, false, e);
    }
  }

  private static TransportResponse toTransportResponse(
      AnthropicMessagesResponse response, String requestedModel) {
    if (response.content().isEmpty()) {
      throw new JudgeResponseException("Empty response from Anthropic API");
    }
    List<String> textBlocks = response.textBlocks();
    if (textBlocks.isEmpty()) {
      String blockTypes =
          String.join(
              ", ",
              response.content().stream()
                  .map(AnthropicMessagesResponse.ContentBlock::type)
                  .toList());
      throw new JudgeResponseException("Expected text response, got " + blockTypes);
    }

    String model =
        response.model() == null || response.model().isBlank() ? requestedModel : response.model();
    int inputTokens = response.usage() == null ? 0 : response.usage().inputTokens();
    int outputTokens = response.usage() == null ? 0 : response.usage().outputTokens();
    log.debug(
        "Anthropic call completed: model={}, in={}, out={}", model, inputTokens, outputTokens);

    return new TransportResponse(String.join("\n", textBlocks), inputTokens, outputTokens, model);
  }
}
