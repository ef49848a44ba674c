package dev.ragjudge.judge.transport;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used by {@link AnthropicTransport}.
 *
 * <p>Base URL, API version and timeouts come from {@link AnthropicProperties}. The API key header
 * is only added when a key is configured; {@link AnthropicTransport#create} refuses to build a
 * transport without one.
 */
@Configuration
public class AnthropicConfig {

  /**
   * Creates the REST client targeting the Anthropic Messages API.
   *
   * @param builder Spring-provided builder with common defaults
   * @param properties connection settings
   * @return a named REST client bean for {@link AnthropicTransport}
   */
  @Bean
  public RestClient anthropicRestClient(
      RestClient.Builder builder, AnthropicProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

    RestClient.Builder configured =
        builder
            .baseUrl(properties.baseUrl())
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(AnthropicTransport.VERSION_HEADER, properties.apiVersion());
    if (properties.hasApiKey()) {
      configured.defaultHeader(AnthropicTransport.API_KEY_HEADER, properties.apiKey());
    }
    return configured.build();
  }
}
