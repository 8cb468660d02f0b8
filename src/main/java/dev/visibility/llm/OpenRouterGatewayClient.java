package dev.visibility.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.visibility.config.LlmProperties;
import dev.visibility.config.RetryProperties;
import dev.visibility.metrics.VisibilityMetrics;
import dev.visibility.retry.ErrorContext;
import dev.visibility.retry.RetryConfig;
import dev.visibility.retry.RetryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Gateway client for the OpenRouter chat-completions API.
 * OpenRouter fronts many vendors (OpenAI, Anthropic, Google) behind one
 * OpenAI-compatible endpoint, so every configured model goes through here.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.llm.provider", havingValue = "openrouter")
public class OpenRouterGatewayClient extends AbstractLlmGatewayClient {

  private final WebClient webClient;
  private final RetryExecutor retryExecutor;
  private final RetryConfig retryConfig;
  private final Duration requestTimeout;

  public OpenRouterGatewayClient(
      LlmProperties properties,
      ResponseCache cache,
      VisibilityMetrics metrics,
      RetryExecutor retryExecutor,
      RetryProperties retryProperties) {
    super(properties, cache, metrics);
    this.retryExecutor = retryExecutor;
    this.retryConfig = retryProperties.forOperation(RetryProperties.LLM);
    this.requestTimeout = properties.getRequestTimeout();
    this.webClient = WebClient.builder()
        .baseUrl(Objects.requireNonNull(properties.getBaseUrl()))
        .defaultHeader("Authorization", "Bearer " + properties.getApiKey())
        .defaultHeader("Content-Type", "application/json")
        .defaultHeader("HTTP-Referer", properties.getReferer())
        .defaultHeader("X-Title", properties.getTitle())
        .build();

    if (!isEnabled()) {
      log.warn("OpenRouter API key is missing! Every LLM query will fail with an authentication error.");
    } else {
      log.info("OpenRouter gateway enabled for models: {}", properties.getModels());
    }
  }

  @Override
  protected Mono<LlmResponse> execute(String model, String prompt, QueryOptions options) {
    if (!isEnabled()) {
      return Mono.error(LlmGatewayException.missingApiKey(model));
    }

    ChatRequest request = new ChatRequest(model, List.of(new Message("user", prompt)),
        temperature(options), maxTokens(options));
    ErrorContext context = ErrorContext.of("llm.query").withMetadata(Map.of("model", model));

    return retryExecutor.withRetry(() -> send(request), context, retryConfig);
  }

  private Mono<LlmResponse> send(ChatRequest request) {
    String model = request.model();
    return webClient.post()
        .uri("/chat/completions")
        .bodyValue(request)
        .retrieve()
        .onStatus(HttpStatusCode::isError,
            clientResponse -> clientResponse.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> LlmGatewayException.fromStatus(clientResponse.statusCode().value(), body, model)))
        .bodyToMono(ChatResponse.class)
        .timeout(requestTimeout)
        .onErrorMap(TimeoutException.class, e -> LlmGatewayException.timeout(model, requestTimeout))
        .onErrorMap(WebClientRequestException.class, e -> LlmGatewayException.network(model, e))
        .flatMap(response -> toResponse(response, model));
  }

  private Mono<LlmResponse> toResponse(ChatResponse response, String requestedModel) {
    if (response == null || response.choices() == null || response.choices().isEmpty()) {
      return Mono.error(LlmGatewayException.invalidResponse(requestedModel, "no choices returned"));
    }
    Message message = response.choices().get(0).message();
    String content = message != null && message.content() != null ? message.content() : "";
    int tokens = response.usage() != null ? response.usage().totalTokens() : 0;
    String model = response.model() != null ? response.model() : requestedModel;
    return Mono.just(new LlmResponse(content, tokens, model, false, 0));
  }

  @Override
  public boolean isEnabled() {
    String apiKey = properties.getApiKey();
    return apiKey != null && !apiKey.isBlank();
  }

  // OpenAI compatible DTOs
  record ChatRequest(
      String model,
      List<Message> messages,
      double temperature,
      @JsonProperty("max_tokens") int maxTokens) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Message(String role, String content) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ChatResponse(String model, List<Choice> choices, Usage usage) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Usage(@JsonProperty("total_tokens") int totalTokens) {
    }
  }
}
