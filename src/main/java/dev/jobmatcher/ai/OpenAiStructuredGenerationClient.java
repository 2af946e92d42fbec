package dev.jobmatcher.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatcher.config.AiProperties;
import dev.jobmatcher.exception.GenerationCallException;
import dev.jobmatcher.exception.InvalidGenerationOutputException;
import dev.jobmatcher.metrics.MatcherMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Structured generation over the OpenAI chat completions API with
 * {@code response_format: json_schema} in strict mode.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "openai")
public class OpenAiStructuredGenerationClient implements StructuredGenerationClient {

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final MatcherMetrics metrics;
  private final String defaultModel;
  private final Duration requestTimeout;

  @Autowired
  public OpenAiStructuredGenerationClient(AiProperties properties, ObjectMapper objectMapper, MatcherMetrics metrics) {
    this(properties.getOpenai().getApiKey(), properties.getOpenai().getBaseUrl(), properties.getOpenai().getModel(),
        properties.getRequestTimeout(), objectMapper, metrics);
  }

  public OpenAiStructuredGenerationClient(String apiKey, String baseUrl, String defaultModel, Duration requestTimeout,
      ObjectMapper objectMapper, MatcherMetrics metrics) {
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.defaultModel = defaultModel;
    this.requestTimeout = requestTimeout;
    this.webClient = WebClient.builder()
        .baseUrl(Objects.requireNonNull(baseUrl))
        .defaultHeader("Authorization", "Bearer " + apiKey)
        .defaultHeader("Content-Type", "application/json")
        .build();

    if (apiKey == null || apiKey.isBlank()) {
      log.warn("OpenAI API Key is missing! Structured generation calls will fail.");
    } else {
      log.info("OpenAI structured generation enabled with model: {}", defaultModel);
    }
  }

  @Override
  public Mono<JsonNode> generate(GenerationRequest request) {
    ChatRequest body = new ChatRequest(
        request.model() != null ? request.model() : defaultModel,
        List.of(new Message("system", request.instructions()), new Message("user", request.input())),
        new ResponseFormat("json_schema", new JsonSchemaFormat(request.schemaName(), true, request.schema())));

    return Mono.defer(() -> {
      long started = System.nanoTime();
      return webClient.post()
          .uri("/chat/completions")
          .bodyValue(body)
          .retrieve()
          .onStatus(HttpStatusCode::isError,
              clientResponse -> clientResponse.bodyToMono(String.class)
                  .defaultIfEmpty("")
                  .flatMap(errorBody -> {
                    log.error("OpenAI {} call failed with status {}: {}", request.operation(),
                        clientResponse.statusCode().value(), errorBody);
                    return Mono.error(new GenerationCallException(String.format("OpenAI %s call failed with status %d",
                        request.operation(), clientResponse.statusCode().value())));
                  }))
          .bodyToMono(ChatResponse.class)
          .timeout(requestTimeout)
          .onErrorMap(TimeoutException.class, e -> new GenerationCallException(
              String.format("OpenAI %s call exceeded its deadline of %s", request.operation(), requestTimeout), e))
          .onErrorMap(WebClientRequestException.class, e -> new GenerationCallException(
              String.format("OpenAI %s call could not be sent: %s", request.operation(), e.getMessage()), e))
          .onErrorMap(WebClientResponseException.class, e -> new GenerationCallException(
              String.format("OpenAI %s response could not be read: %s", request.operation(), e.getMessage()), e))
          .onErrorMap(DecodingException.class, e -> new GenerationCallException(
              String.format("OpenAI %s response could not be decoded: %s", request.operation(), e.getMessage()), e))
          .map(response -> parseContent(request.operation(), response))
          .doFinally(signal -> metrics.recordGenerationLatency(request.operation(),
              Duration.ofNanos(System.nanoTime() - started)));
    });
  }

  private JsonNode parseContent(String operation, ChatResponse response) {
    if (response == null || response.choices() == null || response.choices().isEmpty()) {
      throw new InvalidGenerationOutputException(operation + " returned no choices", List.of("choices: empty"));
    }
    ResponseMessage message = response.choices().get(0).message();
    if (message == null) {
      throw new InvalidGenerationOutputException(operation + " returned no message", List.of("message: missing"));
    }
    if (message.refusal() != null && !message.refusal().isBlank()) {
      throw new InvalidGenerationOutputException(operation + " was refused", List.of("refusal: " + message.refusal()));
    }
    if (message.content() == null || message.content().isBlank()) {
      throw new InvalidGenerationOutputException(operation + " returned empty content", List.of("content: empty"));
    }
    try {
      return objectMapper.readTree(message.content());
    } catch (JsonProcessingException e) {
      throw new InvalidGenerationOutputException(operation + " returned content that is not JSON", e);
    }
  }

  // OpenAI chat completion DTOs
  record ChatRequest(String model, List<Message> messages,
      @JsonProperty("response_format") ResponseFormat responseFormat) {
  }

  record Message(String role, String content) {
  }

  record ResponseFormat(String type, @JsonProperty("json_schema") JsonSchemaFormat jsonSchema) {
  }

  record JsonSchemaFormat(String name, boolean strict, JsonNode schema) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ChatResponse(List<Choice> choices) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(ResponseMessage message) {
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ResponseMessage(String role, String content, String refusal) {
  }
}
