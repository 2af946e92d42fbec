package dev.jobmatcher.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.jobmatcher.config.AiProperties;
import dev.jobmatcher.exception.GenerationCallException;
import dev.jobmatcher.exception.InvalidGenerationOutputException;
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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Embeddings over the OpenAI embeddings endpoint.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "openai")
public class OpenAiEmbeddingClient implements EmbeddingClient {

  private final WebClient webClient;
  private final String model;
  private final Duration requestTimeout;

  @Autowired
  public OpenAiEmbeddingClient(AiProperties properties) {
    this(properties.getOpenai().getApiKey(), properties.getOpenai().getBaseUrl(),
        properties.getOpenai().getEmbeddingModel(), properties.getRequestTimeout());
  }

  public OpenAiEmbeddingClient(String apiKey, String baseUrl, String model, Duration requestTimeout) {
    this.model = model;
    this.requestTimeout = requestTimeout;
    this.webClient = WebClient.builder()
        .baseUrl(Objects.requireNonNull(baseUrl))
        .defaultHeader("Authorization", "Bearer " + apiKey)
        .defaultHeader("Content-Type", "application/json")
        .build();
  }

  @Override
  public Mono<List<Double>> embed(String text) {
    return embedAll(List.of(text)).map(vectors -> vectors.get(0));
  }

  /**
   * Sends every text as one request; the response is reordered by its index field.
   */
  @Override
  public Mono<List<List<Double>>> embedAll(List<String> texts) {
    if (texts.isEmpty()) {
      return Mono.just(List.of());
    }
    return webClient.post()
        .uri("/embeddings")
        .bodyValue(new EmbeddingRequest(model, texts))
        .retrieve()
        .onStatus(HttpStatusCode::isError,
            clientResponse -> clientResponse.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(errorBody -> {
                  log.error("OpenAI embedding call failed with status {}: {}",
                      clientResponse.statusCode().value(), errorBody);
                  return Mono.error(new GenerationCallException(
                      "OpenAI embedding call failed with status " + clientResponse.statusCode().value()));
                }))
        .bodyToMono(EmbeddingResponse.class)
        .timeout(requestTimeout)
        .onErrorMap(TimeoutException.class,
            e -> new GenerationCallException("OpenAI embedding call exceeded its deadline of " + requestTimeout, e))
        .onErrorMap(WebClientRequestException.class,
            e -> new GenerationCallException("OpenAI embedding call could not be sent: " + e.getMessage(), e))
        .onErrorMap(WebClientResponseException.class,
            e -> new GenerationCallException("OpenAI embedding response could not be read: " + e.getMessage(), e))
        .onErrorMap(DecodingException.class,
            e -> new GenerationCallException("OpenAI embedding response could not be decoded: " + e.getMessage(), e))
        .map(response -> vectors(response, texts.size()));
  }

  private List<List<Double>> vectors(EmbeddingResponse response, int expected) {
    if (response.data() == null || response.data().size() != expected) {
      int actual = response.data() == null ? 0 : response.data().size();
      throw new InvalidGenerationOutputException("Embedding response had " + actual + " vectors for "
          + expected + " inputs", List.of("data: expected " + expected + " entries"));
    }
    List<List<Double>> vectors = new ArrayList<>(expected);
    response.data().stream()
        .sorted(Comparator.comparingInt(EmbeddingResponse.EmbeddingData::index))
        .forEach(data -> {
          if (data.embedding() == null || data.embedding().isEmpty()) {
            throw new InvalidGenerationOutputException("Embedding response had no vector at index " + data.index(),
                List.of("data[" + data.index() + "].embedding: empty"));
          }
          vectors.add(data.embedding());
        });
    return vectors;
  }

  @Override
  public String modelName() {
    return model;
  }

  record EmbeddingRequest(String model, List<String> input) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record EmbeddingResponse(List<EmbeddingData> data) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(int index, List<Double> embedding) {
    }
  }
}
