package dev.jobmatcher.run;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatcher.config.RunProperties;
import dev.jobmatcher.exception.TaskRunnerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * {@link TaskRunner} over the trigger.dev REST API.
 */
@Slf4j
@Component
public class TriggerDevTaskRunner implements TaskRunner {

  private static final Set<String> FAILED_STATUSES = Set.of(
      "FAILED", "CRASHED", "CANCELED", "SYSTEM_FAILURE", "TIMED_OUT", "EXPIRED", "INTERRUPTED");
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final Duration requestTimeout;

  @Autowired
  public TriggerDevTaskRunner(RunProperties properties, ObjectMapper objectMapper) {
    this(properties.getTrigger().getBaseUrl(), properties.getTrigger().getSecretKey(),
        properties.getTrigger().getRequestTimeout(), objectMapper);
  }

  public TriggerDevTaskRunner(String baseUrl, String secretKey, Duration requestTimeout, ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.requestTimeout = requestTimeout;
    this.webClient = WebClient.builder()
        .baseUrl(Objects.requireNonNull(baseUrl))
        .defaultHeader("Authorization", "Bearer " + secretKey)
        .defaultHeader("Content-Type", "application/json")
        .build();

    if (secretKey == null || secretKey.isBlank()) {
      log.warn("trigger.dev secret key is missing! Background runs cannot be started.");
    }
  }

  @Override
  public Mono<TaskHandle> trigger(String taskName, Map<String, Object> payload) {
    return webClient.post()
        .uri("/api/v1/tasks/{task}/trigger", taskName)
        .bodyValue(Map.of("payload", payload))
        .retrieve()
        .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .flatMap(body -> {
              log.error("trigger.dev refused task {} with status {}: {}", taskName, response.statusCode().value(),
                  body);
              return Mono.error(new TaskRunnerException(String.format("Triggering task %s failed with status %d",
                  taskName, response.statusCode().value())));
            }))
        .bodyToMono(TriggerResponse.class)
        .timeout(requestTimeout)
        .onErrorMap(e -> !(e instanceof TaskRunnerException), e -> wrap("Triggering task " + taskName, e))
        .map(response -> {
          if (response.id() == null || response.id().isBlank()) {
            throw new TaskRunnerException("trigger.dev returned no run id for task " + taskName);
          }
          log.info("Triggered task {} as run {}", taskName, response.id());
          return new TaskHandle(response.id());
        });
  }

  @Override
  public Mono<TaskRunSnapshot> retrieve(String taskRunId) {
    return webClient.get()
        .uri("/api/v3/runs/{id}", taskRunId)
        .retrieve()
        .onStatus(HttpStatusCode::isError, response -> Mono.error(new TaskRunnerException(
            String.format("Reading run %s failed with status %d", taskRunId, response.statusCode().value()))))
        .bodyToMono(RunResponse.class)
        .timeout(requestTimeout)
        .onErrorMap(e -> !(e instanceof TaskRunnerException), e -> wrap("Reading run " + taskRunId, e))
        .map(this::toSnapshot);
  }

  TaskRunSnapshot toSnapshot(RunResponse response) {
    String status = response.status() != null ? response.status() : "";
    if ("COMPLETED".equals(status)) {
      return new TaskRunSnapshot(TaskRunState.SUCCEEDED, toOutput(response.output()), null);
    }
    if (FAILED_STATUSES.contains(status)) {
      String error = response.error() != null && response.error().message() != null
          ? response.error().message()
          : "Run ended with status " + status;
      return new TaskRunSnapshot(TaskRunState.FAILED, null, error);
    }
    log.debug("Run {} still in status {}", response.id(), status);
    return new TaskRunSnapshot(TaskRunState.RUNNING, null, null);
  }

  private Map<String, Object> toOutput(JsonNode output) {
    if (output == null || output.isNull() || output.isMissingNode()) {
      return Map.of();
    }
    if (output.isObject()) {
      return objectMapper.convertValue(output, MAP_TYPE);
    }
    return Map.of("result", objectMapper.convertValue(output, Object.class));
  }

  private TaskRunnerException wrap(String action, Throwable e) {
    if (e instanceof TimeoutException) {
      return new TaskRunnerException(action + " exceeded its deadline of " + requestTimeout, e);
    }
    if (e instanceof WebClientRequestException) {
      return new TaskRunnerException(action + " could not be sent: " + e.getMessage(), e);
    }
    return new TaskRunnerException(action + " failed: " + e.getMessage(), e);
  }

  // trigger.dev DTOs
  @JsonIgnoreProperties(ignoreUnknown = true)
  record TriggerResponse(String id) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record RunResponse(String id, String status, JsonNode output, RunError error) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record RunError(String message) {
  }
}
