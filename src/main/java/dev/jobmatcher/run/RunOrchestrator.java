package dev.jobmatcher.run;

import dev.jobmatcher.config.RunProperties;
import dev.jobmatcher.metrics.MatcherMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Hands agent runs off to the task runner and tracks them to a terminal state.
 * The orchestrator never executes the job logic itself.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunOrchestrator {

  private final AgentRunStore store;
  private final TaskRunner taskRunner;
  private final RunProperties properties;
  private final MatcherMetrics metrics;

  /**
   * Persists a queued run, triggers the task and records it as running. When the trigger
   * fails the run is marked failed and the error is propagated. Once the task runner has
   * accepted the run it is never marked failed here: a failure to record the hand-off is
   * propagated and the run is left for its callback or {@link #refresh} to finish.
   */
  public Mono<AgentRunView> start(RunRequest request) {
    return blocking(() -> store.create(request))
        .flatMap(run -> taskRunner.trigger(request.taskName(), payload(run))
            .onErrorResume(e -> failTrigger(run, e))
            .flatMap(handle -> recordHandOff(run, handle)))
        .doOnNext(started -> metrics.recordRunStarted(started.agentType().getWireName()));
  }

  /**
   * Persists a run and marks it running without a task runner hand-off, for work this
   * process executes itself and finishes through {@link #complete} or {@link #fail}.
   */
  public Mono<AgentRunView> startInProcess(RunRequest request) {
    Mono<AgentRunView> running = blocking(() -> store.markRunning(store.create(request).id(), null));
    return running.doOnNext(started -> metrics.recordRunStarted(started.agentType().getWireName()));
  }

  public Mono<AgentRunView> status(String runId) {
    return blocking(() -> store.find(runId));
  }

  public Mono<Optional<AgentRunView>> latest(String teamId, AgentType agentType) {
    return blocking(() -> store.latest(teamId, agentType));
  }

  /**
   * Reads the task runner once and applies a terminal state if it reports one.
   */
  public Mono<AgentRunView> refresh(String runId) {
    return status(runId).flatMap(run -> {
      if (run.isTerminal() || run.triggerRunId() == null) {
        return Mono.just(run);
      }
      return taskRunner.retrieve(run.triggerRunId())
          .flatMap(snapshot -> {
            if (!snapshot.isTerminal()) {
              return Mono.just(run);
            }
            Mono<AgentRunView> applied = blocking(() -> store.applyTerminal(runId, snapshot));
            return applied.doOnNext(this::recordFinished);
          });
    });
  }

  public Mono<AgentRunView> complete(String runId, Map<String, Object> outputs) {
    Mono<AgentRunView> completed = blocking(() -> store.complete(runId, outputs));
    return completed.doOnNext(this::recordFinished);
  }

  public Mono<AgentRunView> fail(String runId, String error) {
    Mono<AgentRunView> failed = blocking(() -> store.fail(runId, error));
    return failed.doOnNext(this::recordFinished);
  }

  public Mono<PollResult> awaitTerminal(String runId) {
    return awaitTerminal(runId, properties.getPollInterval(), properties.getPollTimeout());
  }

  /**
   * Polls until the run is terminal. On timeout the caller gets the last known state flagged
   * as abandoned; the run itself is not cancelled. Disposing the subscription stops polling.
   */
  public Mono<PollResult> awaitTerminal(String runId, Duration interval, Duration timeout) {
    return Flux.interval(Duration.ZERO, interval)
        .onBackpressureDrop()
        .concatMap(tick -> refresh(runId))
        .filter(AgentRunView::isTerminal)
        .next()
        .map(PollResult::finished)
        .timeout(timeout, Mono.defer(() -> {
          log.warn("Stopped waiting for run {} after {}", runId, timeout);
          return status(runId).map(PollResult::abandoned);
        }));
  }

  private Mono<TaskRunner.TaskHandle> failTrigger(AgentRunView run, Throwable e) {
    Mono<AgentRunView> failed = blocking(() -> store.fail(run.id(), describe(e)));
    return failed.doOnNext(this::recordFinished)
        .then(Mono.error(e));
  }

  private Mono<AgentRunView> recordHandOff(AgentRunView run, TaskRunner.TaskHandle handle) {
    Mono<AgentRunView> running = blocking(() -> store.markRunning(run.id(), handle.id()));
    return running.doOnError(e -> log.error("Run {} was handed off as {} but could not be marked running: {}",
        run.id(), handle.id(), describe(e)));
  }

  private Map<String, Object> payload(AgentRunView run) {
    Map<String, Object> payload = new HashMap<>(run.inputs());
    payload.put("run_id", run.id());
    payload.put("team_id", run.teamId());
    if (run.userId() != null) {
      payload.put("user_id", run.userId());
    }
    return payload;
  }

  private void recordFinished(AgentRunView run) {
    if (run.isTerminal()) {
      metrics.recordRunFinished(run.agentType().getWireName(), run.status().getWireName());
    }
  }

  private String describe(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  private <T> Mono<T> blocking(Callable<T> call) {
    return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
  }
}
