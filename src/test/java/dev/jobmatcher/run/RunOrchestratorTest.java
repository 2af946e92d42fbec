package dev.jobmatcher.run;

import dev.jobmatcher.Fixtures;
import dev.jobmatcher.config.RunProperties;
import dev.jobmatcher.exception.TaskRunnerException;
import dev.jobmatcher.metrics.MatcherMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RunOrchestratorTest {

  private static final String RUN_ID = "run-1";

  @Mock
  private AgentRunStore store;

  @Mock
  private TaskRunner taskRunner;

  @Mock
  private MatcherMetrics metrics;

  @Captor
  private ArgumentCaptor<Map<String, Object>> payloadCaptor;

  private RunOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    orchestrator = new RunOrchestrator(store, taskRunner, new RunProperties(), metrics);
  }

  private static AgentRunView view(AgentRunStatus status, String triggerRunId) {
    return new AgentRunView(RUN_ID, Fixtures.TEAM_ID, "user-1", AgentType.JOB_SEARCH, status,
        Map.of("queries", "java"), status == AgentRunStatus.SUCCEEDED ? Map.<String, Object>of("jobs_found", 3) : null,
        status == AgentRunStatus.FAILED ? "boom" : null, triggerRunId, Fixtures.NOW,
        status.isTerminal() ? Fixtures.NOW : null, Fixtures.NOW);
  }

  private static RunRequest request() {
    return RunRequest.builder()
        .teamId(Fixtures.TEAM_ID)
        .userId("user-1")
        .agentType(AgentType.JOB_SEARCH)
        .taskName("linkedin-job-search")
        .inputs(Map.of("queries", "java"))
        .build();
  }

  @Nested
  @DisplayName("Start")
  class StartTests {

    @Test
    @DisplayName("Should persist, trigger and mark the run as running")
    void shouldStartRun() {
      // Arrange
      when(store.create(any())).thenReturn(view(AgentRunStatus.QUEUED, null));
      when(taskRunner.trigger(eq("linkedin-job-search"), anyMap()))
          .thenReturn(Mono.just(new TaskRunner.TaskHandle("trg-1")));
      when(store.markRunning(RUN_ID, "trg-1")).thenReturn(view(AgentRunStatus.RUNNING, "trg-1"));

      // Act & Assert
      StepVerifier.create(orchestrator.start(request()))
          .assertNext(run -> {
            assertThat(run.status()).isEqualTo(AgentRunStatus.RUNNING);
            assertThat(run.triggerRunId()).isEqualTo("trg-1");
          })
          .verifyComplete();

      verify(taskRunner).trigger(eq("linkedin-job-search"), payloadCaptor.capture());
      assertThat(payloadCaptor.getValue())
          .containsEntry("run_id", RUN_ID)
          .containsEntry("team_id", Fixtures.TEAM_ID)
          .containsEntry("user_id", "user-1")
          .containsEntry("queries", "java");
      verify(metrics).recordRunStarted("job_search");
    }

    @Test
    @DisplayName("Should mark the run failed and propagate when the trigger is refused")
    void shouldFailRunWhenTriggerFails() {
      // Arrange
      when(store.create(any())).thenReturn(view(AgentRunStatus.QUEUED, null));
      when(taskRunner.trigger(anyString(), anyMap()))
          .thenReturn(Mono.error(new TaskRunnerException("Trigger refused task")));
      when(store.fail(RUN_ID, "Trigger refused task")).thenReturn(view(AgentRunStatus.FAILED, null));

      // Act & Assert
      StepVerifier.create(orchestrator.start(request()))
          .expectError(TaskRunnerException.class)
          .verify();

      verify(store).fail(RUN_ID, "Trigger refused task");
      verify(store, never()).markRunning(anyString(), anyString());
      verify(metrics).recordRunFinished("job_search", "failed");
    }

    @Test
    @DisplayName("Should not fail a run the task runner already accepted")
    void shouldKeepTriggeredRunWhenHandOffWriteFails() {
      // Arrange
      when(store.create(any())).thenReturn(view(AgentRunStatus.QUEUED, null));
      when(taskRunner.trigger(anyString(), anyMap()))
          .thenReturn(Mono.just(new TaskRunner.TaskHandle("trg-1")));
      when(store.markRunning(RUN_ID, "trg-1")).thenThrow(new IllegalStateException("database is locked"));

      // Act & Assert
      StepVerifier.create(orchestrator.start(request()))
          .expectErrorMessage("database is locked")
          .verify();

      verify(store, never()).fail(anyString(), anyString());
      verify(metrics, never()).recordRunStarted(anyString());
    }

    @Test
    @DisplayName("Should mark an in-process run running without a hand-off")
    void shouldStartInProcess() {
      // Arrange
      when(store.create(any())).thenReturn(view(AgentRunStatus.QUEUED, null));
      when(store.markRunning(RUN_ID, null)).thenReturn(view(AgentRunStatus.RUNNING, null));

      // Act & Assert
      StepVerifier.create(orchestrator.startInProcess(request()))
          .assertNext(run -> {
            assertThat(run.status()).isEqualTo(AgentRunStatus.RUNNING);
            assertThat(run.triggerRunId()).isNull();
          })
          .verifyComplete();

      verifyNoInteractions(taskRunner);
      verify(metrics).recordRunStarted("job_search");
    }
  }

  @Nested
  @DisplayName("Refresh")
  class RefreshTests {

    @Test
    @DisplayName("Should apply a terminal snapshot from the task runner")
    void shouldApplyTerminalSnapshot() {
      TaskRunner.TaskRunSnapshot snapshot = new TaskRunner.TaskRunSnapshot(TaskRunner.TaskRunState.SUCCEEDED,
          Map.of("jobs_found", 3), null);
      when(store.find(RUN_ID)).thenReturn(view(AgentRunStatus.RUNNING, "trg-1"));
      when(taskRunner.retrieve("trg-1")).thenReturn(Mono.just(snapshot));
      when(store.applyTerminal(RUN_ID, snapshot)).thenReturn(view(AgentRunStatus.SUCCEEDED, "trg-1"));

      StepVerifier.create(orchestrator.refresh(RUN_ID))
          .assertNext(run -> assertThat(run.outputs()).containsEntry("jobs_found", 3))
          .verifyComplete();

      verify(metrics).recordRunFinished("job_search", "succeeded");
    }

    @Test
    @DisplayName("Should leave a running run untouched while the task runs")
    void shouldKeepRunningRun() {
      when(store.find(RUN_ID)).thenReturn(view(AgentRunStatus.RUNNING, "trg-1"));
      when(taskRunner.retrieve("trg-1")).thenReturn(Mono.just(
          new TaskRunner.TaskRunSnapshot(TaskRunner.TaskRunState.RUNNING, Map.of(), null)));

      StepVerifier.create(orchestrator.refresh(RUN_ID))
          .assertNext(run -> assertThat(run.status()).isEqualTo(AgentRunStatus.RUNNING))
          .verifyComplete();

      verify(store, never()).applyTerminal(anyString(), any());
    }

    @Test
    @DisplayName("Should not call the task runner for a terminal run")
    void shouldNotPollTerminalRun() {
      when(store.find(RUN_ID)).thenReturn(view(AgentRunStatus.FAILED, "trg-1"));

      StepVerifier.create(orchestrator.refresh(RUN_ID))
          .assertNext(run -> assertThat(run.error()).isEqualTo("boom"))
          .verifyComplete();

      verifyNoInteractions(taskRunner);
    }
  }

  @Nested
  @DisplayName("Await terminal")
  class AwaitTests {

    @Test
    @DisplayName("Should poll until the run finishes")
    void shouldPollUntilTerminal() {
      // Arrange
      TaskRunner.TaskRunSnapshot running = new TaskRunner.TaskRunSnapshot(TaskRunner.TaskRunState.RUNNING,
          Map.of(), null);
      TaskRunner.TaskRunSnapshot failed = new TaskRunner.TaskRunSnapshot(TaskRunner.TaskRunState.FAILED,
          Map.of(), "boom");
      when(store.find(RUN_ID)).thenReturn(view(AgentRunStatus.RUNNING, "trg-1"));
      when(taskRunner.retrieve("trg-1")).thenReturn(Mono.just(running), Mono.just(running), Mono.just(failed));
      when(store.applyTerminal(RUN_ID, failed)).thenReturn(view(AgentRunStatus.FAILED, "trg-1"));

      // Act & Assert
      StepVerifier.create(orchestrator.awaitTerminal(RUN_ID, Duration.ofMillis(10), Duration.ofSeconds(5)))
          .assertNext(result -> {
            assertThat(result.abandoned()).isFalse();
            assertThat(result.run().status()).isEqualTo(AgentRunStatus.FAILED);
          })
          .verifyComplete();

      verify(taskRunner, times(3)).retrieve("trg-1");
    }

    @Test
    @DisplayName("Should give up after the timeout and report the last known state")
    void shouldAbandonAfterTimeout() {
      // Arrange
      when(store.find(RUN_ID)).thenReturn(view(AgentRunStatus.RUNNING, "trg-1"));
      when(taskRunner.retrieve("trg-1")).thenReturn(Mono.just(
          new TaskRunner.TaskRunSnapshot(TaskRunner.TaskRunState.RUNNING, Map.of(), null)));

      // Act & Assert
      StepVerifier.create(orchestrator.awaitTerminal(RUN_ID, Duration.ofMillis(10), Duration.ofMillis(200)))
          .assertNext(result -> {
            assertThat(result.abandoned()).isTrue();
            assertThat(result.run().status()).isEqualTo(AgentRunStatus.RUNNING);
          })
          .verifyComplete();

      verify(store, never()).fail(anyString(), anyString());
    }
  }
}
