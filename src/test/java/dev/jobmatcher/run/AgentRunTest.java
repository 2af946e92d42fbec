package dev.jobmatcher.run;

import dev.jobmatcher.Fixtures;
import dev.jobmatcher.exception.IllegalRunTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentRunTest {

    private AgentRun queued() {
        return AgentRun.builder()
                .id("run-1")
                .teamId(Fixtures.TEAM_ID)
                .agentType(AgentType.JOB_ENRICHMENT)
                .trigger(RunTrigger.MANUAL)
                .status(AgentRunStatus.QUEUED)
                .inputs(Map.of("limit", 50))
                .createdAt(Fixtures.NOW)
                .build();
    }

    @Test
    @DisplayName("Should move queued -> running -> succeeded")
    void shouldFollowLifecycle() {
        AgentRun run = queued();

        run.markRunning("trg-1");
        run.succeed(Map.of("enriched", 10), Fixtures.NOW);

        assertThat(run.getStatus()).isEqualTo(AgentRunStatus.SUCCEEDED);
        assertThat(run.getTriggerRunId()).isEqualTo("trg-1");
        assertThat(run.getFinishedAt()).isEqualTo(Fixtures.NOW);
        assertThat(run.isTerminal()).isTrue();
    }

    @Test
    @DisplayName("Should allow failing a queued run")
    void shouldFailQueuedRun() {
        AgentRun run = queued();

        run.fail("trigger unreachable", Fixtures.NOW);

        assertThat(run.getStatus()).isEqualTo(AgentRunStatus.FAILED);
        assertThat(run.getErrorText()).isEqualTo("trigger unreachable");
    }

    @Test
    @DisplayName("Should never change a terminal run")
    void shouldRejectChangesAfterTerminal() {
        AgentRun run = queued();
        run.fail("boom", Fixtures.NOW);

        assertThatThrownBy(() -> run.succeed(Map.of(), Fixtures.NOW))
                .isInstanceOf(IllegalRunTransitionException.class)
                .hasMessageContaining("already failed");
        assertThatThrownBy(() -> run.fail("again", Fixtures.NOW))
                .isInstanceOf(IllegalRunTransitionException.class);
        assertThatThrownBy(() -> run.markRunning("trg-2"))
                .isInstanceOf(IllegalRunTransitionException.class);
        assertThat(run.getErrorText()).isEqualTo("boom");
    }

    @Test
    @DisplayName("Should store empty outputs when a run succeeds without any")
    void shouldDefaultMissingOutputs() {
        AgentRun run = queued();

        run.succeed(null, Fixtures.NOW);

        assertThat(run.getOutputs()).isNotNull().isEmpty();
    }

    @Test
    @DisplayName("Should attach the trigger id to a run finished before hand-off")
    void shouldAttachTriggerRunToFinishedRun() {
        AgentRun run = queued();
        run.succeed(Map.of(), Fixtures.NOW);

        run.attachTriggerRun("trg-9");
        run.attachTriggerRun("trg-10");

        assertThat(run.getStatus()).isEqualTo(AgentRunStatus.SUCCEEDED);
        assertThat(run.getTriggerRunId()).isEqualTo("trg-9");
    }
}
