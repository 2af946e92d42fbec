package dev.jobmatcher.run;

import dev.jobmatcher.Fixtures;
import dev.jobmatcher.exception.EntityNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@Import({AgentRunStore.class, AgentRunStoreTest.Config.class})
class AgentRunStoreTest {

    @TestConfiguration
    static class Config {

        @Bean
        Clock clock() {
            return Clock.fixed(Fixtures.NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private AgentRunStore store;

    private AgentRunView create(AgentType type) {
        return store.create(RunRequest.builder()
                .teamId(Fixtures.TEAM_ID)
                .userId("user-1")
                .agentType(type)
                .taskName("task")
                .inputs(Map.of("limit", 5))
                .build());
    }

    @Test
    @DisplayName("Should create a queued manual run with an id")
    void shouldCreateQueuedRun() {
        AgentRunView run = create(AgentType.JOB_SEARCH);

        assertThat(run.id()).isNotBlank();
        assertThat(run.status()).isEqualTo(AgentRunStatus.QUEUED);
        assertThat(run.inputs()).containsEntry("limit", 5);
        assertThat(store.find(run.id()).createdAt()).isEqualTo(Fixtures.NOW);
    }

    @Test
    @DisplayName("Should apply a successful snapshot once")
    void shouldApplyTerminalSnapshot() {
        AgentRunView run = create(AgentType.JOB_SEARCH);
        store.markRunning(run.id(), "trg-1");

        AgentRunView done = store.applyTerminal(run.id(), new TaskRunner.TaskRunSnapshot(
                TaskRunner.TaskRunState.SUCCEEDED, Map.of("jobs_found", 4), null));
        AgentRunView again = store.applyTerminal(run.id(), new TaskRunner.TaskRunSnapshot(
                TaskRunner.TaskRunState.FAILED, null, "late failure"));

        assertThat(done.status()).isEqualTo(AgentRunStatus.SUCCEEDED);
        assertThat(again.status()).isEqualTo(AgentRunStatus.SUCCEEDED);
        assertThat(again.error()).isNull();
    }

    @Test
    @DisplayName("Should return the newest run per team and type")
    void shouldFindLatestRun() {
        create(AgentType.JOB_SEARCH);
        AgentRunView enrichment = create(AgentType.JOB_ENRICHMENT);

        assertThat(store.latest(Fixtures.TEAM_ID, AgentType.JOB_ENRICHMENT))
                .hasValueSatisfying(run -> assertThat(run.id()).isEqualTo(enrichment.id()));
        assertThat(store.latest("other-team", AgentType.JOB_SEARCH)).isEmpty();
    }

    @Test
    @DisplayName("Should drop null input values when freezing inputs")
    void shouldDropNullInputs() {
        Map<String, Object> inputs = new HashMap<>();
        inputs.put("limit", 5);
        inputs.put("cursor", null);

        AgentRunView run = store.create(RunRequest.builder()
                .teamId(Fixtures.TEAM_ID)
                .agentType(AgentType.JOB_ENRICHMENT)
                .taskName("job-enrichment")
                .inputs(inputs)
                .build());

        assertThat(run.inputs()).containsOnlyKeys("limit");
    }

    @Test
    @DisplayName("Should leave a finished run untouched when failing it")
    void shouldIgnoreFailureOfFinishedRun() {
        AgentRunView run = create(AgentType.JOB_SEARCH);
        store.complete(run.id(), Map.of("jobs_found", 2));

        AgentRunView after = store.fail(run.id(), "trigger timed out");

        assertThat(after.status()).isEqualTo(AgentRunStatus.SUCCEEDED);
        assertThat(after.error()).isNull();
        assertThat(after.outputs()).containsEntry("jobs_found", 2);
    }

    @Test
    @DisplayName("Should keep a run finished by its callback before the hand-off was recorded")
    void shouldRecordLateHandOff() {
        AgentRunView run = create(AgentType.JOB_SEARCH);
        store.complete(run.id(), null);

        AgentRunView after = store.markRunning(run.id(), "trg-7");

        assertThat(after.status()).isEqualTo(AgentRunStatus.SUCCEEDED);
        assertThat(after.triggerRunId()).isEqualTo("trg-7");
        assertThat(after.outputs()).isNotNull().isEmpty();
    }

    @Test
    @DisplayName("Should fail for an unknown run")
    void shouldRejectUnknownRun() {
        assertThatThrownBy(() -> store.find("missing"))
                .isInstanceOf(EntityNotFoundException.class);
    }
}
