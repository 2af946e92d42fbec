package dev.jobmatcher.run;

import dev.jobmatcher.exception.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Transactional persistence of agent run state changes. Blocking; callers on reactive
 * paths offload to a bounded elastic scheduler.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentRunStore {

    private final AgentRunRepository repository;
    private final Clock clock;

    @Transactional
    public AgentRunView create(RunRequest request) {
        Instant now = clock.instant();
        AgentRun run = repository.save(AgentRun.builder()
                .teamId(request.teamId())
                .userId(request.userId())
                .agentType(request.agentType())
                .trigger(request.trigger() != null ? request.trigger() : RunTrigger.MANUAL)
                .status(AgentRunStatus.QUEUED)
                .inputs(frozenInputs(request.inputs()))
                .startedAt(now)
                .createdAt(now)
                .build());
        log.info("Created {} run {} for team {}", run.getAgentType().getWireName(), run.getId(), run.getTeamId());
        return AgentRunView.of(run);
    }

    @Transactional
    public AgentRunView markRunning(String runId, String triggerRunId) {
        AgentRun run = load(runId);
        if (run.isTerminal()) {
            run.attachTriggerRun(triggerRunId);
            log.info("Run {} already {} when hand-off {} was recorded", runId, run.getStatus().getWireName(),
                    triggerRunId);
            return AgentRunView.of(repository.save(run));
        }
        run.markRunning(triggerRunId);
        if (triggerRunId == null) {
            log.info("Run {} running in process", runId);
        } else {
            log.info("Run {} handed off as {}", runId, triggerRunId);
        }
        return AgentRunView.of(repository.save(run));
    }

    @Transactional
    public AgentRunView complete(String runId, Map<String, Object> outputs) {
        AgentRun run = load(runId);
        run.succeed(outputs, clock.instant());
        log.info("Run {} succeeded", runId);
        return AgentRunView.of(repository.save(run));
    }

    /**
     * Marks the run failed. A run that already reached a terminal state is returned as is.
     */
    @Transactional
    public AgentRunView fail(String runId, String error) {
        AgentRun run = load(runId);
        if (run.isTerminal()) {
            log.warn("Run {} already {}; ignoring failure: {}", runId, run.getStatus().getWireName(), error);
            return AgentRunView.of(run);
        }
        run.fail(error, clock.instant());
        log.warn("Run {} failed: {}", runId, error);
        return AgentRunView.of(repository.save(run));
    }

    /**
     * Applies a terminal snapshot read from the task runner. A run that is already terminal
     * is returned unchanged.
     */
    @Transactional
    public AgentRunView applyTerminal(String runId, TaskRunner.TaskRunSnapshot snapshot) {
        AgentRun run = load(runId);
        if (run.isTerminal() || !snapshot.isTerminal()) {
            return AgentRunView.of(run);
        }
        if (snapshot.state() == TaskRunner.TaskRunState.SUCCEEDED) {
            run.succeed(snapshot.output(), clock.instant());
            log.info("Run {} succeeded", runId);
        } else {
            run.fail(snapshot.error(), clock.instant());
            log.warn("Run {} failed: {}", runId, snapshot.error());
        }
        return AgentRunView.of(repository.save(run));
    }

    @Transactional(readOnly = true)
    public AgentRunView find(String runId) {
        return AgentRunView.of(load(runId));
    }

    @Transactional(readOnly = true)
    public Optional<AgentRunView> latest(String teamId, AgentType agentType) {
        return repository.findFirstByTeamIdAndAgentTypeOrderByCreatedAtDesc(teamId, agentType).map(AgentRunView::of);
    }

    private Map<String, Object> frozenInputs(Map<String, Object> inputs) {
        if (inputs == null) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        inputs.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    private AgentRun load(String runId) {
        return repository.findById(runId).orElseThrow(() -> new EntityNotFoundException("Agent run", runId));
    }
}
