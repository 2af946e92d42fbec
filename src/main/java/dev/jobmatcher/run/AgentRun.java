package dev.jobmatcher.run;

import dev.jobmatcher.exception.IllegalRunTransitionException;
import dev.jobmatcher.persistence.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Record of one background agent run handed off to the task runner.
 * Inputs are frozen at creation; once succeeded or failed the run never changes again.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "agent_runs", indexes = {
        @Index(name = "idx_agent_runs_team_type", columnList = "teamId,agentType,createdAt")
})
public class AgentRun {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String teamId;

    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private AgentType agentType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RunTrigger trigger;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AgentRunStatus status;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 65535, updatable = false)
    private Map<String, Object> inputs;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 65535)
    private Map<String, Object> outputs;

    @Column(length = 4000)
    private String errorText;

    private String triggerRunId;

    private Instant startedAt;

    private Instant finishedAt;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    void assignId() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
    }

    public void markRunning(String triggerRunId) {
        requireStatus(AgentRunStatus.QUEUED, "mark running");
        this.status = AgentRunStatus.RUNNING;
        this.triggerRunId = triggerRunId;
    }

    public void succeed(Map<String, Object> outputs, Instant now) {
        requireNotTerminal("succeed");
        this.status = AgentRunStatus.SUCCEEDED;
        this.outputs = outputs != null ? outputs : Map.of();
        this.finishedAt = now;
    }

    public void fail(String error, Instant now) {
        requireNotTerminal("fail");
        this.status = AgentRunStatus.FAILED;
        this.errorText = error;
        this.finishedAt = now;
    }

    /**
     * Records the task runner id on a run whose callback finished it before the hand-off
     * was written. The terminal state is kept.
     */
    public void attachTriggerRun(String triggerRunId) {
        if (this.triggerRunId == null) {
            this.triggerRunId = triggerRunId;
        }
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private void requireStatus(AgentRunStatus expected, String action) {
        if (status != expected) {
            throw new IllegalRunTransitionException(String.format("Cannot %s run %s in status %s", action, id,
                    status.getWireName()));
        }
    }

    private void requireNotTerminal(String action) {
        if (isTerminal()) {
            throw new IllegalRunTransitionException(String.format("Cannot %s run %s: already %s", action, id,
                    status.getWireName()));
        }
    }
}
