package dev.jobmatcher.run;

import java.time.Instant;
import java.util.Map;

/**
 * Read model returned by status reads.
 */
public record AgentRunView(
        String id,
        String teamId,
        String userId,
        AgentType agentType,
        AgentRunStatus status,
        Map<String, Object> inputs,
        Map<String, Object> outputs,
        String error,
        String triggerRunId,
        Instant startedAt,
        Instant finishedAt,
        Instant createdAt) {

    public static AgentRunView of(AgentRun run) {
        return new AgentRunView(run.getId(), run.getTeamId(), run.getUserId(), run.getAgentType(), run.getStatus(),
                run.getInputs(), run.getOutputs(), run.getErrorText(), run.getTriggerRunId(), run.getStartedAt(),
                run.getFinishedAt(), run.getCreatedAt());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
