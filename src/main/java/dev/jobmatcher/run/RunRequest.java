package dev.jobmatcher.run;

import lombok.Builder;

import java.util.Map;

@Builder
public record RunRequest(String teamId, String userId, AgentType agentType, RunTrigger trigger, String taskName,
        Map<String, Object> inputs) {
}
