package dev.jobmatcher.run;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * External task-execution substrate the orchestrator hands runs to.
 */
public interface TaskRunner {

    /**
     * Start a task. Errors with {@link dev.jobmatcher.exception.TaskRunnerException} when the
     * substrate refuses or cannot be reached.
     */
    Mono<TaskHandle> trigger(String taskName, Map<String, Object> payload);

    Mono<TaskRunSnapshot> retrieve(String taskRunId);

    record TaskHandle(String id) {
    }

    enum TaskRunState {
        RUNNING, SUCCEEDED, FAILED
    }

    record TaskRunSnapshot(TaskRunState state, Map<String, Object> output, String error) {

        public boolean isTerminal() {
            return state != TaskRunState.RUNNING;
        }
    }
}
