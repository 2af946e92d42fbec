package dev.jobmatcher.run;

import dev.jobmatcher.exception.EntityNotFoundException;
import dev.jobmatcher.job.JobMatchingPipeline;
import dev.jobmatcher.profile.NormalizedProfileSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Executes job enrichment runs in this process. Pipeline errors end up on the run as a
 * failed status; the returned Mono only errors when the run itself cannot be written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnrichmentRunService {

    private final NormalizedProfileSource profileSource;
    private final JobMatchingPipeline pipeline;
    private final RunOrchestrator runOrchestrator;

    public Mono<AgentRunView> run(String teamId, String userId, RunTrigger trigger) {
        return runOrchestrator.startInProcess(RunRequest.builder()
                        .teamId(teamId)
                        .userId(userId)
                        .agentType(AgentType.JOB_ENRICHMENT)
                        .trigger(trigger)
                        .inputs(Map.of())
                        .build())
                .flatMap(this::execute);
    }

    private Mono<AgentRunView> execute(AgentRunView run) {
        return profileSource.load(run.teamId(), run.userId())
                .switchIfEmpty(Mono.error(() -> new EntityNotFoundException("Profile", run.userId())))
                .flatMap(profile -> pipeline.run(profile, run.id()))
                .flatMap(outcome -> runOrchestrator.complete(run.id(), outcome.toOutputs()))
                .onErrorResume(e -> {
                    String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    log.error("Enrichment run {} for user {} failed: {}", run.id(), run.userId(), error, e);
                    return runOrchestrator.fail(run.id(), error);
                });
    }
}
