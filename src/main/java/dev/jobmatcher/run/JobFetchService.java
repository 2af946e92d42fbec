package dev.jobmatcher.run;

import dev.jobmatcher.cache.SearchSpecCache;
import dev.jobmatcher.config.RunProperties;
import dev.jobmatcher.exception.InvalidGenerationOutputException;
import dev.jobmatcher.profile.NormalizedProfile;
import dev.jobmatcher.profile.NormalizedProfileSource;
import dev.jobmatcher.spec.GeneratedSearchSpec;
import dev.jobmatcher.spec.SearchQueryBuilder;
import dev.jobmatcher.spec.SearchSpec;
import dev.jobmatcher.spec.SearchSpecService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for fetching jobs: turns a profile into search queries and starts the
 * background search run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobFetchService {

    private final NormalizedProfileSource profileSource;
    private final SearchSpecService searchSpecService;
    private final SearchQueryBuilder searchQueryBuilder;
    private final RunOrchestrator runOrchestrator;
    private final RunProperties properties;

    public Mono<AgentRunView> start(String teamId, String userId) {
        return profileSource.load(teamId, userId)
                .flatMap(profile -> resolveSpec(profile)
                        .flatMap(generated -> startSearch(profile, generated)));
    }

    /**
     * Starts an enrichment run over the team's unenriched postings.
     */
    public Mono<AgentRunView> startEnrichment(String teamId, int limit) {
        return runOrchestrator.start(RunRequest.builder()
                .teamId(teamId)
                .agentType(AgentType.JOB_ENRICHMENT)
                .trigger(RunTrigger.MANUAL)
                .taskName(properties.getJobEnrichmentTask())
                .inputs(Map.of("limit", limit))
                .build());
    }

    /**
     * Falls back to the newest spec of an earlier version when generation output is invalid.
     */
    private Mono<GeneratedSearchSpec> resolveSpec(NormalizedProfile profile) {
        return searchSpecService.getOrGenerate(profile)
                .onErrorResume(InvalidGenerationOutputException.class, e -> searchSpecService
                        .previousSpec(profile.userId(), profile.profileVersion())
                        .doOnNext(previous -> log.warn("Search spec generation failed for user {} v{}, "
                                        + "using spec from v{}: {}", profile.userId(), profile.profileVersion(),
                                previous.profileVersion(), e.getMessage()))
                        .map(previous -> new GeneratedSearchSpec(previous, true,
                                SearchSpecCache.cacheKey(previous.userId(), previous.profileVersion())))
                        .switchIfEmpty(Mono.error(e)));
    }

    private Mono<AgentRunView> startSearch(NormalizedProfile profile, GeneratedSearchSpec generated) {
        SearchSpec spec = generated.spec();
        List<String> queries = searchQueryBuilder.buildQueries(spec, properties.getMaxQueries());
        if (queries.isEmpty()) {
            return Mono.error(new IllegalStateException("Search spec for user " + profile.userId()
                    + " produced no queries"));
        }

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("queries", queries);
        inputs.put("profile_version", profile.profileVersion());
        inputs.put("search_spec_key", generated.cacheKey());
        inputs.put("max_results_per_platform", spec.maxResultsPerPlatform());
        log.info("Starting job search for user {} v{} with {} queries", profile.userId(), profile.profileVersion(),
                queries.size());

        return runOrchestrator.start(RunRequest.builder()
                .teamId(profile.teamId())
                .userId(profile.userId())
                .agentType(AgentType.JOB_SEARCH)
                .trigger(RunTrigger.MANUAL)
                .taskName(properties.getJobSearchTask())
                .inputs(inputs)
                .build());
    }
}
