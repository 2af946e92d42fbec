package dev.jobmatcher.job;

import dev.jobmatcher.config.AiProperties;
import dev.jobmatcher.profile.NormalizedProfile;
import dev.jobmatcher.profile.ProfileEmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Takes a team's new postings to scored matches for one user: embed the profile, embed
 * postings that have no embedding yet, shortlist by similarity, enrich shortlisted postings
 * missing an enrichment for the current version, then rank the whole shortlist.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobMatchingPipeline {

    private final ProfileEmbeddingService profileEmbeddingService;
    private final JobEmbeddingService jobEmbeddingService;
    private final JobShortlistService shortlistService;
    private final JobEnrichmentService jobEnrichmentService;
    private final JobRankingService jobRankingService;
    private final JobPostingRepository jobPostingRepository;
    private final JobEnrichmentRepository enrichmentRepository;
    private final AiProperties aiProperties;

    /**
     * @param agentRunId run the score rows are attributed to
     */
    public Mono<MatchingOutcome> run(NormalizedProfile profile, String agentRunId) {
        log.info("Matching jobs for user {} v{} (run {})", profile.userId(), profile.profileVersion(), agentRunId);
        return profileEmbeddingService.embed(profile)
                .flatMap(profileEmbedding -> jobEmbeddingService.embedPending(profile.teamId())
                        .flatMap(embedded -> shortlistService.shortlist(profile.teamId(), profileEmbedding)
                                .flatMap(matches -> {
                                    if (matches.isEmpty()) {
                                        log.info("No jobs shortlisted for user {}", profile.userId());
                                        return Mono.just(MatchingOutcome.nothingShortlisted(embedded));
                                    }
                                    return enrichAndRank(profile, agentRunId, embedded, matches);
                                })));
    }

    private Mono<MatchingOutcome> enrichAndRank(NormalizedProfile profile, String agentRunId, int embedded,
            List<JobMatch> matches) {
        return loadInMatchOrder(matches)
                .flatMap(shortlisted -> unenriched(shortlisted)
                        .flatMap(jobEnrichmentService::enrich)
                        .flatMap(enriched -> jobRankingService.rank(profile, profile.preferences().tightness(),
                                        shortlisted, agentRunId)
                                .map(ranked -> new MatchingOutcome(embedded, matches.size(),
                                        enriched.results().size(), ranked.results().size()))))
                .doOnNext(outcome -> log.info("Matching for user {} done: {}", profile.userId(),
                        outcome.toOutputs()));
    }

    private Mono<List<JobPosting>> loadInMatchOrder(List<JobMatch> matches) {
        return Mono.fromCallable(() -> {
                    Map<String, JobPosting> byId = jobPostingRepository
                            .findAllById(matches.stream().map(JobMatch::jobId).toList()).stream()
                            .collect(Collectors.toMap(JobPosting::getId, Function.identity()));
                    return matches.stream()
                            .map(match -> byId.get(match.jobId()))
                            .filter(Objects::nonNull)
                            .toList();
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<List<JobPosting>> unenriched(List<JobPosting> jobs) {
        int version = aiProperties.getEnrichmentVersion();
        return Mono.fromCallable(() -> jobs.stream()
                        .filter(job -> !enrichmentRepository.existsByJobIdAndEnrichmentVersion(job.getId(), version))
                        .toList())
                .subscribeOn(Schedulers.boundedElastic());
    }
}
