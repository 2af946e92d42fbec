package dev.jobmatcher.job;

import dev.jobmatcher.ai.BatchIdentityVerifier;
import dev.jobmatcher.ai.BatchOutcome;
import dev.jobmatcher.ai.JobEnhancer;
import dev.jobmatcher.ai.RankedJob;
import dev.jobmatcher.ai.RankingContext;
import dev.jobmatcher.config.AiProperties;
import dev.jobmatcher.exception.BatchIdentityMismatchException;
import dev.jobmatcher.exception.InvalidGenerationOutputException;
import dev.jobmatcher.metrics.MatcherMetrics;
import dev.jobmatcher.profile.NormalizedProfile;
import dev.jobmatcher.profile.UserContextBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores postings against a profile version and keeps every score row; readers only see
 * rows that match the current version and tightness.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRankingService {

    private static final String OPERATION = "rank";
    static final int MIN_TIGHTNESS = 1;
    static final int MAX_TIGHTNESS = 5;

    private final JobEnhancer jobEnhancer;
    private final JobScoreRepository jobScoreRepository;
    private final UserContextBuilder userContextBuilder;
    private final AiProperties aiProperties;
    private final MatcherMetrics metrics;
    private final Clock clock;

    /**
     * Rank postings for the profile in batches and store a score row per accepted result.
     *
     * @param agentRunId run that asked for the ranking, or null
     */
    public Mono<BatchOutcome<RankedJob>> rank(NormalizedProfile profile, int tightness, List<JobPosting> jobs,
            String agentRunId) {
        if (tightness < MIN_TIGHTNESS || tightness > MAX_TIGHTNESS) {
            return Mono.error(new IllegalArgumentException(
                    "Tightness must be between " + MIN_TIGHTNESS + " and " + MAX_TIGHTNESS + " but was " + tightness));
        }
        if (jobs.isEmpty()) {
            return Mono.just(BatchOutcome.empty());
        }

        RankingContext context = new RankingContext(profile, userContextBuilder.build(profile), tightness);
        log.info("Ranking {} jobs for user {} v{} (tightness {})", jobs.size(), profile.userId(),
                profile.profileVersion(), tightness);

        return Flux.defer(() -> Flux.fromIterable(partitionList(jobs, aiProperties.getRankBatchSize())))
                .concatMap(batch -> rankBatch(batch, context, agentRunId))
                .reduce(BatchOutcome.<RankedJob>empty(), BatchOutcome::merge);
    }

    /**
     * Newest score per job for the current version and tightness, best first.
     */
    public Mono<List<JobScore>> liveScores(String userId, int currentVersion, int tightness) {
        return Mono.fromCallable(() -> {
                    Map<String, JobScore> newestPerJob = new LinkedHashMap<>();
                    jobScoreRepository.findByUserIdAndProfileVersionAndTightnessOrderByCreatedAtDescIdDesc(
                                    userId, currentVersion, tightness)
                            .forEach(score -> newestPerJob.putIfAbsent(score.getJobId(), score));
                    return newestPerJob.values().stream()
                            .sorted((a, b) -> Double.compare(b.getScore(), a.getScore()))
                            .toList();
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<BatchOutcome<RankedJob>> rankBatch(List<JobPosting> batch, RankingContext context,
            String agentRunId) {
        List<String> ids = batch.stream().map(JobPosting::getId).toList();
        return jobEnhancer.rankBatch(batch, context)
                .map(entries -> BatchIdentityVerifier.reconcile(OPERATION, ids, entries, aiProperties.getBatchMode()))
                .doOnError(BatchIdentityMismatchException.class,
                        e -> metrics.recordBatchIdentityMismatch(OPERATION))
                .doOnError(InvalidGenerationOutputException.class,
                        e -> metrics.recordGenerationFailure(OPERATION))
                .flatMap(outcome -> store(outcome, context, agentRunId).thenReturn(outcome))
                .doOnNext(outcome -> {
                    if (!outcome.rejectedIds().isEmpty()) {
                        metrics.recordRejectedEntries(OPERATION, outcome.rejectedIds().size());
                    }
                });
    }

    private Mono<Void> store(BatchOutcome<RankedJob> outcome, RankingContext context, String agentRunId) {
        NormalizedProfile profile = context.profile();
        return Mono.fromRunnable(() -> jobScoreRepository.saveAll(outcome.results().stream()
                        .map(ranked -> JobScore.builder()
                                .jobId(ranked.jobId())
                                .teamId(profile.teamId())
                                .userId(profile.userId())
                                .profileVersion(profile.profileVersion())
                                .tightness(context.tightness())
                                .score(ranked.score())
                                .skillMatch(ranked.breakdown().skillMatch())
                                .budgetFit(ranked.breakdown().budgetFit())
                                .clientQuality(ranked.breakdown().clientQuality())
                                .scopeFit(ranked.breakdown().scopeFit())
                                .winProbability(ranked.breakdown().winProbability())
                                .reasoning(ranked.reasoning())
                                .agentRunId(agentRunId)
                                .createdAt(clock.instant())
                                .build())
                        .toList()))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private <T> List<List<T>> partitionList(List<T> list, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Batch size must be positive but was " + size);
        }
        List<List<T>> partitions = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            partitions.add(list.subList(i, Math.min(i + size, list.size())));
        }
        return partitions;
    }
}
