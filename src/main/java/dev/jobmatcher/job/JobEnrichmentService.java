package dev.jobmatcher.job;

import dev.jobmatcher.ai.BatchIdentityVerifier;
import dev.jobmatcher.ai.BatchOutcome;
import dev.jobmatcher.ai.EnrichedJob;
import dev.jobmatcher.ai.JobEnhancer;
import dev.jobmatcher.config.AiProperties;
import dev.jobmatcher.exception.BatchIdentityMismatchException;
import dev.jobmatcher.exception.InvalidGenerationOutputException;
import dev.jobmatcher.metrics.MatcherMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Enriches postings in fixed-size batches, one batch at a time, and stores the results
 * stamped with the current enrichment version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobEnrichmentService {

    private static final String OPERATION = "enrich";

    private final JobEnhancer jobEnhancer;
    private final JobEnrichmentRepository enrichmentRepository;
    private final JobPostingRepository jobPostingRepository;
    private final AiProperties aiProperties;
    private final MatcherMetrics metrics;
    private final Clock clock;

    /**
     * Enrich the given postings. A failed batch fails the whole call; batches completed
     * before it stay stored.
     *
     * @return accepted enrichments in input order plus ids rejected in best-effort mode
     */
    public Mono<BatchOutcome<EnrichedJob>> enrich(List<JobPosting> jobs) {
        if (jobs.isEmpty()) {
            return Mono.just(BatchOutcome.empty());
        }
        int batchSize = aiProperties.getEnrichBatchSize();
        log.info("Enriching {} jobs in batches of {} ({} mode)", jobs.size(), batchSize,
                aiProperties.getBatchMode());

        return Flux.defer(() -> Flux.fromIterable(partitionList(jobs, batchSize)))
                .concatMap(this::enrichBatch)
                .reduce(BatchOutcome.<EnrichedJob>empty(), BatchOutcome::merge)
                .doOnNext(outcome -> log.info("Enrichment finished: {} stored, {} rejected",
                        outcome.results().size(), outcome.rejectedIds().size()));
    }

    /**
     * Enrich up to {@code limit} stored postings that have no enrichment for the current
     * enrichment version.
     */
    public Mono<BatchOutcome<EnrichedJob>> enrichPending(int limit) {
        int version = aiProperties.getEnrichmentVersion();
        return Mono.fromCallable(() -> jobPostingRepository.findPendingEnrichment(version, PageRequest.of(0, limit)))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(pending -> log.info("Found {} jobs pending enrichment v{}", pending.size(), version))
                .flatMap(this::enrich);
    }

    private Mono<BatchOutcome<EnrichedJob>> enrichBatch(List<JobPosting> batch) {
        List<String> ids = batch.stream().map(JobPosting::getId).toList();
        return jobEnhancer.enrichBatch(batch)
                .map(entries -> BatchIdentityVerifier.reconcile(OPERATION, ids, entries, aiProperties.getBatchMode()))
                .doOnError(BatchIdentityMismatchException.class,
                        e -> metrics.recordBatchIdentityMismatch(OPERATION))
                .doOnError(InvalidGenerationOutputException.class,
                        e -> metrics.recordGenerationFailure(OPERATION))
                .flatMap(outcome -> store(outcome).thenReturn(outcome))
                .doOnNext(outcome -> {
                    if (!outcome.rejectedIds().isEmpty()) {
                        metrics.recordRejectedEntries(OPERATION, outcome.rejectedIds().size());
                    }
                });
    }

    private Mono<Void> store(BatchOutcome<EnrichedJob> outcome) {
        int version = aiProperties.getEnrichmentVersion();
        boolean aiGenerated = jobEnhancer.isAiBacked();
        return Mono.fromRunnable(() -> {
                    for (EnrichedJob enriched : outcome.results()) {
                        if (enrichmentRepository.existsByJobIdAndEnrichmentVersion(enriched.jobId(), version)) {
                            log.debug("Job {} already enriched at v{}", enriched.jobId(), version);
                            continue;
                        }
                        enrichmentRepository.save(JobEnrichment.builder()
                                .jobId(enriched.jobId())
                                .enrichmentVersion(version)
                                .seniority(enriched.seniority())
                                .summary(enriched.summary())
                                .descriptionMarkdown(enriched.descriptionMarkdown())
                                .aiGenerated(aiGenerated)
                                .createdAt(clock.instant())
                                .build());
                    }
                })
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
