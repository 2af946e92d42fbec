package dev.jobmatcher.ai;

import dev.jobmatcher.job.JobPosting;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Batch enrichment and ranking of job postings.
 * Implementations return one entry per id they produced; matching output to input and
 * applying the batch mode is left to {@link BatchIdentityVerifier}.
 */
public interface JobEnhancer {

    /**
     * Enrich a batch of postings with seniority, summary and structured description.
     *
     * @param jobs postings to enrich, ids unique within the batch
     * @return Mono with the parsed entries; errors when the call as a whole fails
     */
    Mono<List<BatchEntry<EnrichedJob>>> enrichBatch(List<JobPosting> jobs);

    /**
     * Score a batch of postings against a candidate.
     *
     * @param jobs    postings to rank, ids unique within the batch
     * @param context candidate profile and rendered context
     * @return Mono with the parsed entries; errors when the call as a whole fails
     */
    Mono<List<BatchEntry<RankedJob>>> rankBatch(List<JobPosting> jobs, RankingContext context);

    /**
     * Check if results come from a language model rather than heuristics.
     */
    boolean isAiBacked();
}
