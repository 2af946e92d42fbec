package dev.jobmatcher.queue.handler;

import dev.jobmatcher.exception.EntityNotFoundException;
import dev.jobmatcher.job.JobPosting;
import dev.jobmatcher.job.JobPostingRepository;
import dev.jobmatcher.job.JobRankingService;
import dev.jobmatcher.profile.NormalizedProfileSource;
import dev.jobmatcher.queue.RecomputeItemType;
import dev.jobmatcher.queue.RecomputeQueueItem;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Re-scores one job for the profile version that triggered the item.
 */
@Component
public class JobScoresRecomputeHandler extends ProfileRecomputeHandler {

    private final JobPostingRepository jobPostingRepository;
    private final JobRankingService jobRankingService;

    public JobScoresRecomputeHandler(NormalizedProfileSource profileSource, JobPostingRepository jobPostingRepository,
            JobRankingService jobRankingService) {
        super(profileSource);
        this.jobPostingRepository = jobPostingRepository;
        this.jobRankingService = jobRankingService;
    }

    @Override
    public RecomputeItemType type() {
        return RecomputeItemType.JOB_SCORES;
    }

    @Override
    public Mono<Void> handle(RecomputeQueueItem item) {
        if (item.getItemId() == null) {
            return Mono.error(new IllegalArgumentException("job_scores item " + item.getId() + " has no job id"));
        }
        Mono<JobPosting> job = Mono.fromCallable(() -> jobPostingRepository.findById(item.getItemId())
                        .orElseThrow(() -> new EntityNotFoundException("Job", item.getItemId())))
                .subscribeOn(Schedulers.boundedElastic());

        return loadProfile(item)
                .zipWith(job)
                .flatMap(tuple -> jobRankingService.rank(tuple.getT1(), tuple.getT1().preferences().tightness(),
                        List.of(tuple.getT2()), null))
                .then();
    }
}
