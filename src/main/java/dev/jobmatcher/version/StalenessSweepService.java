package dev.jobmatcher.version;

import dev.jobmatcher.config.RecomputeProperties;
import dev.jobmatcher.job.JobScoreRepository;
import dev.jobmatcher.queue.EnqueueResult;
import dev.jobmatcher.queue.RecomputeItemType;
import dev.jobmatcher.queue.RecomputeQueueService;
import dev.jobmatcher.queue.RecomputeRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Schedules recomputation of everything derived from a profile after its version moves.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StalenessSweepService {

    static final int NORMALIZED_PROFILE_PRIORITY = 1;
    static final int SEARCH_SPEC_PRIORITY = 2;
    static final int PROFILE_EMBEDDING_PRIORITY = 3;
    static final int JOB_SCORES_PRIORITY = 5;

    private final RecomputeQueueService queueService;
    private final JobScoreRepository jobScoreRepository;
    private final RecomputeProperties properties;

    /**
     * Enqueue profile-level items for {@code currentVersion} plus one re-scoring item per job
     * whose newest score predates it.
     *
     * @return number of queue rows created (coalesced requests are not counted)
     */
    @Transactional
    public int enqueueRecompute(String teamId, String userId, int currentVersion) {
        int created = 0;
        created += enqueue(teamId, userId, RecomputeItemType.NORMALIZED_PROFILE, null, currentVersion,
                NORMALIZED_PROFILE_PRIORITY);
        created += enqueue(teamId, userId, RecomputeItemType.SEARCH_SPEC, null, currentVersion,
                SEARCH_SPEC_PRIORITY);
        created += enqueue(teamId, userId, RecomputeItemType.PROFILE_EMBEDDING, null, currentVersion,
                PROFILE_EMBEDDING_PRIORITY);

        List<String> staleJobIds = jobScoreRepository.findJobIdsWithStaleScores(userId, currentVersion,
                PageRequest.of(0, properties.getStaleScoreLimit()));
        for (String jobId : staleJobIds) {
            created += enqueue(teamId, userId, RecomputeItemType.JOB_SCORES, jobId, currentVersion,
                    JOB_SCORES_PRIORITY);
        }

        log.info("Staleness sweep for user {} v{}: {} items enqueued ({} stale job scores)", userId,
                currentVersion, created, staleJobIds.size());
        return created;
    }

    private int enqueue(String teamId, String userId, RecomputeItemType type, String itemId, int version,
            int priority) {
        EnqueueResult result = queueService.enqueue(RecomputeRequest.builder()
                .teamId(teamId)
                .userId(userId)
                .itemType(type)
                .itemId(itemId)
                .triggeredByVersion(version)
                .priority(priority)
                .build());
        return result.created() ? 1 : 0;
    }
}
