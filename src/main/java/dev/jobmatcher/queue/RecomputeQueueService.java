package dev.jobmatcher.queue;

import dev.jobmatcher.config.RecomputeProperties;
import dev.jobmatcher.exception.EntityNotFoundException;
import dev.jobmatcher.metrics.MatcherMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable backlog of recomputation work with coalescing, atomic claiming and bounded retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecomputeQueueService {

    static final int CLAIM_CANDIDATES = 10;

    private final RecomputeQueueRepository repository;
    private final RecomputeProperties properties;
    private final MatcherMetrics metrics;
    private final Clock clock;

    /**
     * Enqueue a recompute item. A pending item for the same user, type, item id and trigger
     * version is returned instead of inserting a duplicate.
     */
    @Transactional
    public EnqueueResult enqueue(RecomputeRequest request) {
        int priority = request.priority() != null ? request.priority() : properties.getDefaultPriority();
        if (priority < RecomputeQueueItem.HIGHEST_PRIORITY || priority > RecomputeQueueItem.LOWEST_PRIORITY) {
            throw new IllegalArgumentException("Priority must be between 1 and 10 but was " + priority);
        }

        Optional<RecomputeQueueItem> existing = repository
                .findFirstByUserIdAndItemTypeAndItemIdAndTriggeredByVersionAndStatus(request.userId(),
                        request.itemType(), request.itemId(), request.triggeredByVersion(), RecomputeStatus.PENDING);
        if (existing.isPresent()) {
            log.debug("Coalesced {} for user {} v{} into item {}", request.itemType().getWireName(), request.userId(),
                    request.triggeredByVersion(), existing.get().getId());
            return new EnqueueResult(existing.get(), false);
        }

        RecomputeQueueItem item = repository.save(RecomputeQueueItem.builder()
                .teamId(request.teamId())
                .userId(request.userId())
                .itemType(request.itemType())
                .itemId(request.itemId())
                .triggeredByVersion(request.triggeredByVersion())
                .priority(priority)
                .status(RecomputeStatus.PENDING)
                .retryCount(0)
                .maxRetries(properties.getMaxRetries())
                .createdAt(clock.instant())
                .build());
        metrics.recordEnqueued();
        log.info("Enqueued {} item {} for user {} v{} (priority {})", item.getItemType().getWireName(), item.getId(),
                item.getUserId(), item.getTriggeredByVersion(), item.getPriority());
        return new EnqueueResult(item, true);
    }

    /**
     * Claim the next pending item for a worker. Each candidate is claimed with a conditional
     * update, so two workers can never both take the same item; a lost race moves on to the
     * next candidate.
     */
    @Transactional
    public Optional<RecomputeQueueItem> claimNext(String workerId) {
        List<RecomputeQueueItem> candidates = repository.findByStatusOrderByPriorityAscCreatedAtAscIdAsc(
                RecomputeStatus.PENDING, PageRequest.of(0, CLAIM_CANDIDATES));

        Instant now = clock.instant();
        for (RecomputeQueueItem candidate : candidates) {
            int updated = repository.claim(candidate.getId(), workerId, now, RecomputeStatus.PENDING,
                    RecomputeStatus.PROCESSING);
            if (updated == 1) {
                metrics.recordClaimed();
                log.debug("Worker {} claimed item {}", workerId, candidate.getId());
                return repository.findById(candidate.getId());
            }
            log.debug("Item {} was claimed by another worker", candidate.getId());
        }
        return Optional.empty();
    }

    @Transactional
    public RecomputeQueueItem complete(Long id) {
        RecomputeQueueItem item = load(id);
        item.complete(clock.instant());
        metrics.recordCompleted();
        log.info("Completed {} item {} for user {} v{}", item.getItemType().getWireName(), id, item.getUserId(),
                item.getTriggeredByVersion());
        return repository.save(item);
    }

    /**
     * Record a failed attempt. The item goes back to pending while retries remain and stays
     * failed once they are spent.
     */
    @Transactional
    public RecomputeQueueItem fail(Long id, String error) {
        RecomputeQueueItem item = load(id);
        item.fail(error, clock.instant());
        metrics.recordFailed();

        if (item.canRetry()) {
            item.requeue();
            log.warn("Item {} failed (attempt {}/{}), re-queued: {}", id, item.getRetryCount(), item.getMaxRetries(),
                    error);
        } else {
            log.error("Item {} failed permanently after {} attempts: {}", id, item.getRetryCount(), error);
        }
        return repository.save(item);
    }

    @Transactional(readOnly = true)
    public boolean isSuperseded(RecomputeQueueItem item) {
        return repository.existsByUserIdAndItemTypeAndItemIdAndTriggeredByVersionGreaterThanAndStatusNot(
                item.getUserId(), item.getItemType(), item.getItemId(), item.getTriggeredByVersion(),
                RecomputeStatus.FAILED);
    }

    @Transactional(readOnly = true)
    public QueueStats stats() {
        return new QueueStats(
                repository.countByStatus(RecomputeStatus.PENDING),
                repository.countByStatus(RecomputeStatus.PROCESSING),
                repository.countByStatus(RecomputeStatus.COMPLETED),
                repository.countByStatus(RecomputeStatus.FAILED));
    }

    private RecomputeQueueItem load(Long id) {
        return repository.findById(id).orElseThrow(() -> new EntityNotFoundException("Recompute queue item", id));
    }
}
