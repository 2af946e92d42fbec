package dev.jobmatcher.queue;

import reactor.core.publisher.Mono;

/**
 * Performs the recomputation for one item type.
 */
public interface RecomputeHandler {

    RecomputeItemType type();

    /**
     * Completes when the artifact has been recomputed; errors are recorded as a failed attempt.
     */
    Mono<Void> handle(RecomputeQueueItem item);
}
