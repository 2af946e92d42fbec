package dev.jobmatcher.queue;

import lombok.Builder;

/**
 * Request to enqueue recomputation of one artifact.
 *
 * @param itemId   job id for job scores, null otherwise
 * @param priority 1 (highest) to 10 (lowest), null for the configured default
 */
@Builder
public record RecomputeRequest(
        String teamId,
        String userId,
        RecomputeItemType itemType,
        String itemId,
        int triggeredByVersion,
        Integer priority) {
}
