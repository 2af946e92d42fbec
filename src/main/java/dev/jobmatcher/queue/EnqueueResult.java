package dev.jobmatcher.queue;

/**
 * @param created false when an equivalent pending item already existed and was returned instead
 */
public record EnqueueResult(RecomputeQueueItem item, boolean created) {
}
