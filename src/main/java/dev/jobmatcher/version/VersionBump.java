package dev.jobmatcher.version;

/**
 * Outcome of a successful version write.
 *
 * @param enqueued number of recompute items scheduled for the new version
 */
public record VersionBump(String userId, int fromVersion, int toVersion, ProfileChangeType changeType,
        int enqueued) {
}
