package dev.jobmatcher.version;

import java.time.Instant;

/**
 * Any derived artifact stamped with the profile version it was computed from.
 */
public interface VersionedArtifact {

    String getUserId();

    int getProfileVersion();

    Instant getCreatedAt();
}
