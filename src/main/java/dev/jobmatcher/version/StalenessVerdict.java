package dev.jobmatcher.version;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of comparing an artifact's stamped version with the profile's current version.
 *
 * @param stale          true when the artifact was computed from an older profile
 * @param versionGap     how many versions behind, never negative
 * @param reason         human readable explanation, null when fresh
 */
public record StalenessVerdict(
        @JsonProperty("is_stale") boolean stale,
        @JsonProperty("data_version") int dataVersion,
        @JsonProperty("current_version") int currentVersion,
        @JsonProperty("version_gap") int versionGap,
        @JsonProperty("reason") String reason) {

    public boolean isFresh() {
        return !stale;
    }
}
