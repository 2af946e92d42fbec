package dev.jobmatcher.queue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of derived artifact a queue item recomputes.
 */
public enum RecomputeItemType {
    NORMALIZED_PROFILE("normalized_profile"),
    SEARCH_SPEC("search_spec"),
    PROFILE_EMBEDDING("profile_embedding"),
    JOB_SCORES("job_scores");

    private final String wireName;

    RecomputeItemType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static RecomputeItemType fromWire(String value) {
        for (RecomputeItemType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown recompute item type: " + value);
    }
}
