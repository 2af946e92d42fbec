package dev.jobmatcher.version;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What kind of profile edit caused a version bump. Recorded in the version history.
 */
public enum ProfileChangeType {
    SKILL_ADDED,
    SKILL_REMOVED,
    SKILL_UPDATED,
    EXPERIENCE_ADDED,
    EXPERIENCE_REMOVED,
    EXPERIENCE_UPDATED,
    EDUCATION_ADDED,
    EDUCATION_REMOVED,
    EDUCATION_UPDATED,
    PREFERENCES_UPDATED,
    PROFILE_INFO_UPDATED,
    BULK_UPDATE;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ProfileChangeType fromWire(String value) {
        for (ProfileChangeType type : values()) {
            if (type.getWireName().equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown profile change type: " + value);
    }
}
